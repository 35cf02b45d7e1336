/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.eventbridge.unit.routing;

import org.fireflyframework.eventbridge.core.exception.RoutingException;
import org.fireflyframework.eventbridge.routing.SubjectMatcher;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubjectMatcherTest {

    @ParameterizedTest(name = "{0} ~ {1} -> {2}")
    @CsvSource({
            "event.graph.node,              event.graph.node,         true",
            "event.graph.node,              event.*.node,             true",
            "event.graph.node,              event.graph.edge,         false",
            "event.graph,                   event.graph.node,         false",
            "event.graph.created,           event.graph.created,      true",
            "event.graph.created,           event.graph.deleted,      false",
            "event.graph.created,           event.graph.*,            true",
            "event.graph.node.added,        event.graph.*,            false",
            "event.graph.node.added,        event.graph.*.added,      true",
            "event.graph.edge.added,        event.graph.*.added,      true",
            "event.graph.node.removed,      event.graph.*.added,      false",
            "event.graph.node.added,        event.graph.>,            true",
            "event.graph.created,           event.graph.>,            true",
            "event.graph,                   event.graph.>,            false",
            "event.workflow.started,        event.graph.>,            false",
            "event.workflow.started,        event.>,                  true",
            "event.workflow.started,        >,                        true",
            "event.workflow.started,        *.workflow.>,             true",
            "event.graph.node.added,        *.*.*.*,                  true",
            "event.graph.node,              *.*.*.*,                  false",
            "event.graph.created,           event.graph.created.more, false",
            "event.graph.created.more,      event.graph.created,      false"
    })
    void matchesSubjectAgainstPattern(String subject, String pattern, boolean expected) {
        assertThat(SubjectMatcher.matches(subject, pattern)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"event.graph.>", "event.*.created", ">", "*", "event.workflow.step_completed"})
    void acceptsWellFormedPatterns(String pattern) {
        assertThatCode(() -> SubjectMatcher.validatePattern(pattern)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "event..created", "event.graph.", ".event", "event.>.created", "event.gr*", "event.>x"})
    void rejectsMalformedPatterns(String pattern) {
        assertThatThrownBy(() -> SubjectMatcher.validatePattern(pattern))
                .isInstanceOf(RoutingException.class);
    }
}
