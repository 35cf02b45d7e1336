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


package org.fireflyframework.eventbridge.routing;

import org.fireflyframework.eventbridge.core.exception.RoutingException;

/**
 * NATS-style subject matching.
 *
 * <p>Subjects and patterns are split on {@code .}. {@code *} matches exactly one token;
 * {@code >} is only legal as the last token and matches one or more trailing tokens, so
 * {@code event.graph.>} matches {@code event.graph.node} but not {@code event.graph}.
 * Wildcards occupy whole tokens.
 */
public final class SubjectMatcher {

    public static final String SINGLE = "*";
    public static final String TAIL = ">";

    private SubjectMatcher() {}

    public static boolean matches(String subject, String pattern) {
        String[] subjectTokens = tokens(subject);
        String[] patternTokens = tokens(pattern);
        int last = patternTokens.length - 1;

        if (TAIL.equals(patternTokens[last])) {
            if (subjectTokens.length <= last) {
                return false;
            }
            return prefixMatches(subjectTokens, patternTokens, last);
        }
        return subjectTokens.length == patternTokens.length
                && prefixMatches(subjectTokens, patternTokens, patternTokens.length);
    }

    /**
     * Rejects patterns with empty tokens, partial-token wildcards or a non-final {@code >}.
     *
     * @throws RoutingException when the pattern is malformed
     */
    public static void validatePattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new RoutingException("Subject pattern must not be blank");
        }
        String[] patternTokens = tokens(pattern);
        for (int i = 0; i < patternTokens.length; i++) {
            String token = patternTokens[i];
            if (token.isEmpty()) {
                throw new RoutingException("Subject pattern '" + pattern + "' contains an empty token");
            }
            if (TAIL.equals(token) && i != patternTokens.length - 1) {
                throw new RoutingException("Wildcard '>' must be the last token of '" + pattern + "'");
            }
            boolean wildcard = SINGLE.equals(token) || TAIL.equals(token);
            if (!wildcard && (token.contains(SINGLE) || token.contains(TAIL))) {
                throw new RoutingException("Partial-token wildcard in '" + pattern + "' is not supported");
            }
        }
    }

    private static boolean prefixMatches(String[] subjectTokens, String[] patternTokens, int length) {
        for (int i = 0; i < length; i++) {
            if (!SINGLE.equals(patternTokens[i]) && !patternTokens[i].equals(subjectTokens[i])) {
                return false;
            }
        }
        return true;
    }

    private static String[] tokens(String value) {
        return value.split("\\.", -1);
    }
}
