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


package org.fireflyframework.eventbridge.workflow.service;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.core.exception.UnroutedEventsException;
import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.core.model.CommandEnvelope;
import org.fireflyframework.eventbridge.core.model.MessageMetadata;
import org.fireflyframework.eventbridge.core.observability.RoutingEvents;
import org.fireflyframework.eventbridge.core.store.EventStore;
import org.fireflyframework.eventbridge.event.WorkflowEvent;
import org.fireflyframework.eventbridge.routing.SubjectRouter;
import org.fireflyframework.eventbridge.workflow.aggregate.WorkflowAggregate;
import org.fireflyframework.eventbridge.workflow.command.WorkflowCommand;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Application service driving the command flow: rehydrate the workflow from the event store,
 * handle the command, append the produced events and route them, all in emission order.
 *
 * <p>A rejected command surfaces as an error signal and nothing is appended or routed. When the
 * events were appended but routing failed, the error is an {@link UnroutedEventsException}. Each
 * routed event carries metadata caused by the command's envelope, so deliveries share the
 * command's correlation id. Callers serialize commands per workflow.
 */
@Slf4j
public class WorkflowService {

    private final EventStore eventStore;
    private final SubjectRouter router;
    private final RoutingEvents events;
    private final Clock clock;

    public WorkflowService(EventStore eventStore, SubjectRouter router, RoutingEvents events, Clock clock) {
        this.eventStore = eventStore;
        this.router = router;
        this.events = events;
        this.clock = clock;
    }

    public Mono<CommandResult> execute(WorkflowCommand command) {
        return execute(CommandEnvelope.of(command));
    }

    public Mono<CommandResult> execute(CommandEnvelope envelope) {
        WorkflowCommand command = envelope.command();
        String aggregateId = command.workflowId().toString();
        String commandType = command.getClass().getSimpleName();

        return load(command.workflowId())
                .flatMap(aggregate -> {
                    List<WorkflowEvent> produced = aggregate.execute(command);
                    return eventStore.appendAll(produced)
                            .then(Mono.fromRunnable(aggregate::markEventsCommitted))
                            .then(Mono.fromCallable(() -> route(produced, envelope.metadata()))
                                    .onErrorMap(error -> new UnroutedEventsException(
                                            aggregateId, produced.size(), aggregate.getVersion(), error)))
                            .map(deliveries -> new CommandResult(command.workflowId(),
                                    envelope.metadata().correlationId(), produced, aggregate.getStatus(),
                                    aggregate.getVersion(), deliveries));
                })
                .doOnNext(result -> events.onCommandHandled(aggregateId, commandType, result.events().size()))
                .doOnError(error -> {
                    if (error instanceof UnroutedEventsException unrouted) {
                        events.onCommandUnrouted(aggregateId, commandType, unrouted.getPersistedEvents(), unrouted.getCause());
                    } else {
                        events.onCommandRejected(aggregateId, commandType, error);
                    }
                });
    }

    /**
     * Rebuilds a workflow from its stored events. An unknown id yields a fresh, not yet created workflow.
     */
    public Mono<WorkflowAggregate> load(AggregateId workflowId) {
        return eventStore.read(workflowId)
                .ofType(WorkflowEvent.class)
                .collectList()
                .map(history -> WorkflowAggregate.replay(workflowId, history, clock));
    }

    public Flux<WorkflowEvent> history(AggregateId workflowId) {
        return eventStore.read(workflowId).ofType(WorkflowEvent.class);
    }

    private List<List<String>> route(List<WorkflowEvent> produced, MessageMetadata commandMetadata) {
        List<List<String>> deliveries = new ArrayList<>();
        for (WorkflowEvent event : produced) {
            deliveries.add(router.routeEvent(event, commandMetadata.caused()));
        }
        log.debug("[workflow] Routed {} event(s) for correlationId={}", produced.size(), commandMetadata.correlationId());
        return deliveries;
    }
}
