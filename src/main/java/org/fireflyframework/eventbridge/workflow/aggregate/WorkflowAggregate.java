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


package org.fireflyframework.eventbridge.workflow.aggregate;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.core.exception.DomainValidationException;
import org.fireflyframework.eventbridge.core.exception.DuplicateEntityException;
import org.fireflyframework.eventbridge.core.exception.EntityNotFoundException;
import org.fireflyframework.eventbridge.core.exception.InvalidStateException;
import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.event.*;
import org.fireflyframework.eventbridge.workflow.command.*;
import org.fireflyframework.eventbridge.workflow.model.StepTransition;
import org.fireflyframework.eventbridge.workflow.model.ValidationResult;
import org.fireflyframework.eventbridge.workflow.model.WorkflowMetrics;
import org.fireflyframework.eventbridge.workflow.model.WorkflowResult;
import org.fireflyframework.eventbridge.workflow.model.WorkflowStep;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event-sourced workflow aggregate.
 *
 * <p>{@link #handle(WorkflowCommand)} validates a command against the current state and returns
 * the events it produces without touching the aggregate; every guard is checked before the first
 * event is built, so a rejected command has no effect. {@link #apply(WorkflowEvent)} is the only
 * mutator and is used both for normal progression and for rehydration from an event stream.
 * {@link #execute(WorkflowCommand)} combines the two and tracks the produced events as uncommitted
 * until {@link #markEventsCommitted()} is called.
 *
 * <p>Instances are not thread-safe; callers serialize commands per aggregate.
 */
@Slf4j
public class WorkflowAggregate {

    private final AggregateId id;
    private final Clock clock;

    private String name;
    private String description;
    private String createdBy;
    private Instant createdAt;
    private List<String> tags = List.of();
    private WorkflowState state = new WorkflowState.Designed();
    private final Map<String, WorkflowStep> steps = new LinkedHashMap<>();
    private final List<StepTransition> transitions = new ArrayList<>();
    private String startStep;
    private boolean startStepExplicit;
    private final Set<String> endSteps = new LinkedHashSet<>();
    private long version;
    private ExecutionContext executionContext;

    private final List<WorkflowEvent> uncommittedEvents = new CopyOnWriteArrayList<>();

    public WorkflowAggregate(AggregateId id) {
        this(id, Clock.systemUTC());
    }

    public WorkflowAggregate(AggregateId id, Clock clock) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Rebuilds an aggregate by applying a stored event stream in order.
     */
    public static WorkflowAggregate replay(AggregateId id, Iterable<? extends WorkflowEvent> history, Clock clock) {
        var aggregate = new WorkflowAggregate(id, clock);
        for (WorkflowEvent event : history) {
            aggregate.apply(event);
        }
        return aggregate;
    }

    /**
     * Validates a command against the current state and returns the events it produces, in order.
     * The aggregate is not modified.
     *
     * @throws InvalidStateException     the command is not accepted in the current state
     * @throws DomainValidationException the workflow content does not satisfy the command's rules
     * @throws DuplicateEntityException  a step or transition with the same identity already exists
     * @throws EntityNotFoundException   the command references an unknown step
     */
    public List<WorkflowEvent> handle(WorkflowCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        if (!id.equals(command.workflowId())) {
            throw new DomainValidationException("Command targets workflow " + command.workflowId()
                    + " but was sent to workflow " + id);
        }
        if (command.kind() == CommandKind.CREATE) {
            if (isCreated()) {
                throw new InvalidStateException(state.status().name(),
                        WorkflowTransitionTable.rejectionMessage(CommandKind.CREATE));
            }
        } else if (!isCreated()) {
            throw new InvalidStateException("NEW", "Workflow " + id + " does not exist");
        } else if (!WorkflowTransitionTable.accepts(state, command.kind())) {
            throw new InvalidStateException(state.status().name(),
                    WorkflowTransitionTable.rejectionMessage(command.kind()));
        }
        return List.copyOf(command.accept(new CommandHandler(clock.instant())));
    }

    /**
     * Handles a command and raises the produced events.
     */
    public List<WorkflowEvent> execute(WorkflowCommand command) {
        List<WorkflowEvent> events = handle(command);
        events.forEach(this::raise);
        log.debug("[workflow] {} on {} produced {} event(s), now {} at version {}",
                command.kind(), id, events.size(), state.status(), version);
        return events;
    }

    /**
     * Adds an event to the uncommitted list and applies it.
     */
    public void raise(WorkflowEvent event) {
        apply(event);
        uncommittedEvents.add(event);
    }

    /**
     * Applies an event to the aggregate state. Applying the same ordered stream to a fresh
     * aggregate always yields the same state.
     */
    public void apply(WorkflowEvent event) {
        if (!id.equals(event.workflowId())) {
            throw new IllegalArgumentException("Event " + event.eventType() + " belongs to workflow "
                    + event.workflowId() + ", not " + id);
        }
        event.accept(new EventApplier());
        version++;
    }

    public List<WorkflowEvent> getUncommittedEvents() {
        return List.copyOf(uncommittedEvents);
    }

    public void markEventsCommitted() {
        uncommittedEvents.clear();
    }

    public boolean canTransition(WorkflowStatus to) {
        return WorkflowTransitionTable.canTransition(state, to);
    }

    public boolean isCreated() {
        return version > 0;
    }

    // --- Accessors ---

    public AggregateId getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getCreatedBy() { return createdBy; }
    public Instant getCreatedAt() { return createdAt; }
    public List<String> getTags() { return tags; }
    public WorkflowState getState() { return state; }
    public WorkflowStatus getStatus() { return state.status(); }
    public Map<String, WorkflowStep> getSteps() { return Collections.unmodifiableMap(steps); }
    public List<StepTransition> getTransitions() { return Collections.unmodifiableList(transitions); }
    public String getStartStep() { return startStep; }
    public Set<String> getEndSteps() { return Collections.unmodifiableSet(endSteps); }
    public long getVersion() { return version; }
    public ExecutionContext getExecutionContext() { return executionContext; }

    // --- Snapshot restoration ---

    void restore(WorkflowSnapshot snapshot) {
        this.name = snapshot.name();
        this.description = snapshot.description();
        this.createdBy = snapshot.createdBy();
        this.createdAt = snapshot.createdAt();
        this.tags = snapshot.tags();
        this.state = snapshot.state();
        this.steps.clear();
        this.steps.putAll(snapshot.steps());
        this.transitions.clear();
        this.transitions.addAll(snapshot.transitions());
        this.startStep = snapshot.startStep();
        this.startStepExplicit = snapshot.startStepExplicit();
        this.endSteps.clear();
        this.endSteps.addAll(snapshot.endSteps());
        this.version = snapshot.version();
        this.executionContext = snapshot.executionContext();
    }

    boolean isStartStepExplicit() {
        return startStepExplicit;
    }

    // --- Command handling ---

    private final class CommandHandler implements WorkflowCommandVisitor<List<WorkflowEvent>> {
        private final Instant now;

        private CommandHandler(Instant now) {
            this.now = now;
        }

        @Override
        public List<WorkflowEvent> visit(CreateWorkflow command) {
            if (command.name() == null || command.name().isBlank()) {
                throw new DomainValidationException("Workflow name must not be blank");
            }
            return List.of(new WorkflowCreated(id, command.name(),
                    command.description() != null ? command.description() : "",
                    command.createdBy(), command.tags(), now));
        }

        @Override
        public List<WorkflowEvent> visit(AddStep command) {
            WorkflowStep step = Objects.requireNonNull(command.step(), "step must not be null");
            if (steps.containsKey(step.id())) {
                throw new DuplicateEntityException("Step " + step.id() + " already exists");
            }
            if (command.startStep() && startStepExplicit) {
                throw new DomainValidationException("Workflow already has start step " + startStep);
            }
            return List.of(new StepAdded(id, step, command.startStep(), command.endStep()));
        }

        @Override
        public List<WorkflowEvent> visit(ConnectSteps command) {
            requireStep(command.fromStep());
            requireStep(command.toStep());
            boolean duplicate = transitions.stream().anyMatch(t -> t.connects(command.fromStep(), command.toStep()));
            if (duplicate) {
                throw new DuplicateEntityException("Transition " + command.fromStep() + " -> "
                        + command.toStep() + " already exists");
            }
            String edgeId = command.edgeId() != null ? command.edgeId() : UUID.randomUUID().toString();
            return List.of(new StepsConnected(id, command.fromStep(), command.toStep(), edgeId, command.condition()));
        }

        @Override
        public List<WorkflowEvent> visit(ValidateWorkflow command) {
            List<String> errors = new ArrayList<>();
            if (steps.isEmpty()) {
                errors.add("Workflow has no steps");
            }
            if (startStep == null) {
                errors.add("Workflow has no start step");
            }
            if (endSteps.isEmpty()) {
                errors.add("Workflow has no end steps");
            }
            if (!errors.isEmpty()) {
                throw new DomainValidationException(String.join("; ", errors));
            }
            List<String> warnings = new ArrayList<>();
            Set<String> reachable = reachableFrom(startStep);
            for (String stepId : steps.keySet()) {
                if (!reachable.contains(stepId)) {
                    warnings.add("Step " + stepId + " is not reachable from start step " + startStep);
                }
            }
            return List.of(new WorkflowValidated(id, command.validatedBy(),
                    ValidationResult.of(List.of(), warnings), now));
        }

        @Override
        public List<WorkflowEvent> visit(StartWorkflow command) {
            String instanceId = command.instanceId() != null ? command.instanceId() : UUID.randomUUID().toString();
            return List.of(new WorkflowStarted(id, instanceId, command.startedBy(), command.inputs(), startStep, now));
        }

        @Override
        public List<WorkflowEvent> visit(CompleteStep command) {
            requireStep(command.stepId());
            if (command.nextStep() != null) {
                requireStep(command.nextStep());
            }
            var completed = new StepCompleted(id, command.stepId(), command.outputs(), command.nextStep(), now);
            if (command.nextStep() != null || !endSteps.contains(command.stepId())) {
                return List.of(completed);
            }
            var running = (WorkflowState.Running) state;
            Set<String> executed = new LinkedHashSet<>(running.completedSteps());
            executed.add(command.stepId());
            Map<String, Object> outputs = new HashMap<>(executionContext.variables());
            outputs.putAll(command.outputs());
            var metrics = new WorkflowMetrics(
                    Duration.between(running.startedAt(), now).toMillis(),
                    running.completedSteps().size() + 1,
                    Math.max(0, steps.size() - executed.size()));
            return List.of(completed, new WorkflowCompleted(id, new WorkflowResult(outputs, metrics), now));
        }

        @Override
        public List<WorkflowEvent> visit(PauseWorkflow command) {
            var running = (WorkflowState.Running) state;
            return List.of(new WorkflowPaused(id, command.pausedBy(), command.reason(), running.currentStep(), now));
        }

        @Override
        public List<WorkflowEvent> visit(ResumeWorkflow command) {
            var paused = (WorkflowState.Paused) state;
            return List.of(new WorkflowResumed(id, command.resumedBy(), paused.resumePoint(), now));
        }

        @Override
        public List<WorkflowEvent> visit(FailWorkflow command) {
            if (command.recoveryPoint() != null) {
                requireStep(command.recoveryPoint());
            }
            String failedStep = state instanceof WorkflowState.Running running
                    ? running.currentStep()
                    : ((WorkflowState.Paused) state).resumePoint();
            return List.of(new WorkflowFailed(id, command.error(), failedStep, command.recoveryPoint(), now));
        }

        @Override
        public List<WorkflowEvent> visit(RecoverWorkflow command) {
            var failed = (WorkflowState.Failed) state;
            return List.of(new WorkflowRecovered(id, command.recoveredBy(), failed.recoveryPoint(), now));
        }

        private void requireStep(String stepId) {
            if (stepId == null || !steps.containsKey(stepId)) {
                throw new EntityNotFoundException("Step " + stepId + " not found in workflow " + id);
            }
        }

        private Set<String> reachableFrom(String root) {
            Set<String> visited = new HashSet<>();
            Deque<String> pending = new ArrayDeque<>();
            pending.push(root);
            while (!pending.isEmpty()) {
                String current = pending.pop();
                if (visited.add(current)) {
                    for (StepTransition t : transitions) {
                        if (t.from().equals(current)) {
                            pending.push(t.to());
                        }
                    }
                }
            }
            return visited;
        }
    }

    // --- Event application ---

    private final class EventApplier implements WorkflowEventVisitor<Void> {

        @Override
        public Void visit(WorkflowCreated event) {
            name = event.name();
            description = event.description();
            createdBy = event.createdBy();
            createdAt = event.createdAt();
            tags = event.tags();
            state = new WorkflowState.Designed();
            return null;
        }

        @Override
        public Void visit(StepAdded event) {
            steps.put(event.step().id(), event.step());
            if (event.startStep()) {
                startStep = event.step().id();
                startStepExplicit = true;
            } else if (startStep == null) {
                startStep = event.step().id();
            }
            if (event.endStep()) {
                endSteps.add(event.step().id());
            }
            return null;
        }

        @Override
        public Void visit(StepsConnected event) {
            transitions.add(new StepTransition(event.edgeId(), event.fromStep(), event.toStep(), event.condition()));
            return null;
        }

        @Override
        public Void visit(WorkflowValidated event) {
            state = new WorkflowState.Ready(event.validatedAt(), event.validatedBy());
            return null;
        }

        @Override
        public Void visit(WorkflowStarted event) {
            state = new WorkflowState.Running(event.startedAt(), event.startStep(), List.of());
            executionContext = ExecutionContext.start(event.instanceId(), event.inputs());
            return null;
        }

        @Override
        public Void visit(StepCompleted event) {
            var running = expect(WorkflowState.Running.class, event);
            List<String> completed = new ArrayList<>(running.completedSteps());
            completed.add(event.stepId());
            String current = event.nextStep() != null ? event.nextStep() : running.currentStep();
            state = new WorkflowState.Running(running.startedAt(), current, completed);
            executionContext = executionContext.withStepOutputs(event.stepId(), event.outputs());
            return null;
        }

        @Override
        public Void visit(WorkflowPaused event) {
            var running = expect(WorkflowState.Running.class, event);
            state = new WorkflowState.Paused(event.pausedAt(), event.pausedBy(), event.resumePoint(),
                    running.startedAt(), running.completedSteps());
            return null;
        }

        @Override
        public Void visit(WorkflowResumed event) {
            var paused = expect(WorkflowState.Paused.class, event);
            state = new WorkflowState.Running(paused.startedAt(), event.resumePoint(), paused.completedSteps());
            return null;
        }

        @Override
        public Void visit(WorkflowCompleted event) {
            state = new WorkflowState.Completed(event.completedAt(), event.result());
            executionContext = null;
            return null;
        }

        @Override
        public Void visit(WorkflowFailed event) {
            Instant startedAt;
            List<String> completed;
            if (state instanceof WorkflowState.Paused paused) {
                startedAt = paused.startedAt();
                completed = paused.completedSteps();
            } else {
                var running = expect(WorkflowState.Running.class, event);
                startedAt = running.startedAt();
                completed = running.completedSteps();
            }
            state = new WorkflowState.Failed(event.failedAt(), event.error(), event.failedStep(),
                    event.recoveryPoint(), startedAt, completed);
            if (event.recoveryPoint() == null) {
                executionContext = null;
            }
            return null;
        }

        @Override
        public Void visit(WorkflowRecovered event) {
            var failed = expect(WorkflowState.Failed.class, event);
            state = new WorkflowState.Running(failed.startedAt(), event.recoveryPoint(), failed.completedSteps());
            return null;
        }

        private <S extends WorkflowState> S expect(Class<S> type, WorkflowEvent event) {
            if (!type.isInstance(state)) {
                throw new InvalidStateException(state.status().name(),
                        "Cannot apply " + event.eventType() + " to workflow " + id);
            }
            return type.cast(state);
        }
    }
}
