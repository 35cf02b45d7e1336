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

import org.fireflyframework.eventbridge.workflow.command.CommandKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which commands a workflow accepts in which state, and which state changes are legal.
 *
 * <p>Any (state, command) pair not listed here is rejected with an invalid-state error.
 * {@link CommandKind#CREATE} is handled separately because it applies to a workflow that does not exist yet.
 */
public final class WorkflowTransitionTable {

    private static final Map<WorkflowStatus, Set<CommandKind>> ACCEPTED = new EnumMap<>(WorkflowStatus.class);
    private static final Map<WorkflowStatus, Set<WorkflowStatus>> TRANSITIONS = new EnumMap<>(WorkflowStatus.class);

    static {
        ACCEPTED.put(WorkflowStatus.DESIGNED,
                EnumSet.of(CommandKind.ADD_STEP, CommandKind.CONNECT_STEPS, CommandKind.VALIDATE));
        ACCEPTED.put(WorkflowStatus.READY, EnumSet.of(CommandKind.START));
        ACCEPTED.put(WorkflowStatus.RUNNING,
                EnumSet.of(CommandKind.COMPLETE_STEP, CommandKind.PAUSE, CommandKind.FAIL));
        ACCEPTED.put(WorkflowStatus.PAUSED, EnumSet.of(CommandKind.RESUME, CommandKind.FAIL));
        ACCEPTED.put(WorkflowStatus.COMPLETED, EnumSet.noneOf(CommandKind.class));
        ACCEPTED.put(WorkflowStatus.FAILED, EnumSet.of(CommandKind.RECOVER));

        TRANSITIONS.put(WorkflowStatus.DESIGNED, EnumSet.of(WorkflowStatus.READY));
        TRANSITIONS.put(WorkflowStatus.READY, EnumSet.of(WorkflowStatus.RUNNING));
        TRANSITIONS.put(WorkflowStatus.RUNNING,
                EnumSet.of(WorkflowStatus.PAUSED, WorkflowStatus.COMPLETED, WorkflowStatus.FAILED));
        TRANSITIONS.put(WorkflowStatus.PAUSED, EnumSet.of(WorkflowStatus.RUNNING, WorkflowStatus.FAILED));
        TRANSITIONS.put(WorkflowStatus.COMPLETED, EnumSet.noneOf(WorkflowStatus.class));
        TRANSITIONS.put(WorkflowStatus.FAILED, EnumSet.of(WorkflowStatus.RUNNING));
    }

    private WorkflowTransitionTable() {}

    /**
     * Whether a workflow in {@code state} accepts a command of the given kind.
     * A failed workflow only accepts recovery when it recorded a recovery point.
     */
    public static boolean accepts(WorkflowState state, CommandKind kind) {
        if (!ACCEPTED.get(state.status()).contains(kind)) {
            return false;
        }
        if (state instanceof WorkflowState.Failed failed) {
            return failed.isRecoverable();
        }
        return true;
    }

    /**
     * Whether the lifecycle may move from {@code from} to a state with status {@code to}.
     * Staying in the same status (adding steps, completing a non-final step) is not a transition.
     */
    public static boolean canTransition(WorkflowState from, WorkflowStatus to) {
        if (!TRANSITIONS.get(from.status()).contains(to)) {
            return false;
        }
        if (from instanceof WorkflowState.Failed failed) {
            return failed.isRecoverable();
        }
        return true;
    }

    public static Set<CommandKind> acceptedCommands(WorkflowStatus status) {
        return Collections.unmodifiableSet(ACCEPTED.get(status));
    }

    static String rejectionMessage(CommandKind kind) {
        return switch (kind) {
            case CREATE -> "Workflow already exists";
            case ADD_STEP -> "Can only add steps to workflows in Designed state";
            case CONNECT_STEPS -> "Can only connect steps in Designed state";
            case VALIDATE -> "Can only validate workflows in Designed state";
            case START -> "Can only start workflows in Ready state";
            case COMPLETE_STEP -> "Can only complete steps when workflow is Running";
            case PAUSE -> "Can only pause running workflows";
            case RESUME -> "Can only resume paused workflows";
            case FAIL -> "Can only fail running or paused workflows";
            case RECOVER -> "Can only recover failed workflows that recorded a recovery point";
        };
    }
}
