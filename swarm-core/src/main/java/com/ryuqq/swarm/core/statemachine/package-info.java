/**
 * Session / Task / Agent state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swarm.core.statemachine.SessionStatus} - Session lifecycle states</li>
 *   <li>{@link com.ryuqq.swarm.core.statemachine.TaskStatus} - Task lifecycle states</li>
 *   <li>{@link com.ryuqq.swarm.core.statemachine.AgentStatus} - Agent availability states</li>
 *   <li>{@link com.ryuqq.swarm.core.statemachine.StateTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * TaskStatus status = TaskStatus.QUEUED;
 * status = StateTransition.transition(status, TaskStatus.ASSIGNED);
 * status = StateTransition.transition(status, TaskStatus.IN_PROGRESS);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(TaskStatus.COMPLETED, TaskStatus.IN_PROGRESS);
 * </pre>
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.core.statemachine;
