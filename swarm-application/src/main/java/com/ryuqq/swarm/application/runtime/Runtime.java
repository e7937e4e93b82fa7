package com.ryuqq.swarm.application.runtime;

/**
 * Coordination Runtime.
 *
 * <p>This interface defines one iteration of the coordination loop that drives every active
 * session of an Orchestrator instance.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * for each ACTIVE session:
 *   1. Refresh agent liveness bookkeeping
 *   2. Fail IN_PROGRESS tasks that exceeded the session task timeout
 *   3. Compute the ready set (QUEUED + dependencies COMPLETED + retry delay elapsed)
 *   4. Sort by priority (descending), ties by creation order
 *   5. Assign each ready task to the first IDLE agent sharing a capability
 *   6. Submit assigned tasks to the bounded worker pool
 *   7. Recompute progress; complete the session when every task is terminal
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>By default the runner schedules pump() itself on a fixed tick (1s)</li>
 *   <li>With self-scheduling disabled, pump() is invoked externally (@Scheduled or ExecutorService)</li>
 *   <li>Implementations are thread-safe: concurrent pump() calls serialize per session</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * // Typically invoked by Spring Scheduler when self-scheduling is disabled
 * {@literal @Scheduled}(fixedDelay = 1000)
 * public void scheduledPump() {
 *     runtime.pump();
 * }
 * </pre>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>Handler failures → recorded as task outcomes, retried within the budget</li>
 *   <li>Backing store failures → logged, in-memory state keeps advancing</li>
 *   <li>Unexpected failure while processing one session → that session becomes FAILED, others continue</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single coordination tick over every active session.
     *
     * <p>Never throws because of a single task or agent failure. Returns once assignments are
     * submitted; task execution continues in the worker pool.</p>
     */
    void pump();
}
