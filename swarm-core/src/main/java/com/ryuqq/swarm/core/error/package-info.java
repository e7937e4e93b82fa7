/**
 * Error taxonomy.
 *
 * <ul>
 *   <li>{@link com.ryuqq.swarm.core.error.ValidationException} - bad configuration, rejected synchronously</li>
 *   <li>{@link com.ryuqq.swarm.core.error.ResourceExhaustedException} - launch limits reached</li>
 *   <li>{@link com.ryuqq.swarm.core.error.StoreException} - backing store failure, logged per operation</li>
 *   <li>{@link com.ryuqq.swarm.core.error.UnsupportedLaunchModeException} - container / remote launch</li>
 *   <li>{@link com.ryuqq.swarm.core.error.AgentLaunchException} - process or thread failed to start</li>
 * </ul>
 *
 * <p>Task handler failures are not exceptions at this level; they are recorded as
 * {@link com.ryuqq.swarm.core.outcome.Outcome} values.</p>
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.core.error;
