/**
 * Task execution outcome package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.swarm.core.outcome.Ok} - completed with a result</li>
 *   <li>{@link com.ryuqq.swarm.core.outcome.Retry} - failed, requeued within the retry budget</li>
 *   <li>{@link com.ryuqq.swarm.core.outcome.Fail} - failed, retry budget exhausted</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.core.outcome;
