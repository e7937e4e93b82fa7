/**
 * Domain model package.
 *
 * <h2>Identities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swarm.core.model.SessionId} - UUID based session identity</li>
 *   <li>{@link com.ryuqq.swarm.core.model.TaskId} - {@code {sessionId}_{key}}</li>
 *   <li>{@link com.ryuqq.swarm.core.model.AgentId} - caller supplied or synthesized</li>
 * </ul>
 *
 * <h2>Entities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swarm.core.model.Session} - owns tasks, agents and shared context</li>
 *   <li>{@link com.ryuqq.swarm.core.model.Task} - unit of work with dependencies and a retry budget</li>
 *   <li>{@link com.ryuqq.swarm.core.model.Agent} - capability-tagged executor</li>
 * </ul>
 *
 * <p>Entities are mutable and not thread-safe; the owner (the coordinator runner) serializes
 * every mutation through a per-session lock.</p>
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.core.model;
