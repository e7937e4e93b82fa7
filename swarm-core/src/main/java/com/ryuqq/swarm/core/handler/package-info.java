/**
 * Task handler contract.
 *
 * <p>Handlers are registered per task-type string in a
 * {@link com.ryuqq.swarm.core.handler.TaskHandlerRegistry}. Looking up a type that was never
 * registered is a configuration error
 * ({@link com.ryuqq.swarm.core.error.UnregisteredTaskTypeException}).</p>
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.core.handler;
