/**
 * Coordination runtime port.
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.application.runtime;
