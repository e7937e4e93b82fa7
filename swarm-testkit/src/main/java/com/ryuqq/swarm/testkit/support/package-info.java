/**
 * Test doubles shared across modules: controllable clock, same-thread executor and
 * canned task handlers.
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.testkit.support;
