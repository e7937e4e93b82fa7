/**
 * Reusable contract tests for SPI implementations.
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.testkit.contract;
