/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete functionality for the Core SDK.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swarm.core.spi.BackingStore} - Shared key-value / container / pub-sub store</li>
 *   <li>{@link com.ryuqq.swarm.core.spi.MessageListener} - Channel message callback</li>
 *   <li>{@link com.ryuqq.swarm.core.spi.Subscription} - Closeable channel subscription</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (swarm-adapter-inmemory, swarm-adapter-redis) are responsible for
 * providing concrete implementations of these SPIs.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> InMemory for tests and single-process use, Redis for cross-process sharing</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.core.spi;
