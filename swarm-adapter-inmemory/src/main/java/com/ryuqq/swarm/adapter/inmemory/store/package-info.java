/**
 * In-memory BackingStore adapter implementation package.
 *
 * <p>This package provides the reference implementation of the
 * {@link com.ryuqq.swarm.core.spi.BackingStore} SPI for tests and single-process use.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.swarm.adapter.inmemory.store.InMemoryBackingStore}:
 *       Thread-safe strings, hashes, sets, lists, counters, TTL and synchronous pub/sub</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Visible only inside one JVM</li>
 *   <li>Suitable for Contract Tests, in-process agents and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.swarm.core.spi.BackingStore
 * @author Swarm Team
 * @since 1.0.0
 */
package com.ryuqq.swarm.adapter.inmemory.store;
