/**
 * Redis 기반 Backing Store 어댑터 (Lettuce).
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.adapter.redis.store;
