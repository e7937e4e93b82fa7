/**
 * Memory Coordinator: 교차 프로세스 세션 상태와 이벤트 스트림.
 *
 * <p>{@link com.ryuqq.swarm.application.memory.MemoryCoordinator}는 Backing Store SPI만 사용하며,
 * 모든 값은 Jackson으로 직렬화된 JSON 문자열로 저장됩니다.</p>
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.application.memory;
