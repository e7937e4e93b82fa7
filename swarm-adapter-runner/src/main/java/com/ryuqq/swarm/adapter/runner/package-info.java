/**
 * Runner Adapter Layer - Orchestrator 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swarm.adapter.runner.CoordinatorRunner} - 조정 루프 + 제한된 워커 풀</li>
 *   <li>{@link com.ryuqq.swarm.adapter.runner.BackoffCalculator} - 재할당 지연 계산</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (CoordinatorRunner)
 *   ↓ implements
 * application (Orchestrator, Runtime)
 *   ↓ mirrors to
 * application/memory (MemoryCoordinator → BackingStore SPI)
 *   ↓ depends on
 * core (Session, Task, Agent, Outcome, TaskHandler)
 * </pre>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
package com.ryuqq.swarm.adapter.runner;
