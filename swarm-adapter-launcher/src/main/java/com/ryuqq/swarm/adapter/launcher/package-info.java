/**
 * Launcher Adapter Layer - Agent 프로세스 실행과 수명 관리.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swarm.adapter.launcher.AgentLauncher} - 실행, 헬스 체크, 정지, 재시작</li>
 *   <li>{@link com.ryuqq.swarm.adapter.launcher.AgentTemplates} - 이름 있는 템플릿과 override 병합</li>
 *   <li>{@link com.ryuqq.swarm.adapter.launcher.LaunchStrategy} - 실행 모드별 전략 (process, in_process)</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-launcher (AgentLauncher → LaunchStrategy → AgentHandle)
 *   ↓ launches
 * adapter-launcher/worker (AgentWorker)
 *   ↓ reports to
 * application/memory (MemoryCoordinator → BackingStore SPI)
 * </pre>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
package com.ryuqq.swarm.adapter.launcher;
