/**
 * 실행된 Agent 안에서 도는 워커.
 *
 * <p>{@link com.ryuqq.swarm.adapter.launcher.worker.AgentWorkerMain}은 별도 JVM의 진입점이며
 * {@code SWARM_*} 환경 변수로 설정을 받습니다. in_process 모드에서는 같은
 * {@link com.ryuqq.swarm.adapter.launcher.worker.AgentWorker}를 스레드로 실행합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
package com.ryuqq.swarm.adapter.launcher.worker;
