/**
 * Orchestrator 포트와 입출력 모델.
 *
 * <p>세션 생성 입력({@link com.ryuqq.swarm.application.orchestrator.TaskDefinition},
 * {@link com.ryuqq.swarm.application.orchestrator.AgentDefinition})과
 * 읽기 전용 스냅샷({@link com.ryuqq.swarm.application.orchestrator.SessionStatusView},
 * {@link com.ryuqq.swarm.application.orchestrator.TaskSnapshot})을 정의합니다.</p>
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.application.orchestrator;
