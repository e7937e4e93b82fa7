package com.ryuqq.swarm.application.orchestrator;

import com.ryuqq.swarm.core.model.SessionConfig;
import com.ryuqq.swarm.core.model.SessionId;

import java.util.List;
import java.util.Optional;

/**
 * 세션 오케스트레이션 조정자.
 *
 * <p>세션을 Task로 분해하고, capability 태그를 가진 Agent에 Task를 할당하고,
 * 진행률 추적과 실패 재시도를 담당합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SessionId sessionId = orchestrator.createSession("import", List.of(
 *     TaskDefinition.of("download").withKey("download"),
 *     TaskDefinition.of("filter").withDependencies("download").withPriority(8)
 * ));
 * orchestrator.startSession(sessionId);
 *
 * orchestrator.getSessionStatus(sessionId)
 *     .ifPresent(status -&gt; log.info("{}% done", status.progress().percentage()));
 * </pre>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * 세션 생성 (Agent는 Task의 capability로부터 합성, 기본 설정).
     *
     * @param name 세션 이름
     * @param tasks Task 정의 (빈 목록 허용)
     * @return 세션 ID
     * @throws com.ryuqq.swarm.core.error.ValidationException 정의가 유효하지 않은 경우
     */
    default SessionId createSession(String name, List<TaskDefinition> tasks) {
        return createSession(name, tasks, null, null);
    }

    /**
     * 세션 생성.
     *
     * <p>실행은 시작하지 않습니다. {@code agents}가 null이거나 비어 있으면
     * Task가 요구하는 capability마다 Agent 하나씩을 합성합니다.</p>
     *
     * @param name 세션 이름
     * @param tasks Task 정의 (빈 목록 허용)
     * @param agents Agent 정의 (선택, null 가능)
     * @param config 세션 설정 (선택, null이면 기본값)
     * @return 세션 ID
     * @throws com.ryuqq.swarm.core.error.ValidationException 정의가 유효하지 않은 경우 (상태 변경 없음)
     */
    SessionId createSession(String name, List<TaskDefinition> tasks, List<AgentDefinition> agents, SessionConfig config);

    /**
     * 세션 시작 (INITIALIZING → ACTIVE).
     *
     * <p>조정 루프가 실행 중이 아니면 시작합니다 (멱등).</p>
     *
     * @param sessionId 세션 ID
     * @return 시작 여부 (세션이 없거나 INITIALIZING이 아니면 false)
     */
    boolean startSession(SessionId sessionId);

    /**
     * 세션 중단 (→ CANCELLED).
     *
     * <p>QUEUED/ASSIGNED Task는 즉시 CANCELLED, Agent는 IDLE로 돌아갑니다.
     * 실행 중인 Task는 중단하지 않으며 결과가 버려집니다.</p>
     *
     * @param sessionId 세션 ID
     * @return 중단 여부 (세션이 없거나 이미 종료 상태이면 false)
     */
    boolean stopSession(SessionId sessionId);

    /**
     * 세션 상태 스냅샷 조회 (읽기 전용).
     *
     * @param sessionId 세션 ID
     * @return 스냅샷 (세션이 없으면 empty)
     */
    Optional<SessionStatusView> getSessionStatus(SessionId sessionId);

    /**
     * 세션의 Task 스냅샷 조회 (생성 순서).
     *
     * @param sessionId 세션 ID
     * @return Task 스냅샷 (세션이 없으면 빈 목록)
     */
    List<TaskSnapshot> listTasks(SessionId sessionId);

    /**
     * 조정 루프를 멈추고 진행 중 실행을 제한 시간 동안 기다린 뒤 종료.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void shutdown() throws InterruptedException;
}
