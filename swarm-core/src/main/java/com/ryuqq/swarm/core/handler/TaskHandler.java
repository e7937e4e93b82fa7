package com.ryuqq.swarm.core.handler;

import java.util.Map;

/**
 * Task 타입별 비즈니스 핸들러 계약.
 *
 * <p>Orchestrator와 Agent Worker는 Task 타입 문자열로 등록된 핸들러를 통해서만 작업을 실행합니다.
 * 구체적인 비즈니스 핸들러(CSV 필터링, 업로드 등)는 이 모듈의 범위가 아닙니다.</p>
 *
 * <p><strong>구현 가이드:</strong></p>
 * <ul>
 *   <li>예외를 던지면 실패로 기록되고 재시도 예산 내에서 재실행됩니다</li>
 *   <li>재실행될 수 있으므로 멱등하게 구현하는 것을 권장합니다</li>
 *   <li>인터럽트(타임아웃 취소)에 반응해야 합니다</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Task 실행.
     *
     * @param parameters Task 파라미터 (읽기 전용)
     * @param context 세션 공유 컨텍스트
     * @return 결과 (null 허용, 빈 결과로 취급)
     * @throws Exception 실행 실패 시
     */
    Map<String, Object> execute(Map<String, Object> parameters, SharedContext context) throws Exception;
}
