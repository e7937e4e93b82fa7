package com.ryuqq.swarm.core.error;

/**
 * 메모리 또는 Agent 수 제한 초과로 Launch가 거부됨.
 *
 * <p>거부 시점에는 프로세스/스레드가 시작되지 않았고 어떤 상태도 기록되지 않았습니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public class ResourceExhaustedException extends IllegalStateException {

    public ResourceExhaustedException(String message) {
        super(message);
    }
}
