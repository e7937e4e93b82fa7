package com.ryuqq.swarm.core.handler;

/**
 * {@link java.util.ServiceLoader}로 발견되는 핸들러 제공자.
 *
 * <p>프로세스 모드로 실행된 Agent Worker는 클래스패스의
 * {@code META-INF/services/com.ryuqq.swarm.core.handler.TaskHandlerProvider}
 * 등록 정보로 핸들러를 수집합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public interface TaskHandlerProvider {

    /**
     * 제공하는 핸들러를 등록.
     *
     * @param registry 대상 레지스트리
     */
    void registerHandlers(TaskHandlerRegistry registry);
}
