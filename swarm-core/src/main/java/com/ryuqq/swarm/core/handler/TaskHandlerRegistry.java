package com.ryuqq.swarm.core.handler;

import com.ryuqq.swarm.core.error.UnregisteredTaskTypeException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task 타입 → 핸들러 등록 테이블.
 *
 * <p>각 타입은 핸들러와 함께 해당 타입 실행에 필요한 capability 집합을 등록합니다.
 * Task 정의에 requiredCapabilities가 없으면 이 집합이 사용됩니다.</p>
 *
 * <p>등록되지 않은 타입 조회는 {@link UnregisteredTaskTypeException}으로 실패합니다
 * (런타임 lookup miss가 아니라 구성 오류).</p>
 *
 * <p>Thread-safe.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class TaskHandlerRegistry {

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    /**
     * 핸들러 등록 (capability = 타입 이름).
     *
     * @param taskType Task 타입
     * @param handler 핸들러
     * @return this
     */
    public TaskHandlerRegistry register(String taskType, TaskHandler handler) {
        return register(taskType, handler, Set.of(taskType));
    }

    /**
     * 핸들러 등록.
     *
     * @param taskType Task 타입
     * @param handler 핸들러
     * @param capabilities 이 타입 실행에 필요한 capability (비어 있으면 안 됨)
     * @return this
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public TaskHandlerRegistry register(String taskType, TaskHandler handler, Set<String> capabilities) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("capabilities cannot be null or empty");
        }
        registrations.put(taskType, new Registration(handler,
            Collections.unmodifiableSet(new LinkedHashSet<>(capabilities))));
        return this;
    }

    /**
     * 핸들러 조회 (필수).
     *
     * @param taskType Task 타입
     * @return 핸들러
     * @throws UnregisteredTaskTypeException 등록되지 않은 타입인 경우
     */
    public TaskHandler require(String taskType) {
        Registration registration = registrations.get(taskType);
        if (registration == null) {
            throw new UnregisteredTaskTypeException(taskType);
        }
        return registration.handler();
    }

    /**
     * 핸들러 조회.
     *
     * @param taskType Task 타입
     * @return 핸들러 (없으면 empty)
     */
    public Optional<TaskHandler> find(String taskType) {
        Registration registration = registrations.get(taskType);
        return registration == null ? Optional.empty() : Optional.of(registration.handler());
    }

    /**
     * 타입에 필요한 capability 조회.
     *
     * @param taskType Task 타입
     * @return capability 집합 (등록 순서 유지)
     * @throws UnregisteredTaskTypeException 등록되지 않은 타입인 경우
     */
    public Set<String> capabilitiesFor(String taskType) {
        Registration registration = registrations.get(taskType);
        if (registration == null) {
            throw new UnregisteredTaskTypeException(taskType);
        }
        return registration.capabilities();
    }

    public boolean isRegistered(String taskType) {
        return registrations.containsKey(taskType);
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(registrations.keySet());
    }

    private record Registration(TaskHandler handler, Set<String> capabilities) {
    }
}
