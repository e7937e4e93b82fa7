package com.ryuqq.swarm.application.orchestrator;

import com.ryuqq.swarm.core.error.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Task 정의 (세션 생성 입력).
 *
 * <p>key를 생략하면 목록 내 위치로 {@code task{index}}가 부여됩니다.
 * dependencies는 같은 세션의 key를 참조합니다.
 * requiredCapabilities를 생략하면 타입의 핸들러 등록 정보가 사용됩니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 * @param key 세션 내 고유 키 (선택)
 * @param type Task 타입 (핸들러 선택)
 * @param parameters 파라미터
 * @param priority 우선순위 (기본 5, 클수록 먼저)
 * @param dependencies 선행 Task key
 * @param maxRetries 최대 재시도 (기본 3, 1 이상)
 * @param requiredCapabilities 필요한 capability (선택)
 */
public record TaskDefinition(
    String key,
    String type,
    Map<String, Object> parameters,
    int priority,
    List<String> dependencies,
    int maxRetries,
    Set<String> requiredCapabilities
) {

    public static final int DEFAULT_PRIORITY = 5;
    public static final int DEFAULT_MAX_RETRIES = 3;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ValidationException 파라미터 검증 실패 시
     */
    public TaskDefinition {
        if (type == null || type.isBlank()) {
            throw new ValidationException("Task type cannot be null or blank");
        }
        if (maxRetries < 1) {
            throw new ValidationException(
                "maxRetries must be positive (current: " + maxRetries + ")"
            );
        }
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        requiredCapabilities = requiredCapabilities == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(requiredCapabilities));
    }

    /**
     * 기본값으로 Task 정의 생성.
     *
     * @param type Task 타입
     * @return 정의
     */
    public static TaskDefinition of(String type) {
        return new TaskDefinition(null, type, Map.of(), DEFAULT_PRIORITY, List.of(), DEFAULT_MAX_RETRIES, Set.of());
    }

    public TaskDefinition withKey(String key) {
        return new TaskDefinition(key, type, parameters, priority, dependencies, maxRetries, requiredCapabilities);
    }

    public TaskDefinition withParameters(Map<String, Object> parameters) {
        return new TaskDefinition(key, type, parameters, priority, dependencies, maxRetries, requiredCapabilities);
    }

    public TaskDefinition withPriority(int priority) {
        return new TaskDefinition(key, type, parameters, priority, dependencies, maxRetries, requiredCapabilities);
    }

    public TaskDefinition withDependencies(String... dependencies) {
        return new TaskDefinition(key, type, parameters, priority, List.of(dependencies), maxRetries, requiredCapabilities);
    }

    public TaskDefinition withMaxRetries(int maxRetries) {
        return new TaskDefinition(key, type, parameters, priority, dependencies, maxRetries, requiredCapabilities);
    }

    public TaskDefinition withRequiredCapabilities(String... capabilities) {
        return new TaskDefinition(key, type, parameters, priority, dependencies, maxRetries,
            new LinkedHashSet<>(List.of(capabilities)));
    }
}
