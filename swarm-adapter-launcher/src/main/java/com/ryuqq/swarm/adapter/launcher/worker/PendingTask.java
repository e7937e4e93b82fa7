package com.ryuqq.swarm.adapter.launcher.worker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 공유 컨텍스트 {@code pending_tasks} 목록의 항목.
 *
 * @param id Task ID
 * @param type Task 타입 (핸들러 키)
 * @param parameters 핸들러 파라미터
 * @param requiredCapabilities 요구 capability (비어 있으면 제한 없음)
 * @param assignedAgent 이미 지정된 Agent (없으면 null)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingTask(
    String id,
    String type,
    Map<String, Object> parameters,
    List<String> requiredCapabilities,
    String assignedAgent
) {

    public PendingTask {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        requiredCapabilities = requiredCapabilities == null ? List.of() : List.copyOf(requiredCapabilities);
    }

    public static PendingTask of(String id, String type, Map<String, Object> parameters, List<String> requiredCapabilities) {
        return new PendingTask(id, type, parameters, requiredCapabilities, null);
    }

    @JsonIgnore
    public boolean isAssigned() {
        return assignedAgent != null && !assignedAgent.isBlank();
    }
}
