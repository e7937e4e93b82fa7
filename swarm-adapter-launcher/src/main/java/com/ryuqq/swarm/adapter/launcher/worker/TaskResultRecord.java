package com.ryuqq.swarm.adapter.launcher.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 세션 결과 hash의 값 ({@link com.ryuqq.swarm.application.memory.MemoryCoordinator#putTaskResult}).
 *
 * @author Swarm Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskResultRecord(
    String status,
    Map<String, Object> result,
    String error,
    String agentId,
    Instant startedAt,
    Instant completedAt,
    long executionTimeMs
) {

    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    public TaskResultRecord {
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static TaskResultRecord completed(String agentId, Map<String, Object> result, Instant startedAt, Instant completedAt) {
        return new TaskResultRecord(
            COMPLETED, result, null, agentId, startedAt, completedAt, Duration.between(startedAt, completedAt).toMillis()
        );
    }

    public static TaskResultRecord failed(String agentId, String error, Instant startedAt, Instant completedAt) {
        return new TaskResultRecord(
            FAILED, null, error, agentId, startedAt, completedAt, Duration.between(startedAt, completedAt).toMillis()
        );
    }
}
