package com.ryuqq.swarm.core.outcome;

import com.ryuqq.swarm.core.model.TaskId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 성공 결과.
 *
 * @param taskId Task ID
 * @param result 핸들러 반환값 (null이면 빈 Map)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record Ok(
    TaskId taskId,
    Map<String, Object> result
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId가 null인 경우
     */
    public Ok {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    /**
     * 결과 없이 성공 생성.
     *
     * @param taskId Task ID
     * @return Ok 인스턴스
     */
    public static Ok of(TaskId taskId) {
        return new Ok(taskId, null);
    }
}
