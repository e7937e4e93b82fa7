package com.ryuqq.swarm.adapter.launcher.worker;

import com.ryuqq.swarm.core.handler.SharedContext;
import com.ryuqq.swarm.core.handler.TaskHandler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@code health_check} 타입 기본 핸들러.
 *
 * <p>monitoring 또는 health_check capability를 가진 Agent에서 별도 등록이 없을 때 사용되며,
 * 워커 상태 스냅샷에 {@code healthy} 상태를 붙여 반환합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class HealthCheckHandler implements TaskHandler {

    public static final String TASK_TYPE = "health_check";

    private final Supplier<Map<String, Object>> statusSupplier;

    public HealthCheckHandler(Supplier<Map<String, Object>> statusSupplier) {
        this.statusSupplier = statusSupplier;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> parameters, SharedContext context) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("status", "healthy");
        report.putAll(statusSupplier.get());
        return report;
    }
}
