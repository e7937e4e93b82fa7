package com.ryuqq.swarm.adapter.launcher;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.core.error.ValidationException;
import com.ryuqq.swarm.core.model.ResourceLimits;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이름 있는 Agent 템플릿 모음.
 *
 * <p>템플릿은 capability, 리소스 제한, 기본 실행 모드를 묶은 {@link AgentConfig}입니다.
 * {@link #create(String, Map)}는 템플릿에 override 맵을 필드 단위로 병합합니다.</p>
 *
 * <p><strong>병합 규칙:</strong></p>
 * <ul>
 *   <li>키는 snake_case 필드 이름 (예: {@code max_tasks}, {@code resource_limits})</li>
 *   <li>중첩 맵은 병합, 스칼라와 리스트는 교체</li>
 *   <li>알 수 없는 키는 무시</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class AgentTemplates {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Map<String, AgentConfig> templates = new ConcurrentHashMap<>();
    private final Map<String, String> capabilityTemplates = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = MemoryCoordinator.createObjectMapper();

    /**
     * 빈 템플릿 모음 생성. 기본 템플릿은 {@link #defaults()}를 사용합니다.
     */
    public AgentTemplates() {
    }

    /**
     * 기본 템플릿 5종과 capability 매핑이 등록된 인스턴스.
     *
     * @return 기본 템플릿
     */
    public static AgentTemplates defaults() {
        AgentTemplates defaults = new AgentTemplates();
        defaults.register("data_processor", template(
            "Data Processor", AgentType.SPECIALIST, LaunchMode.PROCESS,
            List.of("data_processing", "csv_handling", "filtering"), 512, 50.0, 2
        ));
        defaults.register("uploader", template(
            "Uploader", AgentType.SPECIALIST, LaunchMode.PROCESS,
            List.of("upload", "product_upload", "rate_limiting"), 256, 30.0, 1
        ));
        defaults.register("cleanup_agent", template(
            "Cleanup Agent", AgentType.WORKER, LaunchMode.PROCESS,
            List.of("cleanup", "file_management", "duplicate_removal"), 128, 20.0, 3
        ));
        defaults.register("parallel_analyzer", template(
            "Parallel Analyzer", AgentType.SPECIALIST, LaunchMode.PROCESS,
            List.of("analysis", "parallel_processing", "categorization"), 1024, 80.0, 1
        ));
        defaults.register("monitor_agent", template(
            "Monitor Agent", AgentType.MONITOR, LaunchMode.IN_PROCESS,
            List.of("monitoring", "health_check", "metrics"), 64, 10.0, 5
        ));

        defaults.mapCapability("data_processing", "data_processor");
        defaults.mapCapability("csv_handling", "data_processor");
        defaults.mapCapability("filtering", "data_processor");
        defaults.mapCapability("upload", "uploader");
        defaults.mapCapability("product_upload", "uploader");
        defaults.mapCapability("cleanup", "cleanup_agent");
        defaults.mapCapability("file_management", "cleanup_agent");
        defaults.mapCapability("analysis", "parallel_analyzer");
        defaults.mapCapability("parallel_processing", "parallel_analyzer");
        defaults.mapCapability("monitoring", "monitor_agent");
        defaults.mapCapability("health_check", "monitor_agent");
        return defaults;
    }

    private static AgentConfig template(
        String name,
        AgentType type,
        LaunchMode launchMode,
        List<String> capabilities,
        long memoryMb,
        double cpuPercent,
        int maxTasks
    ) {
        return new AgentConfig(
            null, name, type, launchMode, capabilities, new ResourceLimits(memoryMb, cpuPercent),
            Map.of(), AgentConfig.DEFAULT_HEARTBEAT_INTERVAL_MS, maxTasks
        );
    }

    /**
     * 템플릿 등록 (같은 이름이면 교체).
     *
     * @param name 템플릿 이름
     * @param template 템플릿 설정 (id는 무시됨)
     * @return this
     */
    public AgentTemplates register(String name, AgentConfig template) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("template name cannot be null or blank");
        }
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        templates.put(name, template.withId(null));
        return this;
    }

    /**
     * auto-scale에서 사용할 capability → 템플릿 매핑 등록.
     *
     * @return this
     */
    public AgentTemplates mapCapability(String capability, String templateName) {
        if (!templates.containsKey(templateName)) {
            throw new IllegalArgumentException("Unknown template: " + templateName);
        }
        capabilityTemplates.put(capability, templateName);
        return this;
    }

    public Optional<AgentConfig> find(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    public Set<String> names() {
        return Set.copyOf(templates.keySet());
    }

    public Optional<String> templateForCapability(String capability) {
        return Optional.ofNullable(capabilityTemplates.get(capability));
    }

    /**
     * 템플릿으로 Agent 설정 생성.
     *
     * <p>override에 {@code id}가 없으면 {@code {template}_{8자리 hex}} 형식으로 생성합니다.</p>
     *
     * @param templateName 템플릿 이름
     * @param overrides 필드 단위 override (null 허용)
     * @return Agent 설정
     * @throws ValidationException 템플릿이 없거나 override 값의 타입이 맞지 않는 경우
     */
    public AgentConfig create(String templateName, Map<String, Object> overrides) {
        AgentConfig template = templates.get(templateName);
        if (template == null) {
            throw new ValidationException("Unknown agent template: " + templateName + " (known: " + names() + ")");
        }
        AgentConfig base = template.withId(templateName + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8));
        if (overrides == null || overrides.isEmpty()) {
            return base;
        }

        Map<String, Object> merged = objectMapper.convertValue(base, MAP_TYPE);
        merge(merged, overrides, true);
        try {
            return objectMapper.convertValue(merged, AgentConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid overrides for template " + templateName + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> merge(Map<String, Object> target, Map<?, ?> overrides, boolean knownKeysOnly) {
        for (Map.Entry<?, ?> entry : overrides.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (knownKeysOnly && !target.containsKey(key)) {
                continue;
            }
            Object current = target.get(key);
            Object override = entry.getValue();
            if (current instanceof Map<?, ?> currentMap && override instanceof Map<?, ?> overrideMap) {
                target.put(key, merge(copyOf(currentMap), overrideMap, false));
            } else {
                target.put(key, override);
            }
        }
        return target;
    }

    private static Map<String, Object> copyOf(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
