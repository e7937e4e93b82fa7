package com.ryuqq.swarm.application.orchestrator;

import com.ryuqq.swarm.core.model.ResourceLimits;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Agent 정의 (세션 생성 입력, 선택).
 *
 * @param id Agent ID
 * @param name 표시 이름
 * @param capabilities capability 집합 (비어 있으면 안 됨)
 * @param resourceLimits 리소스 제한 (null이면 기본값)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record AgentDefinition(
    String id,
    String name,
    Set<String> capabilities,
    ResourceLimits resourceLimits
) {

    public AgentDefinition {
        capabilities = capabilities == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        resourceLimits = resourceLimits == null ? ResourceLimits.defaults() : resourceLimits;
    }

    public static AgentDefinition of(String id, String name, String... capabilities) {
        return new AgentDefinition(id, name, new LinkedHashSet<>(List.of(capabilities)), null);
    }
}
