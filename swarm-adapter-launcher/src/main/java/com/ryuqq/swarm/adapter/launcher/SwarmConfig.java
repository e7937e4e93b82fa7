package com.ryuqq.swarm.adapter.launcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 여러 Agent를 한 번에 실행하기 위한 설정.
 *
 * @param agents 실행할 Agent (템플릿 또는 명시적 설정)
 * @param autoScale true면 requiredCapabilities 중 등록된 Agent가 없는 capability마다 Agent 추가
 * @param requiredCapabilities auto-scale 대상 capability
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record SwarmConfig(
    List<AgentSpec> agents,
    boolean autoScale,
    List<String> requiredCapabilities
) {

    public SwarmConfig {
        agents = agents == null ? List.of() : List.copyOf(agents);
        requiredCapabilities = requiredCapabilities == null ? List.of() : List.copyOf(requiredCapabilities);
    }

    public static SwarmConfig of(List<AgentSpec> agents) {
        return new SwarmConfig(agents, false, List.of());
    }

    public SwarmConfig withAutoScale(List<String> requiredCapabilities) {
        return new SwarmConfig(agents, true, requiredCapabilities);
    }

    /**
     * Swarm 구성 항목. 템플릿 이름 또는 명시적 {@link AgentConfig} 중 하나를 가집니다.
     *
     * @param template 템플릿 이름
     * @param overrides 템플릿 override
     * @param config 명시적 설정
     */
    public record AgentSpec(
        String template,
        Map<String, Object> overrides,
        AgentConfig config
    ) {

        public AgentSpec {
            if ((template == null) == (config == null)) {
                throw new IllegalArgumentException("exactly one of template or config must be set");
            }
            overrides = overrides == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
        }

        public static AgentSpec fromTemplate(String template) {
            return new AgentSpec(template, null, null);
        }

        public static AgentSpec fromTemplate(String template, Map<String, Object> overrides) {
            return new AgentSpec(template, overrides, null);
        }

        public static AgentSpec explicit(AgentConfig config) {
            return new AgentSpec(null, null, config);
        }
    }
}
