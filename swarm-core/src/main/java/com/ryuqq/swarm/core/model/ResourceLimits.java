package com.ryuqq.swarm.core.model;

/**
 * Agent 리소스 제한.
 *
 * <p>범위 검증은 사용하는 쪽(Agent Launcher)이 수행합니다. 잘못된 값도 표현할 수 있어야
 * Launch 단계에서 명시적으로 거부할 수 있기 때문입니다.</p>
 *
 * @param memoryMb 메모리 제한 (MB)
 * @param cpuPercent CPU 제한 (%)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record ResourceLimits(
    long memoryMb,
    double cpuPercent
) {

    /**
     * 기본값: 512MB, 80%.
     */
    public static ResourceLimits defaults() {
        return new ResourceLimits(512, 80.0);
    }
}
