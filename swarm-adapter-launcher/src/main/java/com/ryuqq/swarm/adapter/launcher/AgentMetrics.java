package com.ryuqq.swarm.adapter.launcher;

/**
 * 프로세스/스레드 핸들에서 수집한 리소스 사용량.
 *
 * @param cpuPercent 직전 측정 이후 CPU 사용률 (%)
 * @param memoryMb 상주 메모리 (MB, 측정 불가 시 0)
 * @param uptimeSeconds 시작 이후 경과 시간
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record AgentMetrics(
    double cpuPercent,
    double memoryMb,
    long uptimeSeconds
) {

    public static AgentMetrics empty() {
        return new AgentMetrics(0.0, 0.0, 0);
    }
}
