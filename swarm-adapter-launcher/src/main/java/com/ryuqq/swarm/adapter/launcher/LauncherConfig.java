package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.adapter.launcher.worker.AgentWorkerConfig;

import java.util.Properties;

/**
 * AgentLauncher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAgents: 동시에 STARTING/RUNNING일 수 있는 Agent 수 (기본 20)</li>
 *   <li>healthCheckIntervalMs: 헬스 체크 주기 (기본 10000ms)</li>
 *   <li>heartbeatTimeoutMs: 이 시간 동안 heartbeat가 없으면 FAILED (기본 90000ms)</li>
 *   <li>restartDelayMs: 재시작 전 대기 (기본 5000ms)</li>
 *   <li>maxRestarts: Agent당 재시작 횟수 상한 (기본 3)</li>
 *   <li>stopTimeoutMs: 종료 신호 후 강제 종료까지 대기 (기본 10000ms)</li>
 *   <li>postLaunchCheckMs: 프로세스 시작 직후 즉시 종료 여부 확인 시간 (기본 1000ms)</li>
 *   <li>memoryHeadroomRatio: 요청 메모리가 가용 메모리의 이 비율을 넘으면 거부 (기본 0.8)</li>
 *   <li>storeUrl: 프로세스 모드 Agent가 접속할 Backing Store URL</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record LauncherConfig(
    int maxAgents,
    long healthCheckIntervalMs,
    long heartbeatTimeoutMs,
    long restartDelayMs,
    int maxRestarts,
    long stopTimeoutMs,
    long postLaunchCheckMs,
    double memoryHeadroomRatio,
    String storeUrl
) {

    public static final String DEFAULT_STORE_URL = AgentWorkerConfig.DEFAULT_STORE_URL;

    private static final String PREFIX = "swarm.launcher.";

    /**
     * 기본 설정 생성자.
     */
    public LauncherConfig() {
        this(20, 10000, 90000, 5000, 3, 10000, 1000, 0.8, DEFAULT_STORE_URL);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LauncherConfig {
        if (maxAgents <= 0) {
            throw new IllegalArgumentException("maxAgents must be positive (current: " + maxAgents + ")");
        }
        if (healthCheckIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "healthCheckIntervalMs must be positive (current: " + healthCheckIntervalMs + ")"
            );
        }
        if (heartbeatTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "heartbeatTimeoutMs must be positive (current: " + heartbeatTimeoutMs + ")"
            );
        }
        if (restartDelayMs < 0) {
            throw new IllegalArgumentException("restartDelayMs cannot be negative (current: " + restartDelayMs + ")");
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts cannot be negative (current: " + maxRestarts + ")");
        }
        if (stopTimeoutMs < 0) {
            throw new IllegalArgumentException("stopTimeoutMs cannot be negative (current: " + stopTimeoutMs + ")");
        }
        if (postLaunchCheckMs < 0) {
            throw new IllegalArgumentException(
                "postLaunchCheckMs cannot be negative (current: " + postLaunchCheckMs + ")"
            );
        }
        if (memoryHeadroomRatio <= 0 || memoryHeadroomRatio > 1) {
            throw new IllegalArgumentException(
                "memoryHeadroomRatio must be in (0, 1] (current: " + memoryHeadroomRatio + ")"
            );
        }
        if (storeUrl == null || storeUrl.isBlank()) {
            throw new IllegalArgumentException("storeUrl cannot be null or blank");
        }
    }

    /**
     * {@code swarm.launcher.*} 속성에서 설정 생성 (없는 키는 기본값).
     *
     * @param properties 속성
     * @return 설정
     */
    public static LauncherConfig fromProperties(Properties properties) {
        LauncherConfig defaults = new LauncherConfig();
        return new LauncherConfig(
            Integer.parseInt(properties.getProperty(PREFIX + "max-agents", String.valueOf(defaults.maxAgents()))),
            Long.parseLong(properties.getProperty(PREFIX + "health-check-interval-ms", String.valueOf(defaults.healthCheckIntervalMs()))),
            Long.parseLong(properties.getProperty(PREFIX + "heartbeat-timeout-ms", String.valueOf(defaults.heartbeatTimeoutMs()))),
            Long.parseLong(properties.getProperty(PREFIX + "restart-delay-ms", String.valueOf(defaults.restartDelayMs()))),
            Integer.parseInt(properties.getProperty(PREFIX + "max-restarts", String.valueOf(defaults.maxRestarts()))),
            Long.parseLong(properties.getProperty(PREFIX + "stop-timeout-ms", String.valueOf(defaults.stopTimeoutMs()))),
            Long.parseLong(properties.getProperty(PREFIX + "post-launch-check-ms", String.valueOf(defaults.postLaunchCheckMs()))),
            Double.parseDouble(properties.getProperty(PREFIX + "memory-headroom-ratio", String.valueOf(defaults.memoryHeadroomRatio()))),
            properties.getProperty(PREFIX + "store-url", defaults.storeUrl())
        );
    }

    public LauncherConfig withMaxAgents(int maxAgents) {
        return new LauncherConfig(maxAgents, healthCheckIntervalMs, heartbeatTimeoutMs, restartDelayMs, maxRestarts, stopTimeoutMs, postLaunchCheckMs, memoryHeadroomRatio, storeUrl);
    }

    public LauncherConfig withHealthCheckIntervalMs(long healthCheckIntervalMs) {
        return new LauncherConfig(maxAgents, healthCheckIntervalMs, heartbeatTimeoutMs, restartDelayMs, maxRestarts, stopTimeoutMs, postLaunchCheckMs, memoryHeadroomRatio, storeUrl);
    }

    public LauncherConfig withHeartbeatTimeoutMs(long heartbeatTimeoutMs) {
        return new LauncherConfig(maxAgents, healthCheckIntervalMs, heartbeatTimeoutMs, restartDelayMs, maxRestarts, stopTimeoutMs, postLaunchCheckMs, memoryHeadroomRatio, storeUrl);
    }

    public LauncherConfig withRestartDelayMs(long restartDelayMs) {
        return new LauncherConfig(maxAgents, healthCheckIntervalMs, heartbeatTimeoutMs, restartDelayMs, maxRestarts, stopTimeoutMs, postLaunchCheckMs, memoryHeadroomRatio, storeUrl);
    }

    public LauncherConfig withMaxRestarts(int maxRestarts) {
        return new LauncherConfig(maxAgents, healthCheckIntervalMs, heartbeatTimeoutMs, restartDelayMs, maxRestarts, stopTimeoutMs, postLaunchCheckMs, memoryHeadroomRatio, storeUrl);
    }

    public LauncherConfig withStopTimeoutMs(long stopTimeoutMs) {
        return new LauncherConfig(maxAgents, healthCheckIntervalMs, heartbeatTimeoutMs, restartDelayMs, maxRestarts, stopTimeoutMs, postLaunchCheckMs, memoryHeadroomRatio, storeUrl);
    }

    public LauncherConfig withPostLaunchCheckMs(long postLaunchCheckMs) {
        return new LauncherConfig(maxAgents, healthCheckIntervalMs, heartbeatTimeoutMs, restartDelayMs, maxRestarts, stopTimeoutMs, postLaunchCheckMs, memoryHeadroomRatio, storeUrl);
    }

    public LauncherConfig withStoreUrl(String storeUrl) {
        return new LauncherConfig(maxAgents, healthCheckIntervalMs, heartbeatTimeoutMs, restartDelayMs, maxRestarts, stopTimeoutMs, postLaunchCheckMs, memoryHeadroomRatio, storeUrl);
    }
}
