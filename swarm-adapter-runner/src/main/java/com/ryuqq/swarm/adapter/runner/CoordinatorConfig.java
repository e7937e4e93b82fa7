package com.ryuqq.swarm.adapter.runner;

import com.ryuqq.swarm.core.model.RetryPolicy;
import com.ryuqq.swarm.core.model.SessionConfig;

import java.util.Properties;

/**
 * CoordinatorRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>tickIntervalMs: 조정 루프 주기 (기본 1000ms)</li>
 *   <li>workerPoolSize: Task 실행 스레드 수 (기본 10)</li>
 *   <li>sessionRetentionMs: 종료 세션 보존 기간 (기본 3600000ms = 1시간)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 실행 중 Task 대기 시간 (기본 5000ms)</li>
 *   <li>selfScheduling: 내부 타이머로 pump() 실행 여부 (기본 true)</li>
 *   <li>defaultSessionConfig: createSession에 설정이 없을 때 사용</li>
 * </ul>
 *
 * <p><strong>성능 튜닝 가이드:</strong></p>
 * <ul>
 *   <li>낮은 할당 지연: tickIntervalMs 감소 (1000 → 100)</li>
 *   <li>높은 처리량: workerPoolSize 증가 (블로킹 핸들러 비중에 비례)</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record CoordinatorConfig(
    long tickIntervalMs,
    int workerPoolSize,
    long sessionRetentionMs,
    long shutdownTimeoutMs,
    boolean selfScheduling,
    SessionConfig defaultSessionConfig
) {

    private static final String PREFIX = "swarm.coordinator.";

    /**
     * 기본 설정 생성자.
     */
    public CoordinatorConfig() {
        this(1000, 10, 3600000, 5000, true, new SessionConfig());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinatorConfig {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "tickIntervalMs must be positive (current: " + tickIntervalMs + ")"
            );
        }
        if (workerPoolSize <= 0) {
            throw new IllegalArgumentException(
                "workerPoolSize must be positive (current: " + workerPoolSize + ")"
            );
        }
        if (sessionRetentionMs <= 0) {
            throw new IllegalArgumentException(
                "sessionRetentionMs must be positive (current: " + sessionRetentionMs + ")"
            );
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs cannot be negative (current: " + shutdownTimeoutMs + ")"
            );
        }
        if (defaultSessionConfig == null) {
            throw new IllegalArgumentException("defaultSessionConfig cannot be null");
        }
    }

    /**
     * {@code swarm.coordinator.*} 속성에서 설정 생성 (없는 키는 기본값).
     *
     * <p>세션 기본값은 {@code swarm.coordinator.session.max-agents},
     * {@code swarm.coordinator.session.task-timeout-ms},
     * {@code swarm.coordinator.session.retry-policy}에서 읽습니다.</p>
     *
     * @param properties 속성
     * @return 설정
     */
    public static CoordinatorConfig fromProperties(Properties properties) {
        CoordinatorConfig defaults = new CoordinatorConfig();
        SessionConfig session = defaults.defaultSessionConfig();
        return new CoordinatorConfig(
            Long.parseLong(properties.getProperty(PREFIX + "tick-interval-ms", String.valueOf(defaults.tickIntervalMs()))),
            Integer.parseInt(properties.getProperty(PREFIX + "worker-pool-size", String.valueOf(defaults.workerPoolSize()))),
            Long.parseLong(properties.getProperty(PREFIX + "session-retention-ms", String.valueOf(defaults.sessionRetentionMs()))),
            Long.parseLong(properties.getProperty(PREFIX + "shutdown-timeout-ms", String.valueOf(defaults.shutdownTimeoutMs()))),
            Boolean.parseBoolean(properties.getProperty(PREFIX + "self-scheduling", String.valueOf(defaults.selfScheduling()))),
            new SessionConfig(
                Integer.parseInt(properties.getProperty(PREFIX + "session.max-agents", String.valueOf(session.maxAgents()))),
                Long.parseLong(properties.getProperty(PREFIX + "session.task-timeout-ms", String.valueOf(session.taskTimeoutMs()))),
                RetryPolicy.valueOf(properties.getProperty(PREFIX + "session.retry-policy", session.retryPolicy().name()))
            )
        );
    }

    public CoordinatorConfig withTickIntervalMs(long tickIntervalMs) {
        return new CoordinatorConfig(tickIntervalMs, workerPoolSize, sessionRetentionMs, shutdownTimeoutMs, selfScheduling, defaultSessionConfig);
    }

    public CoordinatorConfig withWorkerPoolSize(int workerPoolSize) {
        return new CoordinatorConfig(tickIntervalMs, workerPoolSize, sessionRetentionMs, shutdownTimeoutMs, selfScheduling, defaultSessionConfig);
    }

    public CoordinatorConfig withSessionRetentionMs(long sessionRetentionMs) {
        return new CoordinatorConfig(tickIntervalMs, workerPoolSize, sessionRetentionMs, shutdownTimeoutMs, selfScheduling, defaultSessionConfig);
    }

    public CoordinatorConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new CoordinatorConfig(tickIntervalMs, workerPoolSize, sessionRetentionMs, shutdownTimeoutMs, selfScheduling, defaultSessionConfig);
    }

    public CoordinatorConfig withSelfScheduling(boolean selfScheduling) {
        return new CoordinatorConfig(tickIntervalMs, workerPoolSize, sessionRetentionMs, shutdownTimeoutMs, selfScheduling, defaultSessionConfig);
    }

    public CoordinatorConfig withDefaultSessionConfig(SessionConfig defaultSessionConfig) {
        return new CoordinatorConfig(tickIntervalMs, workerPoolSize, sessionRetentionMs, shutdownTimeoutMs, selfScheduling, defaultSessionConfig);
    }
}
