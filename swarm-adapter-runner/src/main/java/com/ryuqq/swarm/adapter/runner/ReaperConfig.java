package com.ryuqq.swarm.adapter.runner;

import java.util.Properties;

/**
 * SessionReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 보존 기간 스캔 주기 (기본 300000ms = 5분)</li>
 * </ul>
 *
 * <p>보존 기간 자체는 {@link CoordinatorConfig#sessionRetentionMs()}입니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 */
public record ReaperConfig(long scanIntervalMs) {

    /**
     * 기본 설정 생성자 (scanIntervalMs=300000ms).
     */
    public ReaperConfig() {
        this(300000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
    }

    /**
     * {@code swarm.reaper.*} 속성에서 설정 생성.
     *
     * @param properties 속성
     * @return 설정
     */
    public static ReaperConfig fromProperties(Properties properties) {
        return new ReaperConfig(
            Long.parseLong(properties.getProperty("swarm.reaper.scan-interval-ms", "300000"))
        );
    }

    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs);
    }
}
