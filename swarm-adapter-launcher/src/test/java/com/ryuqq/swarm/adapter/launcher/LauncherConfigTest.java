package com.ryuqq.swarm.adapter.launcher;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LauncherConfig 테스트.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
class LauncherConfigTest {

    @Test
    void 기본값() {
        // when
        LauncherConfig config = new LauncherConfig();

        // then
        assertThat(config.maxAgents()).isEqualTo(20);
        assertThat(config.healthCheckIntervalMs()).isEqualTo(10000);
        assertThat(config.heartbeatTimeoutMs()).isEqualTo(90000);
        assertThat(config.restartDelayMs()).isEqualTo(5000);
        assertThat(config.maxRestarts()).isEqualTo(3);
        assertThat(config.stopTimeoutMs()).isEqualTo(10000);
        assertThat(config.memoryHeadroomRatio()).isEqualTo(0.8);
        assertThat(config.storeUrl()).isEqualTo("redis://localhost:6379/0");
    }

    @Test
    void 속성에서_읽고_없는_키는_기본값() {
        // given
        Properties properties = new Properties();
        properties.setProperty("swarm.launcher.max-agents", "5");
        properties.setProperty("swarm.launcher.heartbeat-timeout-ms", "30000");
        properties.setProperty("swarm.launcher.store-url", "redis://cache:6379/1");

        // when
        LauncherConfig config = LauncherConfig.fromProperties(properties);

        // then
        assertThat(config.maxAgents()).isEqualTo(5);
        assertThat(config.heartbeatTimeoutMs()).isEqualTo(30000);
        assertThat(config.storeUrl()).isEqualTo("redis://cache:6379/1");
        assertThat(config.maxRestarts()).isEqualTo(3);
    }

    @Test
    void 잘못된_값은_거부() {
        // when & then
        assertThatThrownBy(() -> new LauncherConfig().withMaxAgents(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("maxAgents must be positive (current: 0)");
        assertThatThrownBy(() -> new LauncherConfig().withMaxRestarts(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LauncherConfig().withStoreUrl(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
