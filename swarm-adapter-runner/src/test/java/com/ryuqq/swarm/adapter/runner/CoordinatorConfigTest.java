package com.ryuqq.swarm.adapter.runner;

import com.ryuqq.swarm.core.model.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CoordinatorConfig / ReaperConfig 테스트.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
class CoordinatorConfigTest {

    @Test
    void 기본값() {
        // when
        CoordinatorConfig config = new CoordinatorConfig();

        // then
        assertThat(config.tickIntervalMs()).isEqualTo(1000);
        assertThat(config.workerPoolSize()).isEqualTo(10);
        assertThat(config.sessionRetentionMs()).isEqualTo(3600000);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(5000);
        assertThat(config.selfScheduling()).isTrue();
        assertThat(config.defaultSessionConfig().maxAgents()).isEqualTo(10);
        assertThat(config.defaultSessionConfig().retryPolicy()).isEqualTo(RetryPolicy.IMMEDIATE);
    }

    @Test
    void 속성에서_읽고_없는_키는_기본값을_사용함() {
        // given
        Properties properties = new Properties();
        properties.setProperty("swarm.coordinator.tick-interval-ms", "250");
        properties.setProperty("swarm.coordinator.self-scheduling", "false");
        properties.setProperty("swarm.coordinator.session.retry-policy", "EXPONENTIAL");
        properties.setProperty("swarm.coordinator.session.max-agents", "4");

        // when
        CoordinatorConfig config = CoordinatorConfig.fromProperties(properties);

        // then
        assertThat(config.tickIntervalMs()).isEqualTo(250);
        assertThat(config.selfScheduling()).isFalse();
        assertThat(config.workerPoolSize()).isEqualTo(10);
        assertThat(config.defaultSessionConfig().retryPolicy()).isEqualTo(RetryPolicy.EXPONENTIAL);
        assertThat(config.defaultSessionConfig().maxAgents()).isEqualTo(4);
        assertThat(config.defaultSessionConfig().taskTimeoutMs()).isEqualTo(600000);
    }

    @Test
    void 양수가_아닌_값은_예외() {
        assertThatThrownBy(() -> new CoordinatorConfig().withTickIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tickIntervalMs must be positive (current: 0)");
        assertThatThrownBy(() -> new CoordinatorConfig().withWorkerPoolSize(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("workerPoolSize");
        assertThatThrownBy(() -> new CoordinatorConfig().withDefaultSessionConfig(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReaperConfig(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scanIntervalMs");
    }

    @Test
    void ReaperConfig_속성과_기본값() {
        // given
        Properties properties = new Properties();
        properties.setProperty("swarm.reaper.scan-interval-ms", "60000");

        // when / then
        assertThat(new ReaperConfig().scanIntervalMs()).isEqualTo(300000);
        assertThat(ReaperConfig.fromProperties(properties).scanIntervalMs()).isEqualTo(60000);
        assertThat(ReaperConfig.fromProperties(new Properties()).scanIntervalMs()).isEqualTo(300000);
    }
}
