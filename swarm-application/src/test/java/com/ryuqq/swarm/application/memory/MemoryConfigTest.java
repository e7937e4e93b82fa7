package com.ryuqq.swarm.application.memory;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryConfigTest {

    @Test
    void 기본값() {
        MemoryConfig config = new MemoryConfig();

        assertThat(config.namespace()).isEqualTo("swarm");
        assertThat(config.sessionTtlMs()).isEqualTo(7200000);
        assertThat(config.eventTtlMs()).isEqualTo(3600000);
        assertThat(config.eventLogCapacity()).isEqualTo(1000);
        assertThat(config.heartbeatFreshnessMs()).isEqualTo(60000);
    }

    @Test
    void 속성에서_읽고_없는_키는_기본값() {
        // given
        Properties properties = new Properties();
        properties.setProperty("swarm.memory.namespace", "test");
        properties.setProperty("swarm.memory.event-log-capacity", "50");

        // when
        MemoryConfig config = MemoryConfig.fromProperties(properties);

        // then
        assertThat(config.namespace()).isEqualTo("test");
        assertThat(config.eventLogCapacity()).isEqualTo(50);
        assertThat(config.sessionTtlMs()).isEqualTo(7200000);
    }

    @Test
    void 음수_용량은_거부() {
        assertThatThrownBy(() -> new MemoryConfig().withEventLogCapacity(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("eventLogCapacity must be positive (current: 0)");
    }

    @Test
    void 콜론이_포함된_네임스페이스는_거부() {
        assertThatThrownBy(() -> new MemoryConfig().withNamespace("a:b"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
