package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.core.error.ValidationException;
import com.ryuqq.swarm.core.model.ResourceLimits;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AgentConfig 검증 테스트.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
class AgentConfigTest {

    private static AgentConfig valid() {
        return AgentConfig.of("agent-1", "Agent", List.of("analysis"));
    }

    @Test
    void null_값은_기본값으로_채워짐() {
        // when
        AgentConfig config = new AgentConfig("a", "A", null, null, null, null, null, 1000, 1);

        // then
        assertThat(config.type()).isEqualTo(AgentType.WORKER);
        assertThat(config.launchMode()).isEqualTo(LaunchMode.PROCESS);
        assertThat(config.capabilities()).isEmpty();
        assertThat(config.resourceLimits()).isEqualTo(ResourceLimits.defaults());
        assertThat(config.environment()).isEmpty();
    }

    @Test
    void 메모리_경계값() {
        // when & then
        assertThatCode(() -> valid().withResourceLimits(new ResourceLimits(8192, 100.0)).validate())
            .doesNotThrowAnyException();
        assertThatThrownBy(() -> valid().withResourceLimits(new ResourceLimits(8193, 50.0)).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessage("memoryMb must be in (0, 8192] (current: 8193, agent: agent-1)");
        assertThatThrownBy(() -> valid().withResourceLimits(new ResourceLimits(0, 50.0)).validate())
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void CPU_경계값() {
        // when & then
        assertThatThrownBy(() -> valid().withResourceLimits(new ResourceLimits(128, 100.5)).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("cpuPercent must be in (0, 100]");
        assertThatThrownBy(() -> valid().withResourceLimits(new ResourceLimits(128, -1.0)).validate())
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void 식별자와_capability_필수() {
        // when & then
        assertThatThrownBy(() -> valid().withId(" ").validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("id");
        assertThatThrownBy(() -> valid().withName("").validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("name");
        assertThatThrownBy(() -> valid().withCapabilities(null).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("capabilities");
        assertThatThrownBy(() -> valid().withMaxTasks(0).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("maxTasks");
    }

    @Test
    void 실행_모드_wire_이름은_대소문자를_무시() {
        // when & then
        assertThat(LaunchMode.fromWireName("IN_PROCESS")).isEqualTo(LaunchMode.IN_PROCESS);
        assertThat(LaunchMode.fromWireName("container")).isEqualTo(LaunchMode.CONTAINER);
        assertThatThrownBy(() -> LaunchMode.fromWireName("thread"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
