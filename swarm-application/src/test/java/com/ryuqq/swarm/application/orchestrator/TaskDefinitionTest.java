package com.ryuqq.swarm.application.orchestrator;

import com.ryuqq.swarm.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskDefinition 유닛 테스트.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
class TaskDefinitionTest {

    @Test
    void of_기본값_적용() {
        // when
        TaskDefinition definition = TaskDefinition.of("upload");

        // then
        assertThat(definition.key()).isNull();
        assertThat(definition.priority()).isEqualTo(5);
        assertThat(definition.maxRetries()).isEqualTo(3);
        assertThat(definition.dependencies()).isEmpty();
        assertThat(definition.requiredCapabilities()).isEmpty();
        assertThat(definition.parameters()).isEmpty();
    }

    @Test
    void with_메서드는_새_인스턴스를_반환() {
        // given
        TaskDefinition base = TaskDefinition.of("filter");

        // when
        TaskDefinition derived = base.withKey("f").withPriority(8).withDependencies("download")
            .withRequiredCapabilities("filtering");

        // then
        assertThat(base.key()).isNull();
        assertThat(derived.key()).isEqualTo("f");
        assertThat(derived.priority()).isEqualTo(8);
        assertThat(derived.dependencies()).containsExactly("download");
        assertThat(derived.requiredCapabilities()).containsExactly("filtering");
    }

    @Test
    void maxRetries_0은_거부() {
        assertThatThrownBy(() -> TaskDefinition.of("upload").withMaxRetries(0))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("maxRetries must be positive (current: 0)");
    }

    @Test
    void 빈_타입은_거부() {
        assertThatThrownBy(() -> TaskDefinition.of(" "))
            .isInstanceOf(ValidationException.class);
    }
}
