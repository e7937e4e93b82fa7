package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.core.error.ValidationException;
import com.ryuqq.swarm.core.model.ResourceLimits;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AgentTemplates 테스트.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
class AgentTemplatesTest {

    private final AgentTemplates templates = AgentTemplates.defaults();

    @Test
    void 기본_템플릿_5종() {
        // when & then
        assertThat(templates.names())
            .containsExactlyInAnyOrder("data_processor", "uploader", "cleanup_agent", "parallel_analyzer", "monitor_agent");
        AgentConfig monitor = templates.find("monitor_agent").orElseThrow();
        assertThat(monitor.launchMode()).isEqualTo(LaunchMode.IN_PROCESS);
        assertThat(monitor.type()).isEqualTo(AgentType.MONITOR);
        assertThat(monitor.resourceLimits()).isEqualTo(new ResourceLimits(64, 10.0));
        assertThat(monitor.maxTasks()).isEqualTo(5);
        assertThat(templates.find("uploader").orElseThrow().capabilities())
            .containsExactly("upload", "product_upload", "rate_limiting");
    }

    @Test
    void 템플릿으로_생성하면_이름_기반_ID가_부여됨() {
        // when
        AgentConfig first = templates.create("data_processor", null);
        AgentConfig second = templates.create("data_processor", Map.of());

        // then
        assertThat(first.id()).matches("data_processor_[0-9a-f]{8}");
        assertThat(second.id()).isNotEqualTo(first.id());
        assertThat(first.capabilities()).containsExactly("data_processing", "csv_handling", "filtering");
        assertThat(first.resourceLimits()).isEqualTo(new ResourceLimits(512, 50.0));
        assertThat(first.maxTasks()).isEqualTo(2);
    }

    @Test
    void 중첩_맵은_병합되고_스칼라와_리스트는_교체() {
        // when
        AgentConfig agent = templates.create("cleanup_agent", Map.of(
            "id", "cleanup-7",
            "max_tasks", 6,
            "capabilities", List.of("cleanup"),
            "resource_limits", Map.of("memory_mb", 256),
            "environment", Map.of("CLEANUP_ROOT", "/data")
        ));

        // then
        assertThat(agent.id()).isEqualTo("cleanup-7");
        assertThat(agent.maxTasks()).isEqualTo(6);
        assertThat(agent.capabilities()).containsExactly("cleanup");
        assertThat(agent.resourceLimits()).isEqualTo(new ResourceLimits(256, 20.0));
        assertThat(agent.environment()).containsEntry("CLEANUP_ROOT", "/data");
        assertThat(agent.name()).isEqualTo("Cleanup Agent");
    }

    @Test
    void 알_수_없는_override_키는_무시() {
        // when
        AgentConfig agent = templates.create("uploader", Map.of("shop_domain", "example.myshopify.com", "launch_mode", "in_process"));

        // then
        assertThat(agent.launchMode()).isEqualTo(LaunchMode.IN_PROCESS);
        assertThat(agent.capabilities()).containsExactly("upload", "product_upload", "rate_limiting");
    }

    @Test
    void 알_수_없는_템플릿이나_잘못된_값은_ValidationException() {
        // when & then
        assertThatThrownBy(() -> templates.create("shopify_uploader", null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Unknown agent template: shopify_uploader");
        assertThatThrownBy(() -> templates.create("uploader", Map.of("max_tasks", "many")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Invalid overrides for template uploader");
    }

    @Test
    void capability로_템플릿_조회와_사용자_템플릿_등록() {
        // given
        templates.register("reporter", AgentConfig.of("ignored", "Reporter", List.of("reporting")));
        templates.mapCapability("reporting", "reporter");

        // when & then
        assertThat(templates.templateForCapability("csv_handling")).hasValue("data_processor");
        assertThat(templates.templateForCapability("health_check")).hasValue("monitor_agent");
        assertThat(templates.templateForCapability("rate_limiting")).isEmpty();
        assertThat(templates.templateForCapability("reporting")).hasValue("reporter");
        assertThat(templates.create("reporter", null).id()).startsWith("reporter_");
        assertThatThrownBy(() -> templates.mapCapability("x", "missing"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
