package com.ryuqq.swarm.core.handler;

import com.ryuqq.swarm.core.error.UnregisteredTaskTypeException;
import com.ryuqq.swarm.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskHandlerRegistry 테스트.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
class TaskHandlerRegistryTest {

    private final TaskHandler noop = (parameters, context) -> Map.of();

    @Test
    void register_WithoutCapabilities_UsesTypeAsCapability() {
        // Given
        TaskHandlerRegistry registry = new TaskHandlerRegistry();

        // When
        registry.register("cleanup", noop);

        // Then
        assertEquals(Set.of("cleanup"), registry.capabilitiesFor("cleanup"));
        assertSame(noop, registry.require("cleanup"));
    }

    @Test
    void register_WithCapabilities_KeepsThem() {
        // Given
        TaskHandlerRegistry registry = new TaskHandlerRegistry();

        // When
        registry.register("filter_csv", noop, Set.of("data_processing", "csv_handling"));

        // Then
        assertEquals(Set.of("data_processing", "csv_handling"), registry.capabilitiesFor("filter_csv"));
        assertTrue(registry.isRegistered("filter_csv"));
    }

    @Test
    void require_UnregisteredType_ThrowsConfigurationError() {
        // Given
        TaskHandlerRegistry registry = new TaskHandlerRegistry();

        // When & Then
        UnregisteredTaskTypeException exception = assertThrows(
            UnregisteredTaskTypeException.class,
            () -> registry.require("unknown")
        );
        assertEquals("unknown", exception.getTaskType());
        assertInstanceOf(ValidationException.class, exception);
        assertTrue(registry.find("unknown").isEmpty());
    }

    @Test
    void register_EmptyCapabilities_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalArgumentException.class,
            () -> new TaskHandlerRegistry().register("x", noop, Set.of())
        );
    }
}
