package com.ryuqq.lifecycle.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskRunnerConfig, SchedulerConfig 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class RunnerConfigTest {

    @Test
    void taskRunnerConfig_Defaults() {
        TaskRunnerConfig config = new TaskRunnerConfig();

        assertEquals(1000, config.pollIntervalMs());
        assertEquals(0, config.probeRetryLimit());
        assertEquals(30000, config.maxProbeBackoffMs());
    }

    @Test
    void taskRunnerConfig_WithMethods_ReturnNewInstance() {
        TaskRunnerConfig config = new TaskRunnerConfig();

        TaskRunnerConfig changed = config.withProbeRetryLimit(3).withPollIntervalMs(50_000);

        assertEquals(3, changed.probeRetryLimit());
        assertEquals(50_000, changed.pollIntervalMs());
        assertEquals(50_000, changed.maxProbeBackoffMs());
        assertEquals(0, config.probeRetryLimit());
    }

    @Test
    void taskRunnerConfig_InvalidValues_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> new TaskRunnerConfig(0, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new TaskRunnerConfig(10, -1, 10));
        assertThrows(IllegalArgumentException.class, () -> new TaskRunnerConfig(10, 0, 5));
    }

    @Test
    void schedulerConfig_DefaultsAndValidation() {
        SchedulerConfig config = new SchedulerConfig();

        assertEquals(50, config.tickIntervalMs());
        assertEquals(60000, config.awaitTerminationMs());
        assertEquals(5, config.withTickIntervalMs(5).tickIntervalMs());
        assertThrows(IllegalArgumentException.class, () -> config.withTickIntervalMs(0));
        assertThrows(IllegalArgumentException.class, () -> config.withAwaitTerminationMs(-1));
    }
}
