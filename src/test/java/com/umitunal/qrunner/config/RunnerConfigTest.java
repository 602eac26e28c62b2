package com.umitunal.qrunner.config;

import com.umitunal.qrunner.schedule.Schedule;
import com.umitunal.qrunner.serialization.KryoCodec;
import com.umitunal.qrunner.worker.PersistedJobRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class RunnerConfigTest {

    @Test
    @DisplayName("Defaults should match the documented values")
    void testDefaults() {
        RunnerConfig config = RunnerConfig.defaults();

        assertThat(config.getHeartbeat()).isEqualTo(10000);
        assertThat(config.getMaximumConcurrency()).isEqualTo(25);
        assertThat(config.getRetryTimeout()).isEqualTo(60000);
        assertThat(config.isDeleteRecordsOnSuccess()).isFalse();
        assertThat(config.getSchedules()).isEmpty();
        assertThat(config.getPersistencePath().isAbsolute()).isTrue();
        assertThat(config.getPersistencePath().getFileName().toString()).isEqualTo("qrunner-running.json");
        assertThat(config.getRecoveryCodec()).isNotNull();
    }

    @Test
    @DisplayName("Values below one should fall back to the defaults")
    void testFallbackToDefaults() {
        RunnerConfig config = RunnerConfig.newBuilder()
                .withHeartbeat(0)
                .withMaximumConcurrency(-5)
                .withRetryTimeout(0)
                .build();

        assertThat(config.getHeartbeat()).isEqualTo(RunnerConfig.DEFAULT_HEARTBEAT);
        assertThat(config.getMaximumConcurrency()).isEqualTo(RunnerConfig.DEFAULT_MAXIMUM_CONCURRENCY);
        assertThat(config.getRetryTimeout()).isEqualTo(RunnerConfig.DEFAULT_RETRY_TIMEOUT);
    }

    @Test
    @DisplayName("Should keep configured values")
    void testConfiguredValues() {
        KryoCodec<PersistedJobRun[]> codec = new KryoCodec<>(PersistedJobRun[].class);
        Schedule schedule = Schedule.newBuilder("nightly").repeatHours(24).build();

        RunnerConfig config = RunnerConfig.newBuilder()
                .withPersistencePath(Path.of("state", "running.bin"))
                .withDeleteRecordsOnSuccess(true)
                .withHeartbeat(500)
                .withMaximumConcurrency(4)
                .withRetryTimeout(2000)
                .addSchedule(schedule)
                .withRecoveryCodec(codec)
                .build();

        assertThat(config.getPersistencePath()).isEqualTo(Path.of("state", "running.bin").toAbsolutePath());
        assertThat(config.isDeleteRecordsOnSuccess()).isTrue();
        assertThat(config.getHeartbeat()).isEqualTo(500);
        assertThat(config.getMaximumConcurrency()).isEqualTo(4);
        assertThat(config.getRetryTimeout()).isEqualTo(2000);
        assertThat(config.getSchedules()).containsExactly(schedule);
        assertThat(config.getRecoveryCodec()).isSameAs(codec);
    }

    @Test
    @DisplayName("Storage config should reject invalid sizes")
    void testStorageConfigValidation() {
        assertThatThrownBy(() -> StorageConfig.newBuilder("").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StorageConfig.newBuilder("data").withBlockCacheSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);

        StorageConfig config = StorageConfig.newBuilder("data").build();
        assertThat(config.isDurableWrites()).isTrue();
        assertThat(config.getWriteBufferSizeMB()).isEqualTo(16);
    }
}
