package com.umitunal.qrunner.model;

import com.umitunal.qrunner.core.JobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JobRecordTest {

    @Test
    @DisplayName("New records should be queued now with try number one")
    void testDefaults() {
        JobRecord record = new JobRecord();

        assertThat(record.getId()).isNull();
        assertThat(record.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(record.getTryNumber()).isEqualTo(1);
        assertThat(record.getQueueDate()).isNotNull();
    }

    @Test
    @DisplayName("Id should be immutable once assigned")
    void testIdImmutable() {
        JobRecord record = new JobRecord();
        record.setId(10L);
        record.setId(10L);

        assertThat(record.getId()).isEqualTo(10L);
        assertThatThrownBy(() -> record.setId(11L)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Copies should be independent")
    void testCopy() {
        JobRecord record = new JobRecord();
        record.setId(3L);
        record.setName("original");

        JobRecord copy = record.copy();
        copy.setName("changed");
        copy.setStatus(JobStatus.STARTED);

        assertThat(record.getName()).isEqualTo("original");
        assertThat(record.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(copy.getId()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Should reject invalid values")
    void testValidation() {
        JobRecord record = new JobRecord();

        assertThatThrownBy(() -> record.setTryNumber(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> record.setStatus(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> record.setQueueDate(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Status helpers should classify states")
    void testStatusClassification() {
        assertThat(JobStatus.STARTED.isInFlight()).isTrue();
        assertThat(JobStatus.CANCELING.isInFlight()).isTrue();
        assertThat(JobStatus.QUEUED.isInFlight()).isFalse();
        assertThat(JobStatus.QUEUED.isTerminal()).isFalse();
        assertThat(JobStatus.FAILED_TO_LOAD_TYPE.isTerminal()).isTrue();
        assertThat(JobStatus.INTERRUPTED.isTerminal()).isTrue();
    }
}
