package org.pricewatch.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobStateTest {

    @Test
    void testFromEngine_KnownStates() {
        assertThat(JobState.fromEngine("RUNNING")).isEqualTo(JobState.RUNNING);
        assertThat(JobState.fromEngine("SUCCEEDED")).isEqualTo(JobState.SUCCEEDED);
        assertThat(JobState.fromEngine("FAILED")).isEqualTo(JobState.FAILED);
        assertThat(JobState.fromEngine("CANCELLED")).isEqualTo(JobState.CANCELLED);
    }

    @Test
    void testFromEngine_QueuedIsStillRunning() {
        assertThat(JobState.fromEngine("QUEUED")).isEqualTo(JobState.RUNNING);
    }

    @Test
    void testFromEngine_UnrecognizedOrMissing_ShouldBeUnknown() {
        assertThat(JobState.fromEngine(null)).isEqualTo(JobState.UNKNOWN);
        assertThat(JobState.fromEngine("")).isEqualTo(JobState.UNKNOWN);
        assertThat(JobState.fromEngine("UNKNOWN_TO_SDK_VERSION")).isEqualTo(JobState.UNKNOWN);
        assertThat(JobState.fromEngine("PAUSED")).isEqualTo(JobState.UNKNOWN);
    }

    @Test
    void testFromEngine_IgnoresCaseAndWhitespace() {
        assertThat(JobState.fromEngine(" succeeded ")).isEqualTo(JobState.SUCCEEDED);
    }

    @Test
    void testIsTerminal() {
        assertThat(JobState.RUNNING.isTerminal()).isFalse();
        assertThat(JobState.SUCCEEDED.isTerminal()).isTrue();
        assertThat(JobState.FAILED.isTerminal()).isTrue();
        assertThat(JobState.CANCELLED.isTerminal()).isTrue();
        assertThat(JobState.UNKNOWN.isTerminal()).isTrue();
    }

    @Test
    void testJobStatus_BlankReasonIsDropped() {
        assertThat(new JobStatus(JobState.FAILED, "  ").getReason()).isNull();
        assertThat(new JobStatus(null, null).getState()).isEqualTo(JobState.UNKNOWN);
        assertThat(new JobStatus(JobState.FAILED, "syntax error").toString()).isEqualTo("FAILED: syntax error");
    }
}
