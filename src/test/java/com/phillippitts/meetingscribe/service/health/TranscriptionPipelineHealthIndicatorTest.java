package com.phillippitts.meetingscribe.service.health;

import com.phillippitts.meetingscribe.domain.TranscriptionStatus;
import com.phillippitts.meetingscribe.service.queue.PipelineState;
import com.phillippitts.meetingscribe.service.queue.TranscriptionQueueManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TranscriptionPipelineHealthIndicatorTest {

    private TranscriptionQueueManager queue;
    private TranscriptionPipelineHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        queue = mock(TranscriptionQueueManager.class);
        Map<TranscriptionStatus, Long> counts = new EnumMap<>(TranscriptionStatus.class);
        for (TranscriptionStatus s : TranscriptionStatus.values()) {
            counts.put(s, 0L);
        }
        counts.put(TranscriptionStatus.QUEUED, 3L);
        when(queue.jobCounts()).thenReturn(counts);
        indicator = new TranscriptionPipelineHealthIndicator(queue);
    }

    @Test
    void shouldReportUpWhenWorkerRunning() {
        when(queue.pipelineState()).thenReturn(PipelineState.RUNNING);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("state", "RUNNING");
        assertThat(health.getDetails()).containsEntry("queued", 3L);
        assertThat(health.getDetails()).containsEntry("completed", 0L);
    }

    @Test
    void shouldReportDegradedWhileRecovering() {
        when(queue.pipelineState()).thenReturn(PipelineState.RECOVERING);

        assertThat(indicator.health().getStatus()).isEqualTo(new Status("DEGRADED"));
    }

    @Test
    void shouldReportDegradedWhilePaused() {
        when(queue.pipelineState()).thenReturn(PipelineState.PAUSED);

        assertThat(indicator.health().getStatus()).isEqualTo(new Status("DEGRADED"));
    }

    @Test
    void shouldReportDownWhenRecreationAbandoned() {
        when(queue.pipelineState()).thenReturn(PipelineState.UNAVAILABLE);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("state", "UNAVAILABLE");
    }

    @Test
    void shouldReportDownAfterShutdown() {
        when(queue.pipelineState()).thenReturn(PipelineState.STOPPED);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
