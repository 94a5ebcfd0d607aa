package com.phillippitts.meetingscribe.service.metrics;

import com.phillippitts.meetingscribe.domain.TranscriptionJob;
import com.phillippitts.meetingscribe.domain.TranscriptionStatus;
import com.phillippitts.meetingscribe.service.queue.event.TranscriptionJobQueuedEvent;
import com.phillippitts.meetingscribe.service.queue.event.TranscriptionJobUpdatedEvent;
import com.phillippitts.meetingscribe.service.queue.event.TranscriptionPipelineUnavailableEvent;
import com.phillippitts.meetingscribe.service.queue.event.WorkerFailureEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptionMetricsTest {

    private MeterRegistry registry;
    private TranscriptionMetrics metrics;
    private TranscriptionJob job;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TranscriptionMetrics(registry);
        job = TranscriptionJob.queued("evt-1", "/r/sys.wav", "/r/mic.wav", null);
    }

    private double jobs(String outcome) {
        Counter counter = registry.find("meetingscribe.transcription.jobs").tag("outcome", outcome).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void shouldCountQueuedJobs() {
        metrics.onQueued(new TranscriptionJobQueuedEvent(job, Instant.now()));
        metrics.onQueued(new TranscriptionJobQueuedEvent(job, Instant.now()));

        assertThat(jobs("queued")).isEqualTo(2.0);
    }

    @Test
    void shouldRecordDurationOfCompletedJob() {
        TranscriptionJob done = job.transition(TranscriptionStatus.COMPLETED, null, null, "text", null);

        metrics.onUpdated(new TranscriptionJobUpdatedEvent(done, job.createdAt().plusMillis(1500)));

        assertThat(jobs("completed")).isEqualTo(1.0);
        Timer timer = registry.find("meetingscribe.transcription.duration").tag("outcome", "completed").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(1500.0);
    }

    @Test
    void shouldCountFailedJobs() {
        TranscriptionJob failed = job.transition(TranscriptionStatus.FAILED, null, "boom", null, null);

        metrics.onUpdated(new TranscriptionJobUpdatedEvent(failed, Instant.now()));

        assertThat(jobs("failed")).isEqualTo(1.0);
    }

    @Test
    void shouldIgnoreNonTerminalUpdates() {
        TranscriptionJob mixing = job.transition(TranscriptionStatus.MIXING, null, null, null, null);

        metrics.onUpdated(new TranscriptionJobUpdatedEvent(mixing, Instant.now()));

        assertThat(registry.find("meetingscribe.transcription.jobs").counters()).isEmpty();
        assertThat(registry.find("meetingscribe.transcription.duration").timer()).isNull();
    }

    @Test
    void shouldCountWorkerFailuresAndUnavailability() {
        metrics.onWorkerFailure(new WorkerFailureEvent("Worker exited with code 1", 1, true, Instant.now()));
        metrics.onWorkerFailure(new WorkerFailureEvent("Worker exited with code 1", 2, true, Instant.now()));
        metrics.onPipelineUnavailable(new TranscriptionPipelineUnavailableEvent(6, 2, Instant.now()));

        assertThat(registry.find("meetingscribe.transcription.worker.failures").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("meetingscribe.transcription.unavailable").counter().count()).isEqualTo(1.0);
    }
}
