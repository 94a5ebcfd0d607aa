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
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer instrumentation for the transcription pipeline, driven by queue events.
 *
 * <p>Provides:
 * <ul>
 *   <li>Job counts by outcome (queued, completed, failed)</li>
 *   <li>Job duration from submission to completion or failure</li>
 *   <li>Worker faults and pipeline unavailability</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class TranscriptionMetrics {

    private static final String METRIC_PREFIX = "meetingscribe.transcription";

    private final MeterRegistry registry;

    public TranscriptionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void onQueued(TranscriptionJobQueuedEvent event) {
        incrementJobs("queued");
    }

    @EventListener
    public void onUpdated(TranscriptionJobUpdatedEvent event) {
        TranscriptionJob job = event.job();
        if (!job.status().isTerminal()) {
            return;
        }
        String outcome = job.status() == TranscriptionStatus.COMPLETED ? "completed" : "failed";
        incrementJobs(outcome);
        Duration elapsed = Duration.between(job.createdAt(), event.timestamp());
        if (!elapsed.isNegative()) {
            Timer.builder(METRIC_PREFIX + ".duration")
                    .description("Time from submission to a finished job")
                    .tag("outcome", outcome)
                    .register(registry)
                    .record(elapsed);
        }
    }

    @EventListener
    public void onWorkerFailure(WorkerFailureEvent event) {
        Counter.builder(METRIC_PREFIX + ".worker.failures")
                .description("Number of worker faults handled by the queue manager")
                .register(registry)
                .increment();
    }

    @EventListener
    public void onPipelineUnavailable(TranscriptionPipelineUnavailableEvent event) {
        Counter.builder(METRIC_PREFIX + ".unavailable")
                .description("Number of times worker recreation was abandoned")
                .register(registry)
                .increment();
    }

    private void incrementJobs(String outcome) {
        Counter.builder(METRIC_PREFIX + ".jobs")
                .description("Number of transcription jobs by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
