package com.phillippitts.meetingscribe.service.health;

import com.phillippitts.meetingscribe.domain.TranscriptionStatus;
import com.phillippitts.meetingscribe.service.queue.PipelineState;
import com.phillippitts.meetingscribe.service.queue.TranscriptionQueueManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for the transcription pipeline.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: worker running</li>
 *   <li>DEGRADED: worker being recreated, or dispatch paused</li>
 *   <li>DOWN: recreation given up, or queue shut down</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint with job counts per status as details.
 */
@Component
public class TranscriptionPipelineHealthIndicator implements HealthIndicator {

    private final TranscriptionQueueManager queue;

    public TranscriptionPipelineHealthIndicator(TranscriptionQueueManager queue) {
        this.queue = queue;
    }

    @Override
    public Health health() {
        PipelineState state = queue.pipelineState();
        Health.Builder builder = switch (state) {
            case RUNNING -> Health.up();
            case RECOVERING, PAUSED -> Health.status("DEGRADED");
            case UNAVAILABLE, STOPPED -> Health.down();
        };
        builder.withDetail("state", state.name());
        for (Map.Entry<TranscriptionStatus, Long> entry : queue.jobCounts().entrySet()) {
            builder.withDetail(entry.getKey().toString(), entry.getValue());
        }
        return builder.build();
    }
}
