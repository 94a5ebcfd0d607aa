package com.phillippitts.meetingscribe.service.queue.event;

import java.time.Instant;

/**
 * Published when the worker could not be created, reported a fault, exited abnormally or
 * refused a job.
 *
 * @param reason technical description of the fault
 * @param consecutiveFailures failures since the worker was last known good
 * @param recreationScheduled whether another worker will be started after the recreation delay
 * @param at when the fault was handled
 */
public record WorkerFailureEvent(
        String reason,
        int consecutiveFailures,
        boolean recreationScheduled,
        Instant at
) {
    public WorkerFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
