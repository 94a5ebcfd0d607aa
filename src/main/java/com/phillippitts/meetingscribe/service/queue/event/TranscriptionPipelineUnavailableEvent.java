package com.phillippitts.meetingscribe.service.queue.event;

import java.time.Instant;

/**
 * Published once when worker recreation gives up. Queued jobs stay queued until the pipeline is
 * resumed.
 *
 * @param consecutiveFailures failures that exhausted the recreation budget
 * @param stalledJobs number of jobs left in {@code queued}
 * @param at when recreation was abandoned
 */
public record TranscriptionPipelineUnavailableEvent(int consecutiveFailures, int stalledJobs, Instant at) {
}
