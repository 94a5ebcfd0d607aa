package com.phillippitts.meetingscribe.service.queue.event;

import com.phillippitts.meetingscribe.domain.TranscriptionJob;

import java.time.Instant;

/**
 * Published after every status or progress change of a job, including a return to
 * {@code queued} when its worker was retired mid-job.
 *
 * <p>PII note: the snapshot carries transcript text once completed; listeners that log must
 * truncate it.
 *
 * @param job snapshot after the change
 * @param timestamp when the change was applied
 */
public record TranscriptionJobUpdatedEvent(TranscriptionJob job, Instant timestamp) {
}
