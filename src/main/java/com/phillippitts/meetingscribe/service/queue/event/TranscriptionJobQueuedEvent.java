package com.phillippitts.meetingscribe.service.queue.event;

import com.phillippitts.meetingscribe.domain.TranscriptionJob;

import java.time.Instant;

/**
 * Published when a job is accepted into the queue.
 *
 * @param job snapshot in {@code queued} status
 * @param timestamp when the job was accepted
 */
public record TranscriptionJobQueuedEvent(TranscriptionJob job, Instant timestamp) {
}
