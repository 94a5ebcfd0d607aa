package com.phillippitts.meetingscribe.service.storage;

import com.phillippitts.meetingscribe.domain.TranscriptionStatus;

import java.time.Instant;

/**
 * Persisted transcription state of a meeting.
 *
 * @param eventId meeting identifier
 * @param status last recorded status
 * @param transcript transcript text, null unless a transcript file exists
 * @param transcriptPath location of the transcript file (nullable)
 * @param error last failure reason (nullable)
 * @param progress last reported progress (nullable)
 * @param lastUpdated when the state was last written
 */
public record StoredTranscript(
        String eventId,
        TranscriptionStatus status,
        String transcript,
        String transcriptPath,
        String error,
        Integer progress,
        Instant lastUpdated
) {
}
