package com.phillippitts.meetingscribe.service.storage;

import com.phillippitts.meetingscribe.domain.TranscriptionStatus;

import java.util.Optional;

/**
 * Persists transcription outcomes against the meeting they belong to.
 *
 * <p>The queue manager calls {@link #recordTranscriptionResult} off its own thread and never waits
 * for it; implementations report failures by logging or by recording a failed status, not by
 * blocking the pipeline.
 */
public interface TranscriptionResultStore {

    /**
     * Records the latest transcription state of a meeting.
     *
     * @param eventId meeting identifier
     * @param status latest job status
     * @param transcript transcript text (completed only, nullable)
     * @param error failure reason (failed only, nullable)
     * @param progress percent complete (transcribing only, nullable)
     */
    void recordTranscriptionResult(String eventId, TranscriptionStatus status, String transcript,
                                   String error, Integer progress);

    /**
     * @return the stored transcript of the meeting, if one was written
     */
    Optional<StoredTranscript> loadTranscript(String eventId);

    /**
     * Remembers the recordings of a meeting so that transcription can be retried later.
     */
    void saveRecordingPaths(String eventId, RecordingPaths paths);

    Optional<RecordingPaths> loadRecordingPaths(String eventId);
}
