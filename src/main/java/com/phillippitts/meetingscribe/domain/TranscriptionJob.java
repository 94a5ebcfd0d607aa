package com.phillippitts.meetingscribe.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable snapshot of one request to mix and transcribe a pair of audio tracks.
 *
 * <p>The queue manager owns the authoritative sequence of snapshots for a job and replaces
 * its entry on every transition; the worker only ever receives a copy. Because the record is
 * immutable, every snapshot handed to callers is already a defensive copy.
 *
 * <p>Field presence follows the status:
 * <ul>
 *   <li>{@code progress} only while {@link TranscriptionStatus#TRANSCRIBING}</li>
 *   <li>{@code transcript} only when {@link TranscriptionStatus#COMPLETED}</li>
 *   <li>{@code error} only when {@link TranscriptionStatus#FAILED}</li>
 * </ul>
 *
 * @param jobId unique job identifier (generated)
 * @param eventId owning meeting identifier; several jobs may share one
 * @param systemAudioPath system (far-end) audio track
 * @param micAudioPath microphone audio track
 * @param mixedAudioPath mixed track, set once mixing succeeds (nullable)
 * @param status current lifecycle state
 * @param progress percent complete while transcribing (nullable)
 * @param transcript transcript text when completed (nullable)
 * @param error failure reason when failed (nullable)
 * @param modelName speech-to-text model override (nullable, default model applies)
 * @param createdAt creation timestamp
 */
public record TranscriptionJob(
        String jobId,
        String eventId,
        String systemAudioPath,
        String micAudioPath,
        String mixedAudioPath,
        TranscriptionStatus status,
        Integer progress,
        String transcript,
        String error,
        String modelName,
        Instant createdAt
) {

    public TranscriptionJob {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(eventId, "eventId must not be null");
        Objects.requireNonNull(systemAudioPath, "systemAudioPath must not be null");
        Objects.requireNonNull(micAudioPath, "micAudioPath must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (status != TranscriptionStatus.TRANSCRIBING) {
            progress = null;
        }
        if (status != TranscriptionStatus.COMPLETED) {
            transcript = null;
        }
        if (status != TranscriptionStatus.FAILED) {
            error = null;
        }
    }

    /**
     * Creates a new job in {@link TranscriptionStatus#QUEUED} with a random id.
     *
     * @param eventId owning meeting identifier
     * @param systemAudioPath system audio track
     * @param micAudioPath microphone audio track
     * @param modelName model override, or null for the default model
     * @return queued job snapshot
     * @throws IllegalArgumentException if any identifier or path is blank
     */
    public static TranscriptionJob queued(String eventId, String systemAudioPath, String micAudioPath,
                                          String modelName) {
        requireText(eventId, "eventId");
        requireText(systemAudioPath, "systemAudioPath");
        requireText(micAudioPath, "micAudioPath");
        String model = (modelName == null || modelName.isBlank()) ? null : modelName.trim();
        return new TranscriptionJob(UUID.randomUUID().toString(), eventId, systemAudioPath, micAudioPath,
                null, TranscriptionStatus.QUEUED, null, null, null, model, Instant.now());
    }

    /**
     * Returns the snapshot after a worker-reported transition. Null arguments keep the
     * current value; fields not valid for the new status are cleared.
     */
    public TranscriptionJob transition(TranscriptionStatus newStatus, Integer newProgress, String newError,
                                       String newTranscript, String newMixedAudioPath) {
        Objects.requireNonNull(newStatus, "newStatus must not be null");
        return new TranscriptionJob(
                jobId, eventId, systemAudioPath, micAudioPath,
                newMixedAudioPath != null ? newMixedAudioPath : mixedAudioPath,
                newStatus,
                newProgress != null ? newProgress : progress,
                newTranscript != null ? newTranscript : transcript,
                newError != null ? newError : error,
                modelName, createdAt);
    }

    /**
     * Returns this job back in the queue, dropping any per-attempt state.
     */
    public TranscriptionJob requeued() {
        return new TranscriptionJob(jobId, eventId, systemAudioPath, micAudioPath, null,
                TranscriptionStatus.QUEUED, null, null, null, modelName, createdAt);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
