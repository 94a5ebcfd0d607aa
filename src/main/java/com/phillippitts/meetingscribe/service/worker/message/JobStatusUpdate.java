package com.phillippitts.meetingscribe.service.worker.message;

import com.phillippitts.meetingscribe.domain.TranscriptionJob;
import com.phillippitts.meetingscribe.domain.TranscriptionStatus;

import java.util.Objects;

/**
 * A job moved to a new status, or reported new progress while transcribing.
 *
 * <p>Optional fields are null when they do not apply to the status.
 */
public record JobStatusUpdate(
        String jobId,
        String eventId,
        TranscriptionStatus status,
        Integer progress,
        String error,
        String transcript,
        String mixedAudioPath
) implements WorkerMessage {

    public JobStatusUpdate {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(status, "status");
    }

    public static JobStatusUpdate mixing(TranscriptionJob job) {
        return new JobStatusUpdate(job.jobId(), job.eventId(), TranscriptionStatus.MIXING,
                null, null, null, null);
    }

    public static JobStatusUpdate transcribing(TranscriptionJob job, int progress, String mixedAudioPath) {
        return new JobStatusUpdate(job.jobId(), job.eventId(), TranscriptionStatus.TRANSCRIBING,
                progress, null, null, mixedAudioPath);
    }

    public static JobStatusUpdate progress(TranscriptionJob job, int progress) {
        return transcribing(job, progress, null);
    }

    public static JobStatusUpdate completed(TranscriptionJob job, String transcript) {
        return new JobStatusUpdate(job.jobId(), job.eventId(), TranscriptionStatus.COMPLETED,
                null, null, transcript == null ? "" : transcript, null);
    }

    public static JobStatusUpdate failed(TranscriptionJob job, String error) {
        return new JobStatusUpdate(job.jobId(), job.eventId(), TranscriptionStatus.FAILED,
                null, error, null, null);
    }
}
