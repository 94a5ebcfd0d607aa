package com.phillippitts.meetingscribe.service.transcription;

import com.phillippitts.meetingscribe.config.properties.WhisperProperties;
import com.phillippitts.meetingscribe.domain.TranscriptionJob;
import com.phillippitts.meetingscribe.exception.JobNotFoundException;
import com.phillippitts.meetingscribe.exception.RetryUnavailableException;
import com.phillippitts.meetingscribe.service.paths.TranscriptionDependencies;
import com.phillippitts.meetingscribe.service.paths.TranscriptionPaths;
import com.phillippitts.meetingscribe.service.queue.PipelineState;
import com.phillippitts.meetingscribe.service.queue.TranscriptionQueueManager;
import com.phillippitts.meetingscribe.service.storage.RecordingPaths;
import com.phillippitts.meetingscribe.service.storage.StoredTranscript;
import com.phillippitts.meetingscribe.service.storage.TranscriptionResultStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for callers that record meetings and want them transcribed.
 *
 * <p>Wraps {@link TranscriptionQueueManager} with the operations that need the store: remembering
 * recordings on submission and rebuilding a job from them on retry.
 */
@Service
public class TranscriptionService {

    private static final Logger LOG = LogManager.getLogger(TranscriptionService.class);

    static final String NO_PREVIOUS_JOB =
            "No previous transcription job found for this event. The recording files may have been deleted.";
    static final String AUDIO_UNAVAILABLE = "Audio files are no longer available. Please record again.";

    private final TranscriptionQueueManager queue;
    private final TranscriptionResultStore store;
    private final TranscriptionPaths paths;
    private final WhisperProperties whisperProps;

    public TranscriptionService(TranscriptionQueueManager queue, TranscriptionResultStore store,
                                TranscriptionPaths paths, WhisperProperties whisperProps) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.store = Objects.requireNonNull(store, "store");
        this.paths = Objects.requireNonNull(paths, "paths");
        this.whisperProps = Objects.requireNonNull(whisperProps, "whisperProps");
    }

    /**
     * Queues a meeting's recordings and remembers them for later retries.
     */
    public TranscriptionJob submit(String eventId, String systemAudioPath, String micAudioPath, String modelName) {
        TranscriptionJob job = queue.submit(eventId, systemAudioPath, micAudioPath, modelName);
        try {
            store.saveRecordingPaths(eventId, new RecordingPaths(systemAudioPath, micAudioPath));
        } catch (RuntimeException e) {
            // The job is already queued; only a later retry from stored paths is affected
            LOG.error("Failed to save recording paths for event {}: {}", eventId, e.toString());
        }
        return job;
    }

    /**
     * Queues a new job for a meeting from the best available inputs.
     *
     * <p>Inputs are taken, in order, from the given job of this meeting, from the recordings stored
     * for the meeting, and from the meeting's most recent job. Both files must still exist.
     *
     * @param eventId meeting identifier
     * @param jobId job to repeat (nullable)
     * @return the new queued job
     * @throws RetryUnavailableException if no usable inputs remain
     */
    public TranscriptionJob retry(String eventId, String jobId) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId must not be blank");
        }
        LOG.info("Retrying transcription for event {}, original job: {}", eventId, jobId != null ? jobId : "unknown");

        if (jobId != null && !jobId.isBlank()) {
            Optional<TranscriptionJob> original = queue.getJob(jobId).filter(j -> j.eventId().equals(eventId));
            if (original.isPresent()) {
                return resubmit(original.get(), "requested job");
            }
            LOG.debug("Job {} not found for event {}; falling back to stored recordings", jobId, eventId);
        }

        Optional<RecordingPaths> stored = store.loadRecordingPaths(eventId);
        if (stored.isPresent() && exists(stored.get().systemAudioPath()) && exists(stored.get().micAudioPath())) {
            TranscriptionJob job = queue.submit(eventId, stored.get().systemAudioPath(),
                    stored.get().micAudioPath(), whisperProps.defaultModel());
            LOG.info("Created job {} for retry of event {} using stored paths", job.jobId(), eventId);
            return job;
        }

        LOG.debug("Stored paths not available for event {}; checking queued jobs", eventId);
        // Jobs are kept in submission order
        List<TranscriptionJob> previous = queue.getJobsForEvent(eventId);
        if (previous.isEmpty()) {
            throw new RetryUnavailableException(eventId, NO_PREVIOUS_JOB);
        }
        return resubmit(previous.get(previous.size() - 1), "most recent job");
    }

    private TranscriptionJob resubmit(TranscriptionJob original, String source) {
        if (!exists(original.systemAudioPath()) || !exists(original.micAudioPath())) {
            throw new RetryUnavailableException(original.eventId(), AUDIO_UNAVAILABLE);
        }
        String model = original.modelName() != null ? original.modelName() : whisperProps.defaultModel();
        TranscriptionJob job = queue.submit(original.eventId(), original.systemAudioPath(),
                original.micAudioPath(), model);
        LOG.info("Created job {} for retry of event {} using {} {}", job.jobId(), original.eventId(), source,
                original.jobId());
        return job;
    }

    public List<TranscriptionJob> listJobs() {
        return queue.listJobs();
    }

    /**
     * @throws JobNotFoundException if the id is unknown
     */
    public TranscriptionJob getJob(String jobId) {
        return queue.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<TranscriptionJob> getJobsForEvent(String eventId) {
        return queue.getJobsForEvent(eventId);
    }

    public int purgeTerminal() {
        return queue.purgeTerminal();
    }

    public void pause(boolean terminate) {
        queue.pause(terminate);
    }

    public void resume() {
        queue.resume();
    }

    public PipelineState pipelineState() {
        return queue.pipelineState();
    }

    public Optional<StoredTranscript> loadTranscript(String eventId) {
        return store.loadTranscript(eventId);
    }

    public TranscriptionDependencies checkSetup() {
        return paths.checkDependencies();
    }

    private static boolean exists(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        try {
            return Files.exists(Path.of(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
