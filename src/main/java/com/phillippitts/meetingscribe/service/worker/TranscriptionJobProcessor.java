package com.phillippitts.meetingscribe.service.worker;

import com.phillippitts.meetingscribe.config.properties.WhisperProperties;
import com.phillippitts.meetingscribe.domain.TranscriptionJob;
import com.phillippitts.meetingscribe.exception.EngineStartException;
import com.phillippitts.meetingscribe.exception.TranscriptionException;
import com.phillippitts.meetingscribe.service.audio.AudioMixer;
import com.phillippitts.meetingscribe.service.paths.TranscriptionPaths;
import com.phillippitts.meetingscribe.service.stt.whisper.WhisperInvocation;
import com.phillippitts.meetingscribe.service.stt.whisper.WhisperProcessManager;
import com.phillippitts.meetingscribe.service.worker.message.JobStatusUpdate;
import com.phillippitts.meetingscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Takes one job through mixing and transcription, reporting every transition.
 *
 * <p>Every job-level failure ends in a {@code failed} update; nothing is thrown back to the
 * worker loop except {@link Error}s. Sequence for a successful job:
 * <pre>
 * mixing -> transcribing(0, mixedAudioPath) -> transcribing(n)* -> completed(transcript)
 * </pre>
 */
public class TranscriptionJobProcessor {

    private static final Logger LOG = LogManager.getLogger(TranscriptionJobProcessor.class);

    private static final int TRANSCRIPT_PREVIEW_CHARS = 80;

    private final AudioMixer mixer;
    private final TranscriptionPaths paths;
    private final WhisperProcessManager whisper;
    private final WhisperProperties whisperProps;

    public TranscriptionJobProcessor(AudioMixer mixer, TranscriptionPaths paths, WhisperProcessManager whisper,
                                     WhisperProperties whisperProps) {
        this.mixer = Objects.requireNonNull(mixer, "mixer");
        this.paths = Objects.requireNonNull(paths, "paths");
        this.whisper = Objects.requireNonNull(whisper, "whisper");
        this.whisperProps = Objects.requireNonNull(whisperProps, "whisperProps");
    }

    /**
     * Processes a job to a terminal status.
     *
     * @param job copy of the queued job
     * @param updates receives status updates; may be called from a stream-reader thread for progress
     */
    public void process(TranscriptionJob job, Consumer<JobStatusUpdate> updates) {
        ThreadContext.put("jobId", job.jobId());
        ThreadContext.put("eventId", job.eventId());
        try {
            run(job, updates);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error processing job", e);
            updates.accept(JobStatusUpdate.failed(job, "Unexpected error: " + e.getMessage()));
        } finally {
            ThreadContext.remove("jobId");
            ThreadContext.remove("eventId");
        }
    }

    private void run(TranscriptionJob job, Consumer<JobStatusUpdate> updates) {
        LOG.info("Processing job");
        updates.accept(JobStatusUpdate.mixing(job));

        Path mixed;
        try {
            Path systemAudio = Path.of(job.systemAudioPath());
            mixed = mixer.mix(systemAudio, Path.of(job.micAudioPath()), mixedOutputPath(job, systemAudio));
        } catch (RuntimeException e) {
            LOG.warn("Mixing failed: {}", e.getMessage());
            updates.accept(JobStatusUpdate.failed(job, "Mixing failed: " + e.getMessage()));
            return;
        }
        updates.accept(JobStatusUpdate.transcribing(job, 0, mixed.toString()));

        Path engine = paths.engineExecutablePath();
        if (!Files.exists(engine)) {
            fail(job, updates, "Whisper executable not found at: " + engine);
            return;
        }
        String modelName = job.modelName() != null ? job.modelName() : whisperProps.defaultModel();
        Path model = paths.modelFilePath(TranscriptionPaths.modelFileName(modelName));
        if (!Files.exists(model)) {
            fail(job, updates, "Whisper model not found at: " + model);
            return;
        }

        WhisperInvocation invocation = new WhisperInvocation(engine, model, mixed,
                whisperProps.language(), whisperProps.threads(), whisperProps.maxStdoutBytes());
        try {
            String transcript = whisper.transcribe(invocation,
                    progress -> updates.accept(JobStatusUpdate.progress(job, progress)));
            LOG.info("Transcription completed ({} chars): \"{}\"", transcript.length(),
                    LogSanitizer.singleLine(transcript, TRANSCRIPT_PREVIEW_CHARS));
            updates.accept(JobStatusUpdate.completed(job, transcript));
        } catch (EngineStartException e) {
            fail(job, updates, "Failed to start whisper process: " + e.getReason());
        } catch (TranscriptionException e) {
            if (e.hasExitCode()) {
                fail(job, updates, "Transcription failed with code " + e.getExitCode() + ": " + e.getDiagnostics());
            } else {
                fail(job, updates, "Transcription failed: " + e.getMessage());
            }
        }
    }

    private static void fail(TranscriptionJob job, Consumer<JobStatusUpdate> updates, String error) {
        LOG.warn("Job failed: {}", LogSanitizer.singleLine(error, 500));
        updates.accept(JobStatusUpdate.failed(job, error));
    }

    /**
     * Mixed output lives next to the system track as {@code <jobId>_mixed.wav}.
     */
    static Path mixedOutputPath(TranscriptionJob job, Path systemAudio) {
        Path dir = systemAudio.toAbsolutePath().getParent();
        String fileName = job.jobId() + "_mixed.wav";
        return dir != null ? dir.resolve(fileName) : Path.of(fileName);
    }
}
