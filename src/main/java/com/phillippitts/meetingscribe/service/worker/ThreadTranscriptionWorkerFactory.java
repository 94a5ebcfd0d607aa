package com.phillippitts.meetingscribe.service.worker;

import com.phillippitts.meetingscribe.config.properties.WhisperProperties;
import com.phillippitts.meetingscribe.exception.WorkerCreationException;
import com.phillippitts.meetingscribe.service.audio.AudioMixer;
import com.phillippitts.meetingscribe.service.paths.TranscriptionPaths;
import com.phillippitts.meetingscribe.service.process.ProcessFactory;
import com.phillippitts.meetingscribe.service.stt.whisper.WhisperProcessManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Creates {@link ThreadTranscriptionWorker}s after checking that the installation layout exists.
 *
 * <p>Each worker gets its own {@link WhisperProcessManager}, so a retired worker tearing down its
 * subprocess never touches the process of its replacement.
 */
@Component
public class ThreadTranscriptionWorkerFactory implements TranscriptionWorkerFactory {

    private static final Logger LOG = LogManager.getLogger(ThreadTranscriptionWorkerFactory.class);

    private final TranscriptionPaths paths;
    private final AudioMixer mixer;
    private final ProcessFactory processFactory;
    private final WhisperProperties whisperProps;

    public ThreadTranscriptionWorkerFactory(TranscriptionPaths paths, AudioMixer mixer,
                                            ProcessFactory processFactory, WhisperProperties whisperProps) {
        this.paths = Objects.requireNonNull(paths, "paths");
        this.mixer = Objects.requireNonNull(mixer, "mixer");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.whisperProps = Objects.requireNonNull(whisperProps, "whisperProps");
    }

    @Override
    public TranscriptionWorker create(WorkerListener listener) {
        Path assets = paths.assetsDirectory();
        if (!Files.isDirectory(assets)) {
            throw new WorkerCreationException("Transcription assets directory not found at: " + assets);
        }
        TranscriptionJobProcessor processor = new TranscriptionJobProcessor(mixer, paths,
                new WhisperProcessManager(processFactory), whisperProps);
        ThreadTranscriptionWorker worker = new ThreadTranscriptionWorker(processor, listener);
        worker.start();
        LOG.info("Transcription worker started (assets={})", assets);
        return worker;
    }
}
