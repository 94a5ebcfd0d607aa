package com.phillippitts.meetingscribe.config.transcription;

import com.phillippitts.meetingscribe.config.properties.WhisperProperties;
import com.phillippitts.meetingscribe.service.paths.TranscriptionDependencies;
import com.phillippitts.meetingscribe.service.paths.TranscriptionPaths;
import com.phillippitts.meetingscribe.service.paths.WhisperModel;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reports at startup whether whisper.cpp, ffmpeg and the default model are installed.
 *
 * <p>Problems are logged as warnings with a fix hint; startup continues so that the REST surface
 * stays usable and jobs fail individually with a precise reason.
 */
@Component
@ConditionalOnProperty(name = "transcription.validation.enabled", havingValue = "true", matchIfMissing = true)
class TranscriptionSetupValidator {

    private static final Logger LOG = LogManager.getLogger(TranscriptionSetupValidator.class);

    private static final long BYTES_PER_MB = 1024 * 1024;

    private final TranscriptionPaths paths;
    private final WhisperProperties whisper;

    TranscriptionSetupValidator(TranscriptionPaths paths, WhisperProperties whisper) {
        this.paths = paths;
        this.whisper = whisper;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Checking transcription setup... os={}, arch={}, assets='{}'",
                System.getProperty("os.name"), System.getProperty("os.arch"), paths.assetsDirectory());
        List<String> problems = findProblems();
        if (problems.isEmpty()) {
            LOG.info("Transcription setup OK: default model '{}'", whisper.defaultModel());
        } else {
            problems.forEach(p -> LOG.warn("Transcription setup: {}", p));
        }
    }

    // Visible for tests
    List<String> findProblems() {
        List<String> problems = new ArrayList<>();
        if (!Files.isDirectory(paths.assetsDirectory())) {
            problems.add("assets directory not found: " + paths.assetsDirectory());
        }

        TranscriptionDependencies deps = paths.checkDependencies();
        if (!deps.whisper().exists()) {
            problems.add("whisper binary not found: " + deps.whisper().path());
        } else if (!Files.isExecutable(Path.of(deps.whisper().path()))) {
            problems.add("whisper binary not executable: " + deps.whisper().path() + hint(deps.whisper().path()));
        }
        if (!deps.ffmpeg().exists()) {
            problems.add("ffmpeg not found: " + deps.ffmpeg().path());
        } else if (!Files.isExecutable(Path.of(deps.ffmpeg().path()))) {
            problems.add("ffmpeg not executable: " + deps.ffmpeg().path() + hint(deps.ffmpeg().path()));
        }

        for (WhisperModel model : deps.models()) {
            LOG.info("Whisper model available: {} ({} MB)", model.name(), model.sizeBytes() / BYTES_PER_MB);
        }
        Path defaultModel = paths.modelFilePath(TranscriptionPaths.modelFileName(whisper.defaultModel()));
        if (!Files.exists(defaultModel)) {
            problems.add("default whisper model '" + whisper.defaultModel() + "' not found: " + defaultModel);
        }
        return problems;
    }

    private static String hint(String binary) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("mac")
                ? " (try: chmod +x '" + binary + "' && xattr -dr com.apple.quarantine '" + binary + "')"
                : " (try: chmod +x '" + binary + "')";
    }
}
