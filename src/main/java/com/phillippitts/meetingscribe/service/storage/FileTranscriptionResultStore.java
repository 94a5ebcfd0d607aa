package com.phillippitts.meetingscribe.service.storage;

import com.phillippitts.meetingscribe.config.properties.StorageProperties;
import com.phillippitts.meetingscribe.domain.TranscriptionStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TranscriptionResultStore} keeping one JSON document per meeting.
 *
 * <pre>
 * &lt;data&gt;/meetings/&lt;eventId&gt;.json                  status, progress, error, transcript path, recordings
 * &lt;data&gt;/transcripts/&lt;eventId&gt;_&lt;epochMillis&gt;.txt   completed transcripts
 * </pre>
 *
 * <p>Documents are rewritten through a temp file and an atomic move. All methods are synchronized;
 * writes come from the persistence pool and reads from request threads.
 */
@Component
public class FileTranscriptionResultStore implements TranscriptionResultStore {

    private static final Logger LOG = LogManager.getLogger(FileTranscriptionResultStore.class);

    static final String KEY_STATUS = "transcriptStatus";
    static final String KEY_PROGRESS = "transcriptProgress";
    static final String KEY_ERROR = "transcriptError";
    static final String KEY_PATH = "transcriptPath";
    static final String KEY_RECORDINGS = "recordingPaths";
    static final String KEY_LAST_UPDATED = "lastUpdated";

    private final Path meetingsDir;
    private final Path transcriptsDir;

    public FileTranscriptionResultStore(StorageProperties props) {
        Objects.requireNonNull(props, "props");
        Path root = Path.of(props.dataDirectory()).toAbsolutePath().normalize();
        this.meetingsDir = root.resolve("meetings");
        this.transcriptsDir = root.resolve("transcripts");
        LOG.info("Transcription results stored under {}", root);
    }

    @Override
    public synchronized void recordTranscriptionResult(String eventId, TranscriptionStatus status, String transcript,
                                                       String error, Integer progress) {
        if (eventId == null || eventId.isBlank()) {
            LOG.error("Attempted to save transcription result with empty eventId");
            return;
        }
        Objects.requireNonNull(status, "status");

        JSONObject doc = readDocument(eventId);
        doc.put(KEY_STATUS, status.toString());
        if (progress != null) {
            doc.put(KEY_PROGRESS, progress.intValue());
        }
        if (status != TranscriptionStatus.FAILED) {
            doc.remove(KEY_ERROR);
        }

        if (status == TranscriptionStatus.COMPLETED && transcript != null && !transcript.isEmpty()) {
            Path file = transcriptsDir.resolve(safeName(eventId) + "_" + System.currentTimeMillis() + ".txt");
            try {
                Files.createDirectories(transcriptsDir);
                Files.writeString(file, transcript, StandardCharsets.UTF_8);
                doc.put(KEY_PATH, file.toString());
                LOG.info("Transcript for event {} written to {}", eventId, file);
            } catch (IOException e) {
                LOG.error("Failed to write transcript file for event {}: {}", eventId, e.toString());
                doc.put(KEY_STATUS, TranscriptionStatus.FAILED.toString());
                doc.put(KEY_ERROR, "Failed to write transcript file: " + e.getMessage());
            }
        } else if (status == TranscriptionStatus.FAILED && error != null) {
            doc.put(KEY_ERROR, error);
        }

        writeDocument(eventId, doc);
    }

    @Override
    public synchronized Optional<StoredTranscript> loadTranscript(String eventId) {
        Path docFile = documentPath(eventId);
        if (!Files.exists(docFile)) {
            return Optional.empty();
        }
        JSONObject doc = readDocument(eventId);
        if (!doc.has(KEY_STATUS)) {
            return Optional.empty();
        }
        String transcriptPath = doc.optString(KEY_PATH, null);
        String transcript = null;
        if (transcriptPath != null) {
            Path file = Path.of(transcriptPath);
            if (Files.exists(file)) {
                try {
                    transcript = Files.readString(file, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    LOG.warn("Failed to read transcript {} for event {}: {}", file, eventId, e.toString());
                }
            } else {
                LOG.warn("Transcript file for event {} is missing: {}", eventId, file);
            }
        }
        Integer progress = doc.has(KEY_PROGRESS) ? doc.optInt(KEY_PROGRESS) : null;
        Instant lastUpdated = doc.has(KEY_LAST_UPDATED) ? Instant.ofEpochMilli(doc.optLong(KEY_LAST_UPDATED)) : null;
        return Optional.of(new StoredTranscript(eventId, parseStatus(doc.optString(KEY_STATUS)), transcript,
                transcriptPath, doc.optString(KEY_ERROR, null), progress, lastUpdated));
    }

    @Override
    public synchronized void saveRecordingPaths(String eventId, RecordingPaths paths) {
        if (eventId == null || eventId.isBlank()) {
            LOG.error("Attempted to save recording paths with empty eventId");
            return;
        }
        Objects.requireNonNull(paths, "paths");
        JSONObject doc = readDocument(eventId);
        JSONObject recordings = new JSONObject();
        recordings.put("system", paths.systemAudioPath());
        recordings.put("mic", paths.micAudioPath());
        doc.put(KEY_RECORDINGS, recordings);
        writeDocument(eventId, doc);
        LOG.debug("Saved recording paths for event {}", eventId);
    }

    @Override
    public synchronized Optional<RecordingPaths> loadRecordingPaths(String eventId) {
        if (!Files.exists(documentPath(eventId))) {
            return Optional.empty();
        }
        JSONObject recordings = readDocument(eventId).optJSONObject(KEY_RECORDINGS);
        if (recordings == null) {
            return Optional.empty();
        }
        String system = recordings.optString("system", null);
        String mic = recordings.optString("mic", null);
        if (system == null || mic == null) {
            return Optional.empty();
        }
        return Optional.of(new RecordingPaths(system, mic));
    }

    private JSONObject readDocument(String eventId) {
        Path file = documentPath(eventId);
        if (!Files.exists(file)) {
            return new JSONObject();
        }
        try {
            return new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read meeting data " + file, e);
        } catch (JSONException e) {
            LOG.warn("Meeting data {} is not valid JSON; starting a new document: {}", file, e.getMessage());
            return new JSONObject();
        }
    }

    private void writeDocument(String eventId, JSONObject doc) {
        doc.put(KEY_LAST_UPDATED, System.currentTimeMillis());
        Path file = documentPath(eventId);
        try {
            Files.createDirectories(meetingsDir);
            Path tmp = Files.createTempFile(meetingsDir, safeName(eventId), ".tmp");
            Files.writeString(tmp, doc.toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write meeting data " + file, e);
        }
    }

    private Path documentPath(String eventId) {
        return meetingsDir.resolve(safeName(eventId) + ".json");
    }

    /**
     * Event ids come from calendar providers; keep them from escaping the data directory.
     */
    static String safeName(String eventId) {
        return eventId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static TranscriptionStatus parseStatus(String value) {
        try {
            return TranscriptionStatus.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown stored transcription status '{}'", value);
            return null;
        }
    }
}
