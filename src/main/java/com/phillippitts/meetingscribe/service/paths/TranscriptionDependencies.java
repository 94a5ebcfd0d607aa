package com.phillippitts.meetingscribe.service.paths;

import java.util.List;

/**
 * Snapshot of which transcription artifacts are present.
 */
public record TranscriptionDependencies(
        Artifact whisper,
        Artifact ffmpeg,
        List<WhisperModel> models
) {
    public TranscriptionDependencies {
        models = models == null ? List.of() : List.copyOf(models);
    }

    /**
     * @return true when the engine, ffmpeg and at least one model are available
     */
    public boolean ready() {
        return whisper.exists() && ffmpeg.exists() && !models.isEmpty();
    }

    /**
     * @param exists whether the file is present
     * @param path resolved location
     */
    public record Artifact(boolean exists, String path) {
    }
}
