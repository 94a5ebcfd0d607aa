package com.phillippitts.meetingscribe.service.paths;

import java.nio.file.Path;
import java.util.List;

/**
 * Resolves where the transcription artifacts live on disk.
 *
 * <p>All methods are pure and synchronous: they compute locations and never create or download
 * anything. Callers check existence themselves so that a missing artifact becomes a job-level
 * failure rather than an exception.
 */
public interface TranscriptionPaths {

    /**
     * @return root directory holding the bundled executables and models
     */
    Path assetsDirectory();

    /**
     * @return whisper.cpp command-line executable
     */
    Path engineExecutablePath();

    /**
     * @param fileName model file name, e.g. {@code ggml-base.en.bin}
     * @return model file location
     */
    Path modelFilePath(String fileName);

    /**
     * @return ffmpeg executable used by the audio mixer
     */
    Path ffmpegPath();

    /**
     * @return model files ({@code *.bin}) present in the models directory, empty if none
     */
    List<WhisperModel> availableModels();

    /**
     * @return existence report for the engine, ffmpeg and models
     */
    TranscriptionDependencies checkDependencies();

    /**
     * Maps a model name such as {@code base.en} to its file name {@code ggml-base.en.bin}.
     */
    static String modelFileName(String modelName) {
        return "ggml-" + modelName + ".bin";
    }
}
