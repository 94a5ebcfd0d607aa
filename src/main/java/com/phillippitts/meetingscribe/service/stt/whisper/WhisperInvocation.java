package com.phillippitts.meetingscribe.service.stt.whisper;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything needed to run whisper.cpp once.
 *
 * @param binaryPath whisper.cpp executable
 * @param modelPath model file
 * @param audioPath mixed 16 kHz mono WAV
 * @param language language hint passed with {@code -l}
 * @param threads worker threads passed with {@code -t}
 * @param maxStdoutChars cap on captured transcript text
 */
public record WhisperInvocation(
        Path binaryPath,
        Path modelPath,
        Path audioPath,
        String language,
        int threads,
        int maxStdoutChars
) {
    public WhisperInvocation {
        Objects.requireNonNull(binaryPath, "binaryPath");
        Objects.requireNonNull(modelPath, "modelPath");
        Objects.requireNonNull(audioPath, "audioPath");
        Objects.requireNonNull(language, "language");
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive");
        }
        if (maxStdoutChars <= 0) {
            throw new IllegalArgumentException("maxStdoutChars must be positive");
        }
    }
}
