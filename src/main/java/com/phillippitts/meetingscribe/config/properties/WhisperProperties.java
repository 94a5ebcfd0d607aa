package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp engine invocation.
 * Binds to properties prefixed with "transcription.whisper".
 *
 * <p>Executable and model locations are not configured here; they come from
 * {@link com.phillippitts.meetingscribe.service.paths.TranscriptionPaths}.
 *
 * @param language language hint passed with {@code -l}
 * @param threads CPU threads passed with {@code -t}
 * @param defaultModel model used when a job has no override (file {@code ggml-<name>.bin})
 * @param maxStdoutBytes transcript capture cap (prevents pathological memory usage)
 */
@ConfigurationProperties(prefix = "transcription.whisper")
@Validated
public record WhisperProperties(
        @NotBlank(message = "Language code must not be blank")
        String language,

        @Positive(message = "Thread count must be positive")
        int threads,

        @NotBlank(message = "Default model must not be blank")
        String defaultModel,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {
    @ConstructorBinding
    public WhisperProperties {
    }

    /**
     * Default constructor with standard values.
     * Default stdout cap: 1MB (hours of meeting text).
     */
    public WhisperProperties() {
        this("en", 4, "base.en", 1048576);
    }
}
