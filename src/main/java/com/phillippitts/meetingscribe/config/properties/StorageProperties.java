package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Where per-meeting transcription state and transcript files are written.
 *
 * @param dataDirectory root directory; {@code meetings/} and {@code transcripts/} are created below it
 */
@ConfigurationProperties(prefix = "transcription.storage")
@Validated
public record StorageProperties(
        @NotBlank(message = "Storage data directory must not be blank")
        String dataDirectory
) {
    @ConstructorBinding
    public StorageProperties {
    }

    public StorageProperties() {
        this(System.getProperty("user.home") + "/.meeting-scribe");
    }
}
