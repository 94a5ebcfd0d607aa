package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the transcription queue manager and its worker supervision.
 *
 * <p>Example application.properties:
 * <pre>
 * transcription.queue.max-recreation-attempts=5
 * transcription.queue.recreation-delay=2s
 * transcription.queue.start-on-boot=true
 * </pre>
 */
@ConfigurationProperties(prefix = "transcription.queue")
@Validated
public class TranscriptionQueueProperties {

    /** Consecutive worker faults that may each schedule a recreation before the pipeline gives up. */
    @Positive(message = "Max recreation attempts must be positive")
    private int maxRecreationAttempts = 5;

    /** Delay between a worker fault and the recreation attempt. */
    @NotNull
    private Duration recreationDelay = Duration.ofSeconds(2);

    /** Create the worker as soon as the application is ready instead of on first submit. */
    private boolean startOnBoot = true;

    public int getMaxRecreationAttempts() {
        return maxRecreationAttempts;
    }

    public void setMaxRecreationAttempts(int maxRecreationAttempts) {
        this.maxRecreationAttempts = maxRecreationAttempts;
    }

    public Duration getRecreationDelay() {
        return recreationDelay;
    }

    public void setRecreationDelay(Duration recreationDelay) {
        this.recreationDelay = recreationDelay;
    }

    public boolean isStartOnBoot() {
        return startOnBoot;
    }

    public void setStartOnBoot(boolean startOnBoot) {
        this.startOnBoot = startOnBoot;
    }
}
