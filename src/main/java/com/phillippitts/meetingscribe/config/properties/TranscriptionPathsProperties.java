package com.phillippitts.meetingscribe.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Locations of the bundled assets (whisper.cpp executable, models, ffmpeg).
 *
 * <p>In the installed layout everything lives under {@code resources-path}; during development it
 * lives under {@code development-root}. Both roots contain an {@code assets/} directory.
 *
 * <pre>
 * transcription.paths.packaged=false
 * transcription.paths.development-root=.
 * transcription.paths.resources-path=/Applications/MeetingScribe.app/Contents/Resources
 * </pre>
 */
@ConfigurationProperties(prefix = "transcription.paths")
public class TranscriptionPathsProperties {

    private boolean packaged = false;
    private String resourcesPath = "";
    private String developmentRoot = ".";

    public boolean isPackaged() {
        return packaged;
    }

    public void setPackaged(boolean packaged) {
        this.packaged = packaged;
    }

    public String getResourcesPath() {
        return resourcesPath;
    }

    public void setResourcesPath(String resourcesPath) {
        this.resourcesPath = resourcesPath;
    }

    public String getDevelopmentRoot() {
        return developmentRoot;
    }

    public void setDevelopmentRoot(String developmentRoot) {
        this.developmentRoot = developmentRoot;
    }
}
