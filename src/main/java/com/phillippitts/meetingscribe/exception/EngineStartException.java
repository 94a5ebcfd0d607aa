package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when the speech-to-text executable cannot be launched at all
 * (missing execute permission, wrong architecture, etc.).
 */
public class EngineStartException extends TranscriptionException {

    private final String binaryPath;

    public EngineStartException(String binaryPath, String engineName, Throwable cause) {
        super("Failed to start process " + binaryPath, engineName, cause);
        this.binaryPath = binaryPath;
    }

    public String getBinaryPath() {
        return binaryPath;
    }

    /**
     * @return the launcher's own reason, without the engine decoration
     */
    public String getReason() {
        Throwable cause = getCause();
        return cause != null && cause.getMessage() != null ? cause.getMessage() : getMessage();
    }
}
