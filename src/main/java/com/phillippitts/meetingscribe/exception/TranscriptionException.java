package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when the speech-to-text engine fails to produce a transcript.
 * This may occur due to a non-zero exit, an I/O failure while reading its output, or interruption.
 */
public class TranscriptionException extends MeetingScribeException {

    /** Exit code reported when the engine process never exited normally. */
    public static final int NO_EXIT_CODE = -1;

    private final String engineName;
    private final int exitCode;
    private final String diagnostics;

    public TranscriptionException(String message) {
        super(message);
        this.engineName = "unknown";
        this.exitCode = NO_EXIT_CODE;
        this.diagnostics = "";
    }

    public TranscriptionException(String message, String engineName) {
        this(message, engineName, null, NO_EXIT_CODE, "");
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
        this.exitCode = NO_EXIT_CODE;
        this.diagnostics = "";
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        this(message, engineName, cause, NO_EXIT_CODE, "");
    }

    public TranscriptionException(String message, String engineName, Throwable cause,
                                  int exitCode, String diagnostics) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
        this.exitCode = exitCode;
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }

    public String getEngineName() {
        return engineName;
    }

    /**
     * @return process exit code, or {@link #NO_EXIT_CODE} when the process did not exit normally
     */
    public int getExitCode() {
        return exitCode;
    }

    public boolean hasExitCode() {
        return exitCode != NO_EXIT_CODE;
    }

    /**
     * @return captured stderr text from the engine (possibly truncated, never null)
     */
    public String getDiagnostics() {
        return diagnostics;
    }
}
