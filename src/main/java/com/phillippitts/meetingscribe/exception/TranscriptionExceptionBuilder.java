package com.phillippitts.meetingscribe.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing TranscriptionException with rich contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Simple exception
 * throw TranscriptionExceptionBuilder.create("Transcription failed")
 *         .engine("whisper")
 *         .build();
 *
 * // With exit code, duration and captured stderr
 * throw TranscriptionExceptionBuilder.create("Non-zero exit: 1")
 *         .engine("whisper")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("binaryPath", binPath)
 *         .diagnostics(stderrSnippet)
 *         .build();
 * </pre>
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private String diagnostics;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Attaches captured stderr text. It is exposed through
     * {@link TranscriptionException#getDiagnostics()} and appended to the message as {@code stderr=...}.
     *
     * @param stderr diagnostic text (may be null)
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder diagnostics(String stderr) {
        this.diagnostics = stderr;
        return metadata("stderr", stderr);
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value (ignored when null)
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the TranscriptionException with the configured properties.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (engine: {engine})
     * </pre>
     *
     * @return constructed TranscriptionException
     */
    public TranscriptionException build() {
        String engine = engineName != null ? engineName : "unknown";
        int code = exitCode != null ? exitCode : TranscriptionException.NO_EXIT_CODE;
        return new TranscriptionException(buildDetailedMessage(), engine, cause, code, diagnostics);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
