package com.phillippitts.meetingscribe.service.stt.whisper;

/**
 * Limits applied by {@link WhisperProcessManager} to the whisper.cpp streams.
 *
 * @see WhisperProcessManager
 * @since 1.0
 */
final class WhisperConstants {

    /** Engine name reported in {@link com.phillippitts.meetingscribe.exception.TranscriptionException}. */
    static final String ENGINE_NAME = "whisper";

    /**
     * Maximum characters captured from stderr per run. Progress lines are still observed
     * after the cap is reached; only the diagnostic capture stops growing.
     */
    static final int STDERR_MAX_CHARS = 256 * 1024;

    /**
     * Maximum characters of stderr carried into an error message.
     */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private WhisperConstants() {
        // Utility class - prevent instantiation
    }
}
