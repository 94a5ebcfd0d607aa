package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when the system and microphone tracks cannot be combined into a single file.
 */
public class AudioMixingException extends MeetingScribeException {

    public AudioMixingException(String message) {
        super(message);
    }

    public AudioMixingException(String message, Throwable cause) {
        super(message, cause);
    }
}
