package com.phillippitts.meetingscribe.exception;

/**
 * Base exception for all meeting-scribe application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class MeetingScribeException extends RuntimeException {

    public MeetingScribeException(String message) {
        super(message);
    }

    public MeetingScribeException(String message, Throwable cause) {
        super(message, cause);
    }

    public MeetingScribeException(Throwable cause) {
        super(cause);
    }
}
