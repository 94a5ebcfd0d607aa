package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when the transcription worker cannot be created because a required
 * artifact of the installation is not resolvable.
 */
public class WorkerCreationException extends MeetingScribeException {

    public WorkerCreationException(String message) {
        super(message);
    }

    public WorkerCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
