package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when a transcription cannot be retried because no prior job or
 * recording is available for the meeting.
 */
public class RetryUnavailableException extends MeetingScribeException {

    private final String eventId;

    public RetryUnavailableException(String eventId, String reason) {
        super(reason);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
