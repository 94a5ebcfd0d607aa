package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when a transcription job id is not known to the queue.
 */
public class JobNotFoundException extends MeetingScribeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Transcription job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
