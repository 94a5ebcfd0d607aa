package com.phillippitts.meetingscribe.service.worker.message;

/**
 * The worker is idle and can accept a job. Sent once after start-up and once after every job.
 */
public record WorkerReady() implements WorkerMessage {

    public static final WorkerReady INSTANCE = new WorkerReady();
}
