package com.phillippitts.meetingscribe.service.queue;

/**
 * Coarse state of the transcription pipeline as seen by the queue manager.
 */
public enum PipelineState {
    /** A worker is live and jobs are dispatched. */
    RUNNING,
    /** No worker yet, or a recreation is pending. */
    RECOVERING,
    /** Dispatch suspended by {@code pause}. */
    PAUSED,
    /** Recreation budget exhausted; queued jobs stall until {@code resume}. */
    UNAVAILABLE,
    /** Shut down for process exit. */
    STOPPED
}
