package com.phillippitts.meetingscribe.service.worker.message;

/**
 * Marker for messages a worker sends back to the queue manager.
 *
 * @see WorkerReady
 * @see JobStatusUpdate
 */
public interface WorkerMessage {
}
