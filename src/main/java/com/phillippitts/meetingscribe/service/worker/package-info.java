/**
 * The background worker that mixes and transcribes one job at a time.
 *
 * <p>The worker talks to the queue manager only through
 * {@link com.phillippitts.meetingscribe.service.worker.message.WorkerMessage}s delivered to a
 * {@link com.phillippitts.meetingscribe.service.worker.WorkerListener}, and receives only copies of
 * jobs through {@link com.phillippitts.meetingscribe.service.worker.TranscriptionWorker#post}.
 *
 * @since 1.0
 */
package com.phillippitts.meetingscribe.service.worker;
