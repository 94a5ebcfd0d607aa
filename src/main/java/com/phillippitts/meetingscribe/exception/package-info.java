/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.exception.MeetingScribeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.TranscriptionException} - the speech-to-text
 *       engine exited non-zero or its output could not be read; carries exit code and stderr</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.EngineStartException} - the engine
 *       executable could not be launched</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.AudioMixingException} - the two input
 *       tracks could not be mixed</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.WorkerCreationException} - the worker
 *       could not be created; the queue manager schedules recovery</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.JobNotFoundException} and
 *       {@link com.phillippitts.meetingscribe.exception.RetryUnavailableException} - submission
 *       API lookups that cannot be satisfied</li>
 * </ul>
 *
 * <p>Job-level failures never escape the worker as exceptions; they are converted into
 * {@code failed} status updates. Only the submission API lets exceptions reach the
 * REST boundary, where {@code GlobalExceptionHandler} maps them to HTTP responses.
 *
 * @see com.phillippitts.meetingscribe.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.meetingscribe.exception;
