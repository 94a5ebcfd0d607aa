/**
 * Core domain model for transcription jobs.
 *
 * <p>Domain types are immutable records and enums with no framework dependencies, so they
 * can travel between the queue manager thread and the worker thread without sharing state.
 *
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.domain.TranscriptionJob} - snapshot of one
 *       mix-and-transcribe request</li>
 *   <li>{@link com.phillippitts.meetingscribe.domain.TranscriptionStatus} - job lifecycle
 *       states and their terminal/active classification</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.meetingscribe.domain;
