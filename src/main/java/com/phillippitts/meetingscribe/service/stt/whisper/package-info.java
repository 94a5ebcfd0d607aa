/**
 * whisper.cpp speech-to-text engine invocation.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.service.stt.whisper.WhisperProcessManager} -
 *       process lifecycle (spawn, drain, progress, cleanup)</li>
 *   <li>{@link com.phillippitts.meetingscribe.service.stt.whisper.WhisperProgressParser} -
 *       percentage extraction from {@code --print-progress} lines</li>
 *   <li>{@link com.phillippitts.meetingscribe.service.stt.whisper.WhisperInvocation} -
 *       parameters of one run</li>
 * </ul>
 *
 * <p>The engine writes the transcript to stdout and progress plus diagnostics to stderr.
 * Exit code 0 means success.
 *
 * @since 1.0
 */
package com.phillippitts.meetingscribe.service.stt.whisper;
