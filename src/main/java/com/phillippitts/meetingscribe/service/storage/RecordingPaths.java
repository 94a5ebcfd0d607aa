package com.phillippitts.meetingscribe.service.storage;

/**
 * The two recordings of a meeting.
 *
 * @param systemAudioPath system (far-end) track
 * @param micAudioPath microphone track
 */
public record RecordingPaths(String systemAudioPath, String micAudioPath) {
}
