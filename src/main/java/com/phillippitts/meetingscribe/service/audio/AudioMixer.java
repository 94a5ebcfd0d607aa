package com.phillippitts.meetingscribe.service.audio;

import com.phillippitts.meetingscribe.exception.AudioMixingException;

import java.nio.file.Path;

/**
 * Combines the system and microphone tracks of a meeting into one file the speech-to-text
 * engine can read.
 *
 * <p>Implementations block the calling thread until the output is written; callers run them on
 * the worker thread, never on the queue manager thread.
 */
public interface AudioMixer {

    /**
     * Mixes two recordings.
     *
     * @param systemAudioPath system (far-end) track
     * @param micAudioPath microphone track
     * @param outputPath file to write; overwritten if present
     * @return the written output path
     * @throws AudioMixingException on missing input, tool failure or missing output
     */
    Path mix(Path systemAudioPath, Path micAudioPath, Path outputPath);
}
