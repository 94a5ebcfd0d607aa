package com.phillippitts.meetingscribe.service.paths;

/**
 * A whisper model file found on disk.
 *
 * @param name model name as users select it (e.g. {@code base.en})
 * @param fileName file name (e.g. {@code ggml-base.en.bin})
 * @param path absolute location
 * @param sizeBytes file size
 */
public record WhisperModel(String name, String fileName, String path, long sizeBytes) {
}
