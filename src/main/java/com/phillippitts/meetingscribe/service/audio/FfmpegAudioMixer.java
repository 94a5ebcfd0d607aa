package com.phillippitts.meetingscribe.service.audio;

import com.phillippitts.meetingscribe.exception.AudioMixingException;
import com.phillippitts.meetingscribe.service.paths.TranscriptionPaths;
import com.phillippitts.meetingscribe.service.process.ProcessFactory;
import com.phillippitts.meetingscribe.service.process.ProcessSupport;
import com.phillippitts.meetingscribe.service.process.StreamGobbler;
import com.phillippitts.meetingscribe.util.LogSanitizer;
import com.phillippitts.meetingscribe.util.ProcessTimeouts;
import com.phillippitts.meetingscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * {@link AudioMixer} backed by the bundled ffmpeg binary.
 *
 * <p>The two tracks are merged into a single 16 kHz mono 16-bit PCM WAV, the input format
 * whisper.cpp expects:
 * <pre>
 * ffmpeg -y -i sys -i mic -filter_complex [0:a][1:a]amerge=inputs=2[a] -map [a]
 *        -ac 1 -ar 16000 -acodec pcm_s16le out
 * </pre>
 */
@Component
public class FfmpegAudioMixer implements AudioMixer {

    private static final Logger LOG = LogManager.getLogger(FfmpegAudioMixer.class);

    private static final int STDERR_MAX_CHARS = 64 * 1024;
    private static final int STDOUT_MAX_CHARS = 8 * 1024;

    private final TranscriptionPaths paths;
    private final ProcessFactory processFactory;

    public FfmpegAudioMixer(TranscriptionPaths paths, ProcessFactory processFactory) {
        this.paths = Objects.requireNonNull(paths, "paths");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    @Override
    public Path mix(Path systemAudioPath, Path micAudioPath, Path outputPath) {
        Objects.requireNonNull(outputPath, "outputPath");
        if (systemAudioPath == null || !Files.exists(systemAudioPath)) {
            throw new AudioMixingException("System audio file not found at: " + systemAudioPath);
        }
        if (micAudioPath == null || !Files.exists(micAudioPath)) {
            throw new AudioMixingException("Microphone audio file not found at: " + micAudioPath);
        }

        List<String> command = buildCommand(paths.ffmpegPath(), systemAudioPath, micAudioPath, outputPath);
        LOG.info("Mixing {} and {} into {}", systemAudioPath.getFileName(), micAudioPath.getFileName(),
                outputPath);
        long start = System.nanoTime();

        Process process;
        try {
            process = processFactory.start(command, workingDirectory(outputPath));
        } catch (IOException e) {
            throw new AudioMixingException("Failed to start FFmpeg: " + e.getMessage(), e);
        }

        StreamGobbler out = StreamGobbler.start(process.getInputStream(), "ffmpeg-out", STDOUT_MAX_CHARS, null);
        StreamGobbler err = StreamGobbler.start(process.getErrorStream(), "ffmpeg-err", STDERR_MAX_CHARS, null);
        try {
            int exitCode = process.waitFor();
            out.await(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            err.await(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            if (exitCode != 0) {
                String stderr = err.captured();
                LOG.warn("FFmpeg exited with code {}: {}", exitCode, LogSanitizer.singleLine(stderr, 500));
                throw new AudioMixingException("FFmpeg failed with code " + exitCode + ". Error: " + stderr);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessSupport.destroy(process);
            throw new AudioMixingException("Interrupted while waiting for FFmpeg", e);
        }

        if (!Files.exists(outputPath)) {
            throw new AudioMixingException("FFmpeg completed but output file not found at: " + outputPath);
        }
        LOG.info("Mixed audio written to {} in {} ms", outputPath, TimeUtils.elapsedMillis(start));
        return outputPath;
    }

    static List<String> buildCommand(Path ffmpeg, Path systemAudioPath, Path micAudioPath, Path outputPath) {
        return List.of(
                ffmpeg.toString(),
                "-y",
                "-i", systemAudioPath.toString(),
                "-i", micAudioPath.toString(),
                "-filter_complex", "[0:a][1:a]amerge=inputs=2[a]",
                "-map", "[a]",
                "-ac", "1",
                "-ar", "16000",
                "-acodec", "pcm_s16le",
                outputPath.toString());
    }

    private static Path workingDirectory(Path outputPath) {
        Path parent = outputPath.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".").toAbsolutePath();
    }
}
