package com.phillippitts.meetingscribe.service.stt.whisper;

import com.phillippitts.meetingscribe.exception.EngineStartException;
import com.phillippitts.meetingscribe.exception.TranscriptionException;
import com.phillippitts.meetingscribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.meetingscribe.service.process.ProcessFactory;
import com.phillippitts.meetingscribe.service.process.ProcessSupport;
import com.phillippitts.meetingscribe.service.process.StreamGobbler;
import com.phillippitts.meetingscribe.util.ProcessTimeouts;
import com.phillippitts.meetingscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Runs the whisper.cpp command-line program for one mixed recording.
 *
 * <p>Responsibilities:
 * - Build the CLI for a {@link WhisperInvocation}
 * - Start the process via {@link ProcessFactory}
 * - Drain stdout (transcript) and stderr (progress and diagnostics) concurrently
 * - Report progress percentages while the process runs
 * - Provide structured error context in {@link TranscriptionException}
 * - Idempotent {@link #close()} for cleanup
 *
 * <p>No timeout is applied: a run lasts as long as the engine needs. Interrupting the calling
 * thread destroys the subprocess.
 *
 * <p>One instance serves one worker thread at a time.
 */
public final class WhisperProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    private final ProcessFactory processFactory;

    private volatile Process current;
    private volatile StreamGobbler outGobbler;
    private volatile StreamGobbler errGobbler;

    public WhisperProcessManager(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Executes whisper.cpp and returns its stdout verbatim as the transcript.
     *
     * <p>CLI contract:
     *   <pre>
     *   ${binary} -m ${model} -f ${wav} -l ${language} -t ${threads} --output-txt --print-progress
     *   </pre>
     *
     * @param invocation run parameters
     * @param progressListener receives each percentage parsed from stderr; may be null
     * @return stdout content produced by whisper (may be empty)
     * @throws EngineStartException if the executable cannot be launched
     * @throws TranscriptionException on non-zero exit, I/O failure or interruption
     */
    public String transcribe(WhisperInvocation invocation, IntConsumer progressListener) {
        Objects.requireNonNull(invocation, "invocation");

        List<String> command = buildCommand(invocation);
        long startTime = System.nanoTime();
        LOG.debug("Starting whisper: {}", command);

        Process process;
        try {
            process = processFactory.start(command, workingDirectory(invocation.audioPath()));
        } catch (IOException e) {
            throw new EngineStartException(invocation.binaryPath().toString(), WhisperConstants.ENGINE_NAME, e);
        }
        this.current = process;

        try {
            // Start gobblers before waiting to avoid deadlock
            StreamGobbler out = StreamGobbler.start(process.getInputStream(), "whisper-out",
                    invocation.maxStdoutChars(), null);
            StreamGobbler err = StreamGobbler.start(process.getErrorStream(), "whisper-err",
                    WhisperConstants.STDERR_MAX_CHARS, line -> reportProgress(line, progressListener));
            this.outGobbler = out;
            this.errGobbler = err;

            int exitCode = process.waitFor();
            out.await(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            err.await(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());

            if (exitCode != 0) {
                throw whisperError("Non-zero exit: " + exitCode, invocation, exitCode, err.captured(),
                        startTime, null);
            }
            String output = out.captured();
            LOG.debug("Whisper finished in {} ms, stdout size={} chars",
                    TimeUtils.elapsedMillis(startTime), output.length());
            return output;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw whisperError("Interrupted while waiting for whisper", invocation,
                    TranscriptionException.NO_EXIT_CODE, capturedStderr(), startTime, e);
        } finally {
            close();
        }
    }

    static List<String> buildCommand(WhisperInvocation invocation) {
        List<String> cmd = new ArrayList<>();
        cmd.add(invocation.binaryPath().toAbsolutePath().toString());
        cmd.add("-m");
        cmd.add(invocation.modelPath().toAbsolutePath().toString());
        cmd.add("-f");
        cmd.add(invocation.audioPath().toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(invocation.language());
        cmd.add("-t");
        cmd.add(String.valueOf(invocation.threads()));
        cmd.add("--output-txt");
        cmd.add("--print-progress");
        return cmd;
    }

    private static Path workingDirectory(Path audioPath) {
        Path parent = audioPath.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".").toAbsolutePath();
    }

    private static void reportProgress(String line, IntConsumer listener) {
        if (listener == null) {
            return;
        }
        WhisperProgressParser.parse(line).ifPresent(listener);
    }

    private String capturedStderr() {
        StreamGobbler err = this.errGobbler;
        return err == null ? "" : err.captured();
    }

    private TranscriptionException whisperError(String msg, WhisperInvocation invocation, int exitCode,
                                                String stderr, long startNano, Throwable cause) {
        String snippet = stderr == null ? ""
                : stderr.substring(0, Math.min(WhisperConstants.ERROR_SNIPPET_MAX_CHARS, stderr.length()));

        TranscriptionExceptionBuilder builder = TranscriptionExceptionBuilder.create(msg)
                .engine(WhisperConstants.ENGINE_NAME)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("binaryPath", invocation.binaryPath())
                .metadata("modelPath", invocation.modelPath())
                .diagnostics(snippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    /**
     * Idempotent cleanup of any running process and gobbler threads.
     */
    @Override
    public void close() {
        Process process = this.current;
        this.current = null;
        if (process != null && process.isAlive()) {
            ProcessSupport.destroy(process);
        }
        StreamGobbler out = this.outGobbler;
        StreamGobbler err = this.errGobbler;
        if (out != null) {
            out.await(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
        }
        if (err != null) {
            err.await(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
        }
        outGobbler = null;
        errGobbler = null;
    }
}
