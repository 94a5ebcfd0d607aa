package com.phillippitts.meetingscribe.testutil;

import com.phillippitts.meetingscribe.service.process.ProcessFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared test doubles for subprocess-driven code (ffmpeg mixer, whisper runner).
 * Provides fake Process implementations for hermetic testing without real binaries.
 */
public final class ProcessTestDoubles {

    private ProcessTestDoubles() {}

    /**
     * Encapsulates test process behavior configuration.
     *
     * @param stdout stdout content to return
     * @param stderr stderr content to return
     * @param exitCode process exit code
     * @param blockUntilDestroyed when true, {@code waitFor()} blocks until the process is destroyed
     */
    public record ProcessBehavior(String stdout, String stderr, int exitCode, boolean blockUntilDestroyed) {

        public static ProcessBehavior exits(String stdout, String stderr, int exitCode) {
            return new ProcessBehavior(stdout, stderr, exitCode, false);
        }

        public static ProcessBehavior hangs() {
            return new ProcessBehavior("", "", 143, true);
        }
    }

    /**
     * Stub ProcessFactory that returns a pre-configured Process and records every command line.
     */
    public static final class StubProcessFactory implements ProcessFactory {
        private final Process process;
        private final IOException startFailure;
        public final List<List<String>> commands = new CopyOnWriteArrayList<>();

        public StubProcessFactory(Process process) {
            this.process = process;
            this.startFailure = null;
        }

        private StubProcessFactory(IOException startFailure) {
            this.process = null;
            this.startFailure = startFailure;
        }

        /**
         * Factory whose every start attempt fails like a missing or non-executable binary.
         */
        public static StubProcessFactory failingWith(String message) {
            return new StubProcessFactory(new IOException(message));
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            commands.add(List.copyOf(command));
            if (startFailure != null) {
                throw startFailure;
            }
            return process;
        }

        public List<String> lastCommand() {
            return commands.isEmpty() ? List.of() : commands.get(commands.size() - 1);
        }
    }

    /**
     * Minimal fake Process that allows controlling stdout/stderr, exit code, and termination timing.
     */
    public static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final CountDownLatch destroyed = new CountDownLatch(1);
        private final boolean blockUntilDestroyed;
        private volatile boolean alive = true;
        private volatile boolean destroyCalled = false;

        public TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.blockUntilDestroyed = behavior.blockUntilDestroyed();
        }

        public boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() throws InterruptedException {
            if (blockUntilDestroyed) {
                destroyed.await();
            }
            this.alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (blockUntilDestroyed) {
                return destroyed.await(timeout, unit);
            }
            this.alive = false;
            return true;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
            destroyed.countDown();
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
