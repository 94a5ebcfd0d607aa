package com.phillippitts.meetingscribe.service.stt.whisper;

import com.phillippitts.meetingscribe.exception.EngineStartException;
import com.phillippitts.meetingscribe.exception.TranscriptionException;
import com.phillippitts.meetingscribe.service.process.ProcessFactory;
import com.phillippitts.meetingscribe.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.meetingscribe.testutil.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.meetingscribe.testutil.ProcessTestDoubles.TestProcess;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhisperProcessManagerHermeticTest {

    private static WhisperInvocation invocation() {
        return new WhisperInvocation(Path.of("/opt/scribe/assets/main"),
                Path.of("/opt/scribe/assets/models/whisper/ggml-base.en.bin"),
                Path.of("/tmp/recordings/job_mixed.wav"), "en", 4, 1048576);
    }

    @Test
    void successReturnsStdout() {
        // Arrange
        TestProcess tp = new TestProcess(ProcessBehavior.exits("hello world", "", 0));
        ProcessFactory factory = new StubProcessFactory(tp);
        WhisperProcessManager mgr = new WhisperProcessManager(factory);

        // Act
        String out = mgr.transcribe(invocation(), null);

        // Assert
        assertThat(out).isEqualTo("hello world");
    }

    @Test
    void progressLinesAreReported() {
        String stderr = "whisper_print_progress_callback: progress =   5%\n"
                + "whisper_print_progress_callback: progress =  60%\r"
                + "whisper_print_progress_callback: progress = 100%\n";
        WhisperProcessManager mgr = new WhisperProcessManager(
                new StubProcessFactory(new TestProcess(ProcessBehavior.exits("text", stderr, 0))));
        List<Integer> progress = new CopyOnWriteArrayList<>();

        mgr.transcribe(invocation(), progress::add);

        assertThat(progress).containsExactly(5, 60, 100);
    }

    @Test
    void nonZeroExitThrowsWithStderrSnippet() {
        TestProcess tp = new TestProcess(ProcessBehavior.exits("", "something went wrong", 1));
        WhisperProcessManager mgr = new WhisperProcessManager(new StubProcessFactory(tp));

        assertThatThrownBy(() -> mgr.transcribe(invocation(), null))
            .isInstanceOf(TranscriptionException.class)
            .hasMessageContaining("Non-zero exit")
            .hasMessageContaining("stderr=")
            .hasMessageContaining("engine: whisper")
            .satisfies(e -> {
                TranscriptionException te = (TranscriptionException) e;
                assertThat(te.getExitCode()).isEqualTo(1);
                assertThat(te.getDiagnostics()).isEqualTo("something went wrong");
            });
    }

    @Test
    void launchFailureThrowsEngineStartException() {
        WhisperProcessManager mgr = new WhisperProcessManager(
                StubProcessFactory.failingWith("Cannot run program: error=2, No such file or directory"));

        assertThatThrownBy(() -> mgr.transcribe(invocation(), null))
            .isInstanceOf(EngineStartException.class)
            .satisfies(e -> assertThat(((EngineStartException) e).getReason())
                    .isEqualTo("Cannot run program: error=2, No such file or directory"));
    }

    @Test
    void interruptKillsProcessAndThrows() throws Exception {
        // Process that never terminates by itself
        TestProcess tp = new TestProcess(ProcessBehavior.hangs());
        WhisperProcessManager mgr = new WhisperProcessManager(new StubProcessFactory(tp));
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread runner = new Thread(() -> {
            try {
                mgr.transcribe(invocation(), null);
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "whisper-test-runner");
        runner.start();
        Thread.sleep(100);

        runner.interrupt();
        runner.join(5000);

        assertThat(failure.get())
            .isInstanceOf(TranscriptionException.class)
            .hasMessageContaining("Interrupted while waiting for whisper");
        assertThat(((TranscriptionException) failure.get()).hasExitCode()).isFalse();
        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(tp::wasDestroyCalled);
    }

    @Test
    void commandCarriesModelAudioLanguageAndThreads() {
        List<String> cmd = WhisperProcessManager.buildCommand(invocation());

        assertThat(cmd).containsExactly(
                "/opt/scribe/assets/main",
                "-m", "/opt/scribe/assets/models/whisper/ggml-base.en.bin",
                "-f", "/tmp/recordings/job_mixed.wav",
                "-l", "en",
                "-t", "4",
                "--output-txt",
                "--print-progress");
    }

    @Test
    void closeIsIdempotent() {
        WhisperProcessManager mgr = new WhisperProcessManager(
                new StubProcessFactory(new TestProcess(ProcessBehavior.exits("", "", 0))));

        mgr.close();
        mgr.close();

        assertThat(mgr.transcribe(invocation(), null)).isEmpty();
    }
}
