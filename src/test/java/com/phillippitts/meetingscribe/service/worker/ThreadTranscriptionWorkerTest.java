package com.phillippitts.meetingscribe.service.worker;

import com.phillippitts.meetingscribe.config.properties.TranscriptionPathsProperties;
import com.phillippitts.meetingscribe.config.properties.WhisperProperties;
import com.phillippitts.meetingscribe.domain.TranscriptionJob;
import com.phillippitts.meetingscribe.domain.TranscriptionStatus;
import com.phillippitts.meetingscribe.service.audio.AudioMixer;
import com.phillippitts.meetingscribe.service.paths.ConfiguredTranscriptionPaths;
import com.phillippitts.meetingscribe.service.paths.TranscriptionPaths;
import com.phillippitts.meetingscribe.service.process.ProcessFactory;
import com.phillippitts.meetingscribe.service.stt.whisper.WhisperProcessManager;
import com.phillippitts.meetingscribe.service.worker.message.WorkerReady;
import com.phillippitts.meetingscribe.testutil.FakeAudioMixer;
import com.phillippitts.meetingscribe.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.meetingscribe.testutil.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.meetingscribe.testutil.ProcessTestDoubles.TestProcess;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ThreadTranscriptionWorkerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path root;

    private TranscriptionPaths paths;
    private RecordingWorkerListener listener;
    private ThreadTranscriptionWorker worker;

    @BeforeEach
    void setUp() throws IOException {
        TranscriptionPathsProperties props = new TranscriptionPathsProperties();
        props.setDevelopmentRoot(root.toString());
        paths = new ConfiguredTranscriptionPaths(props);
        Files.createDirectories(paths.modelFilePath("x").getParent());
        Files.writeString(paths.engineExecutablePath(), "#!/bin/sh\n");
        Files.write(paths.modelFilePath("ggml-base.en.bin"), new byte[16]);
        listener = new RecordingWorkerListener();
    }

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.terminate();
        }
    }

    private ThreadTranscriptionWorker startWorker(AudioMixer mixer, ProcessFactory factory) {
        TranscriptionJobProcessor processor = new TranscriptionJobProcessor(mixer, paths,
                new WhisperProcessManager(factory), new WhisperProperties());
        worker = new ThreadTranscriptionWorker(processor, listener);
        worker.start();
        return worker;
    }

    private TranscriptionJob job() {
        return TranscriptionJob.queued("evt-1", root.resolve("system.wav").toString(),
                root.resolve("mic.wav").toString(), null);
    }

    @Test
    void signalsReadyOnStartAndAfterEachJob() {
        // Arrange
        StubProcessFactory factory = new StubProcessFactory(
                new TestProcess(ProcessBehavior.exits("meeting notes", "", 0)));
        startWorker(new FakeAudioMixer(), factory);
        await().atMost(TIMEOUT).until(() -> listener.messages.contains(WorkerReady.INSTANCE));

        // Act
        worker.post(job());

        // Assert
        await().atMost(TIMEOUT).until(() -> listener.messages.size() == 5);
        assertThat(listener.messages.get(0)).isEqualTo(WorkerReady.INSTANCE);
        assertThat(listener.statuses()).containsExactly(
                TranscriptionStatus.MIXING, TranscriptionStatus.TRANSCRIBING, TranscriptionStatus.COMPLETED);
        assertThat(listener.messages.get(4)).isEqualTo(WorkerReady.INSTANCE);
        assertThat(worker.isAlive()).isTrue();
        assertThat(listener.exitCodes).isEmpty();
    }

    @Test
    void failedJobDoesNotStopWorker() {
        FakeAudioMixer mixer = new FakeAudioMixer();
        mixer.failWith("Microphone audio file not found at: /gone/mic.wav");
        startWorker(mixer, new StubProcessFactory(new TestProcess(ProcessBehavior.exits("", "", 0))));

        worker.post(job());
        worker.post(job());

        await().atMost(TIMEOUT).until(() -> listener.statuses().stream()
                .filter(s -> s == TranscriptionStatus.FAILED).count() == 2);
        assertThat(worker.isAlive()).isTrue();
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void terminateKillsRunningWhisperAndReportsExit() {
        // Arrange
        TestProcess hanging = new TestProcess(ProcessBehavior.hangs());
        startWorker(new FakeAudioMixer(), new StubProcessFactory(hanging));
        worker.post(job());
        await().atMost(TIMEOUT).until(() -> listener.statuses().contains(TranscriptionStatus.TRANSCRIBING));

        // Act
        worker.terminate();

        // Assert
        await().atMost(TIMEOUT).until(() -> !listener.exitCodes.isEmpty());
        assertThat(hanging.wasDestroyCalled()).isTrue();
        assertThat(listener.exitCodes).containsExactly(ThreadTranscriptionWorker.ABNORMAL_EXIT);
        assertThat(worker.isAlive()).isFalse();
        assertThat(listener.messages.get(listener.messages.size() - 1)).isNotEqualTo(WorkerReady.INSTANCE);
    }

    @Test
    void postAfterTerminateIsRejected() {
        startWorker(new FakeAudioMixer(), new StubProcessFactory(new TestProcess(ProcessBehavior.exits("", "", 0))));

        worker.terminate();

        assertThatThrownBy(() -> worker.post(job()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("is not running");
        await().atMost(TIMEOUT).until(() -> listener.exitCodes.size() == 1);
    }

    @Test
    void fatalErrorIsReportedBeforeExit() {
        AudioMixer broken = (sys, mic, out) -> {
            throw new LinkageError("native library missing");
        };
        startWorker(broken, new StubProcessFactory(new TestProcess(ProcessBehavior.exits("", "", 0))));

        worker.post(job());

        await().atMost(TIMEOUT).until(() -> !listener.exitCodes.isEmpty());
        assertThat(listener.errors).hasSize(1);
        assertThat(listener.errors.get(0)).isInstanceOf(LinkageError.class);
        assertThat(listener.exitCodes).containsExactly(ThreadTranscriptionWorker.ABNORMAL_EXIT);
        assertThat(listener.hasTerminalUpdate()).isFalse();
    }
}
