package com.phillippitts.meetingscribe.service.worker;

import com.phillippitts.meetingscribe.config.properties.TranscriptionPathsProperties;
import com.phillippitts.meetingscribe.config.properties.WhisperProperties;
import com.phillippitts.meetingscribe.exception.WorkerCreationException;
import com.phillippitts.meetingscribe.service.paths.ConfiguredTranscriptionPaths;
import com.phillippitts.meetingscribe.service.paths.TranscriptionPaths;
import com.phillippitts.meetingscribe.service.worker.message.WorkerReady;
import com.phillippitts.meetingscribe.testutil.FakeAudioMixer;
import com.phillippitts.meetingscribe.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.meetingscribe.testutil.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.meetingscribe.testutil.ProcessTestDoubles.TestProcess;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ThreadTranscriptionWorkerFactoryTest {

    @TempDir
    Path root;

    private ThreadTranscriptionWorkerFactory factoryFor(Path developmentRoot) {
        TranscriptionPathsProperties props = new TranscriptionPathsProperties();
        props.setDevelopmentRoot(developmentRoot.toString());
        TranscriptionPaths paths = new ConfiguredTranscriptionPaths(props);
        return new ThreadTranscriptionWorkerFactory(paths, new FakeAudioMixer(),
                new StubProcessFactory(new TestProcess(ProcessBehavior.exits("", "", 0))),
                new WhisperProperties());
    }

    @Test
    void missingAssetsDirectoryFailsCreation() {
        ThreadTranscriptionWorkerFactory factory = factoryFor(root.resolve("not-installed"));

        assertThatThrownBy(() -> factory.create(new RecordingWorkerListener()))
                .isInstanceOf(WorkerCreationException.class)
                .hasMessageStartingWith("Transcription assets directory not found at: ")
                .hasMessageContaining("not-installed");
    }

    @Test
    void createdWorkerIsRunningAndSignalsReady() throws IOException {
        // Arrange
        Files.createDirectories(root.resolve("assets"));
        RecordingWorkerListener listener = new RecordingWorkerListener();

        // Act
        TranscriptionWorker worker = factoryFor(root).create(listener);

        // Assert
        try {
            await().atMost(Duration.ofSeconds(5)).until(() -> listener.messages.contains(WorkerReady.INSTANCE));
            assertThat(worker.isAlive()).isTrue();
        } finally {
            worker.terminate();
        }
        await().atMost(Duration.ofSeconds(5)).until(() -> !listener.exitCodes.isEmpty());
        assertThat(worker.isAlive()).isFalse();
    }
}
