package com.phillippitts.meetingscribe.service.process;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class StreamGobblerTest {

    private static ByteArrayInputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void capturesWholeStream() {
        StreamGobbler gobbler = StreamGobbler.start(stream("line one\nline two\n"), "test-out", 1024, null);

        gobbler.await(2000);

        assertThat(gobbler.captured()).isEqualTo("line one\nline two\n");
    }

    @Test
    void truncatesAtCapButKeepsDraining() {
        StreamGobbler gobbler = StreamGobbler.start(stream("x".repeat(50_000)), "test-cap", 100, null);

        gobbler.await(2000);

        assertThat(gobbler.captured()).hasSize(100);
    }

    @Test
    void passesEachLineToListener() {
        List<String> lines = new CopyOnWriteArrayList<>();

        StreamGobbler gobbler = StreamGobbler.start(stream("a\r\nb\rc"), "test-lines", 1024, lines::add);
        gobbler.await(2000);

        assertThat(lines).containsExactly("a", "b", "c");
    }

    @Test
    void failingListenerDoesNotStopCapture() {
        StreamGobbler gobbler = StreamGobbler.start(stream("first\nsecond\n"), "test-bad-listener", 1024,
                line -> {
                    throw new IllegalStateException("listener bug");
                });

        gobbler.await(2000);

        assertThat(gobbler.captured()).isEqualTo("first\nsecond\n");
    }
}
