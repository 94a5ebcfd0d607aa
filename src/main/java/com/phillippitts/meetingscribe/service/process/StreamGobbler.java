package com.phillippitts.meetingscribe.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Drains one subprocess stream on a daemon thread.
 *
 * <p>Text is captured verbatim up to {@code maxChars}; once the cap is hit the gobbler keeps
 * reading (so the child never blocks on a full pipe) but discards the excess and logs a warning.
 * When a line listener is supplied every complete line ({@code \n} or {@code \r} terminated)
 * is passed to it as soon as it is read, which is how progress lines are observed while the
 * process is still running.
 */
public final class StreamGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamGobbler.class);
    private static final int BUFFER_CHARS = 8192;

    private final InputStream inputStream;
    private final String name;
    private final int maxChars;
    private final Consumer<String> lineListener;
    private final Map<String, String> logContext;

    private final StringBuilder captured = new StringBuilder();
    private final StringBuilder pendingLine = new StringBuilder();
    private boolean capReached;
    private Thread thread;

    private StreamGobbler(InputStream inputStream, String name, int maxChars, Consumer<String> lineListener) {
        this.inputStream = inputStream;
        this.name = name;
        this.maxChars = maxChars;
        this.lineListener = lineListener;
        this.logContext = ThreadContext.getImmutableContext();
    }

    /**
     * Starts a gobbler thread for the given stream.
     *
     * @param inputStream stream to drain
     * @param name thread name, also used in log messages
     * @param maxChars capture cap in characters
     * @param lineListener receives each complete line; may be null
     * @return the running gobbler
     */
    public static StreamGobbler start(InputStream inputStream, String name, int maxChars,
                                      Consumer<String> lineListener) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, name, maxChars, lineListener);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        gobbler.thread = thread;
        thread.start();
        return gobbler;
    }

    @Override
    public void run() {
        if (logContext != null && !logContext.isEmpty()) {
            ThreadContext.putAll(logContext);
        }
        char[] buffer = new char[BUFFER_CHARS];
        try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                append(buffer, read);
                if (lineListener != null) {
                    scanLines(buffer, read);
                }
            }
            if (lineListener != null && pendingLine.length() > 0) {
                emitLine();
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        } finally {
            ThreadContext.clearAll();
        }
    }

    private synchronized void append(char[] buffer, int length) {
        int available = maxChars - captured.length();
        if (available <= 0) {
            if (!capReached) {
                LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                capReached = true;
            }
            return;
        }
        if (length > available) {
            captured.append(buffer, 0, available);
            LOG.warn("Stream '{}' reached {} char cap (truncated)", name, maxChars);
            capReached = true;
        } else {
            captured.append(buffer, 0, length);
        }
    }

    private void scanLines(char[] buffer, int length) {
        for (int i = 0; i < length; i++) {
            char c = buffer[i];
            if (c == '\n' || c == '\r') {
                emitLine();
            } else {
                pendingLine.append(c);
            }
        }
    }

    private void emitLine() {
        if (pendingLine.length() == 0) {
            return;
        }
        String line = pendingLine.toString();
        pendingLine.setLength(0);
        try {
            lineListener.accept(line);
        } catch (RuntimeException e) {
            LOG.warn("Line listener for stream '{}' failed: {}", name, e.toString());
        }
    }

    /**
     * @return text captured so far (at most {@code maxChars})
     */
    public synchronized String captured() {
        return captured.toString();
    }

    /**
     * Waits up to {@code timeoutMillis} for the stream to be fully drained.
     */
    public void await(long timeoutMillis) {
        ProcessSupport.joinQuietly(thread, timeoutMillis);
    }
}
