package com.phillippitts.meetingscribe.service.events;

import com.phillippitts.meetingscribe.service.queue.event.TranscriptionPipelineUnavailableEvent;
import com.phillippitts.meetingscribe.service.queue.event.WorkerFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * User-facing summary of pipeline faults. Throttled so that a crash loop does not flood the log.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onWorkerFailure(WorkerFailureEvent e) {
        if (e.recreationScheduled() && shouldLog("worker-failure")) {
            LOG.warn("Transcription worker is restarting after a fault ({} in a row). "
                    + "Check the whisper and ffmpeg installation if this repeats.", e.consecutiveFailures());
        }
    }

    @EventListener
    void onPipelineUnavailable(TranscriptionPipelineUnavailableEvent e) {
        if (shouldLog("pipeline-unavailable")) {
            LOG.error("Transcription is unavailable after {} worker failures; {} job(s) are waiting. "
                    + "Fix the installation and call POST /api/transcriptions/resume.",
                    e.consecutiveFailures(), e.stalledJobs());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
