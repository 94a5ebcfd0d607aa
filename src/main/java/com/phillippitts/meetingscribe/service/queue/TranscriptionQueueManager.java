package com.phillippitts.meetingscribe.service.queue;

import com.phillippitts.meetingscribe.config.properties.TranscriptionQueueProperties;
import com.phillippitts.meetingscribe.domain.TranscriptionJob;
import com.phillippitts.meetingscribe.domain.TranscriptionStatus;
import com.phillippitts.meetingscribe.service.queue.event.TranscriptionJobQueuedEvent;
import com.phillippitts.meetingscribe.service.queue.event.TranscriptionJobUpdatedEvent;
import com.phillippitts.meetingscribe.service.queue.event.TranscriptionPipelineUnavailableEvent;
import com.phillippitts.meetingscribe.service.queue.event.WorkerFailureEvent;
import com.phillippitts.meetingscribe.service.storage.TranscriptionResultStore;
import com.phillippitts.meetingscribe.service.worker.TranscriptionWorker;
import com.phillippitts.meetingscribe.service.worker.TranscriptionWorkerFactory;
import com.phillippitts.meetingscribe.service.worker.WorkerListener;
import com.phillippitts.meetingscribe.service.worker.message.JobStatusUpdate;
import com.phillippitts.meetingscribe.service.worker.message.WorkerMessage;
import com.phillippitts.meetingscribe.service.worker.message.WorkerReady;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the transcription jobs and the single worker that processes them.
 *
 * <p>Jobs are dispatched in submission order, one at a time: a job is sent only when a worker is
 * live, the manager is neither busy nor paused, and no previously sent job is still unfinished.
 * Every status update from the worker replaces the job's snapshot, is published as a
 * {@link TranscriptionJobUpdatedEvent} and is persisted on {@code persistenceExecutor}.
 *
 * <p>Worker supervision:
 * <ul>
 *   <li>Creation failure, a reported fault, an abnormal exit and a refused job each count as one
 *       consecutive failure; the worker is retired and a single recreation is scheduled after
 *       {@code transcription.queue.recreation-delay}.</li>
 *   <li>Once the count exceeds {@code transcription.queue.max-recreation-attempts}, recreation
 *       stops, a {@link TranscriptionPipelineUnavailableEvent} is published and queued jobs stay
 *       queued until {@link #resume()}.</li>
 *   <li>The count resets when a worker is created and whenever a worker reports ready.</li>
 *   <li>A job that was mixing or transcribing when its worker was retired goes back to
 *       {@code queued}.</li>
 *   <li>Messages from a retired worker are ignored, so a fault followed by an exit counts once.</li>
 * </ul>
 *
 * <p>Worker callbacks are handed to {@code transcriptionManagerExecutor} (a single thread) so they
 * are handled in emission order. Public methods are synchronized and may be called from any thread.
 */
@Component
public class TranscriptionQueueManager {

    private static final Logger LOG = LogManager.getLogger(TranscriptionQueueManager.class);

    private final TranscriptionWorkerFactory workerFactory;
    private final TranscriptionResultStore store;
    private final ApplicationEventPublisher publisher;
    private final Executor managerExecutor;
    private final Executor persistenceExecutor;
    private final TaskScheduler recoveryScheduler;
    private final TranscriptionQueueProperties props;

    // Guarded by this
    private final List<TranscriptionJob> jobs = new ArrayList<>();
    private TranscriptionWorker worker;
    private int generation;
    private boolean busy;
    private boolean paused;
    private boolean stopped;
    private boolean unavailableAnnounced;
    private String inFlightJobId;
    private int consecutiveFailures;
    private ScheduledFuture<?> recreationTimer;

    public TranscriptionQueueManager(TranscriptionWorkerFactory workerFactory,
                                     TranscriptionResultStore store,
                                     ApplicationEventPublisher publisher,
                                     @Qualifier("transcriptionManagerExecutor") Executor managerExecutor,
                                     @Qualifier("persistenceExecutor") Executor persistenceExecutor,
                                     @Qualifier("transcriptionRecoveryScheduler") TaskScheduler recoveryScheduler,
                                     TranscriptionQueueProperties props) {
        this.workerFactory = Objects.requireNonNull(workerFactory, "workerFactory");
        this.store = Objects.requireNonNull(store, "store");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.managerExecutor = Objects.requireNonNull(managerExecutor, "managerExecutor");
        this.persistenceExecutor = Objects.requireNonNull(persistenceExecutor, "persistenceExecutor");
        this.recoveryScheduler = Objects.requireNonNull(recoveryScheduler, "recoveryScheduler");
        this.props = Objects.requireNonNull(props, "props");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (props.isStartOnBoot()) {
            initialize();
        } else {
            LOG.info("Transcription worker start on boot disabled; waiting for first submission");
        }
    }

    /**
     * Starts the worker, or re-triggers dispatch if one is already running.
     */
    public synchronized void initialize() {
        if (stopped) {
            LOG.warn("initialize() ignored: transcription queue is shut down");
            return;
        }
        cancelRecreationTimer();
        if (worker == null) {
            consecutiveFailures = 0;
            createWorker();
        } else {
            busy = false;
            dispatchNext();
        }
    }

    /**
     * Queues a new job and returns its snapshot without waiting for any processing.
     *
     * @throws IllegalArgumentException if an identifier or path is blank
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public synchronized TranscriptionJob submit(String eventId, String systemAudioPath, String micAudioPath,
                                                String modelName) {
        if (stopped) {
            throw new IllegalStateException("Transcription queue is shut down");
        }
        TranscriptionJob job = TranscriptionJob.queued(eventId, systemAudioPath, micAudioPath, modelName);
        jobs.add(job);
        LOG.info("Queued transcription job {} for event {} (queue size={})", job.jobId(), eventId, jobs.size());
        publisher.publishEvent(new TranscriptionJobQueuedEvent(job, Instant.now()));

        if (worker == null) {
            if (recreationTimer == null && !recreationExhausted()) {
                createWorker();
            } else {
                LOG.debug("No worker available; job {} waits for recovery", job.jobId());
            }
        } else {
            dispatchNext();
        }
        return job;
    }

    public synchronized List<TranscriptionJob> listJobs() {
        return List.copyOf(jobs);
    }

    public synchronized Optional<TranscriptionJob> getJob(String jobId) {
        return jobs.stream().filter(j -> j.jobId().equals(jobId)).findFirst();
    }

    public synchronized List<TranscriptionJob> getJobsForEvent(String eventId) {
        return jobs.stream().filter(j -> j.eventId().equals(eventId)).toList();
    }

    /**
     * Stops dispatching. With {@code terminate} the worker is killed and recreation is suppressed;
     * a job it was running goes back to the queue.
     */
    public synchronized void pause(boolean terminate) {
        paused = true;
        if (terminate) {
            cancelRecreationTimer();
            consecutiveFailures = props.getMaxRecreationAttempts() + 1;
            retireWorker();
            LOG.info("Transcription paused; worker terminated");
        } else {
            LOG.info("Transcription paused");
        }
        busy = true;
    }

    /**
     * Lifts a pause (or an exhausted recreation budget) and restarts the worker if none exists.
     */
    public synchronized void resume() {
        if (stopped) {
            LOG.warn("resume() ignored: transcription queue is shut down");
            return;
        }
        paused = false;
        busy = false;
        unavailableAnnounced = false;
        if (worker == null) {
            cancelRecreationTimer();
            consecutiveFailures = 0;
            createWorker();
        } else {
            dispatchNext();
        }
        LOG.info("Transcription resumed");
    }

    /**
     * Removes completed and failed jobs.
     *
     * @return number of jobs removed
     */
    public synchronized int purgeTerminal() {
        int before = jobs.size();
        jobs.removeIf(j -> j.status().isTerminal());
        int removed = before - jobs.size();
        LOG.info("Purged {} finished transcription job(s); {} remain", removed, jobs.size());
        return removed;
    }

    /**
     * Terminates the worker, disables recreation and drops all jobs. For process exit only.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        cancelRecreationTimer();
        consecutiveFailures = props.getMaxRecreationAttempts() + 1;
        inFlightJobId = null;
        retireWorker();
        busy = true;
        int dropped = jobs.size();
        jobs.clear();
        LOG.info("Transcription queue shut down ({} job(s) dropped)", dropped);
    }

    public synchronized PipelineState pipelineState() {
        if (stopped) {
            return PipelineState.STOPPED;
        }
        if (paused) {
            return PipelineState.PAUSED;
        }
        if (recreationExhausted()) {
            return PipelineState.UNAVAILABLE;
        }
        return worker != null ? PipelineState.RUNNING : PipelineState.RECOVERING;
    }

    /**
     * @return number of jobs in each status (statuses without jobs map to zero)
     */
    public synchronized Map<TranscriptionStatus, Long> jobCounts() {
        Map<TranscriptionStatus, Long> counts = new EnumMap<>(TranscriptionStatus.class);
        for (TranscriptionStatus s : TranscriptionStatus.values()) {
            counts.put(s, 0L);
        }
        for (TranscriptionJob job : jobs) {
            counts.merge(job.status(), 1L, Long::sum);
        }
        return counts;
    }

    @Scheduled(fixedRate = 60_000)
    void logQueueSummary() {
        Map<TranscriptionStatus, Long> counts;
        PipelineState state;
        synchronized (this) {
            if (jobs.isEmpty()) {
                return;
            }
            counts = jobCounts();
            state = pipelineState();
        }
        LOG.info("Transcription queue: state={}, jobs={}", state, counts);
    }

    synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    synchronized boolean isRecreationPending() {
        return recreationTimer != null;
    }

    // ---- worker lifecycle -------------------------------------------------------------------

    private void createWorker() {
        if (stopped || recreationExhausted()) {
            return;
        }
        if (recreationTimer != null) {
            LOG.debug("Worker recreation already pending; skipping creation");
            return;
        }
        int gen = ++generation;
        try {
            TranscriptionWorker created = workerFactory.create(listenerFor(gen));
            worker = created;
            consecutiveFailures = 0;
            busy = false;
            inFlightJobId = null;
            LOG.info("Transcription worker created (generation {})", gen);
            dispatchNext();
        } catch (RuntimeException e) {
            LOG.warn("Failed to create transcription worker: {}", e.getMessage());
            handleWorkerFault(gen, "Worker creation failed: " + e.getMessage());
        }
    }

    private void recreateWorker() {
        recreationTimer = null;
        if (worker != null) {
            LOG.debug("Recreation timer fired but a worker is already running");
            return;
        }
        LOG.info("Recreating transcription worker (consecutive failures={})", consecutiveFailures);
        createWorker();
    }

    private void handleWorkerFault(int gen, String reason) {
        if (gen != generation) {
            LOG.debug("Ignoring fault from retired worker generation {}: {}", gen, reason);
            return;
        }
        retireWorker();
        consecutiveFailures++;
        boolean scheduled = scheduleRecreation();
        LOG.warn("Transcription worker fault #{}: {}{}", consecutiveFailures, reason,
                scheduled ? "; recreating in " + props.getRecreationDelay().toMillis() + " ms" : "");
        publisher.publishEvent(new WorkerFailureEvent(reason, consecutiveFailures, scheduled, Instant.now()));
    }

    private boolean scheduleRecreation() {
        if (stopped) {
            return false;
        }
        if (recreationExhausted()) {
            LOG.error("Transcription worker failed {} consecutive times; giving up until resume()",
                    consecutiveFailures);
            if (!unavailableAnnounced) {
                unavailableAnnounced = true;
                publisher.publishEvent(new TranscriptionPipelineUnavailableEvent(consecutiveFailures,
                        (int) jobs.stream().filter(j -> j.status() == TranscriptionStatus.QUEUED).count(),
                        Instant.now()));
            }
            return false;
        }
        cancelRecreationTimer();
        recreationTimer = recoveryScheduler.schedule(
                () -> deliver(this::recreateWorkerSafely),
                Instant.now().plus(props.getRecreationDelay()));
        return true;
    }

    private synchronized void recreateWorkerSafely() {
        recreateWorker();
    }

    /**
     * Drops the current worker: bumps the generation so its late messages are ignored, terminates
     * it and puts an unfinished in-flight job back in the queue.
     */
    private void retireWorker() {
        generation++;
        TranscriptionWorker retired = worker;
        worker = null;
        busy = false;
        if (retired != null) {
            try {
                retired.terminate();
            } catch (RuntimeException e) {
                LOG.warn("Error terminating transcription worker: {}", e.toString());
            }
        }
        requeueInFlight();
    }

    private void requeueInFlight() {
        String jobId = inFlightJobId;
        inFlightJobId = null;
        if (jobId == null) {
            return;
        }
        int idx = indexOf(jobId);
        if (idx < 0) {
            return;
        }
        TranscriptionJob job = jobs.get(idx);
        if (job.status().isActive()) {
            TranscriptionJob requeued = job.requeued();
            jobs.set(idx, requeued);
            LOG.warn("Job {} was {} when its worker stopped; returned to queue", jobId, job.status());
            publisher.publishEvent(new TranscriptionJobUpdatedEvent(requeued, Instant.now()));
        }
    }

    private void cancelRecreationTimer() {
        ScheduledFuture<?> timer = recreationTimer;
        recreationTimer = null;
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private boolean recreationExhausted() {
        return consecutiveFailures > props.getMaxRecreationAttempts();
    }

    // ---- dispatch ---------------------------------------------------------------------------

    private void dispatchNext() {
        if (worker == null || busy || paused || stopped || inFlightJobId != null) {
            return;
        }
        TranscriptionJob next = null;
        for (TranscriptionJob job : jobs) {
            if (job.status() == TranscriptionStatus.QUEUED) {
                next = job;
                break;
            }
        }
        if (next == null) {
            return;
        }
        busy = true;
        inFlightJobId = next.jobId();
        try {
            worker.post(next);
            LOG.info("Dispatched job {} (event {}) to worker", next.jobId(), next.eventId());
        } catch (RuntimeException e) {
            // Job stays queued for the next dispatch after recovery
            busy = false;
            inFlightJobId = null;
            handleWorkerFault(generation, "Failed to send job " + next.jobId() + " to worker: " + e.getMessage());
        }
    }

    // ---- worker messages --------------------------------------------------------------------

    private WorkerListener listenerFor(int gen) {
        return new WorkerListener() {
            @Override
            public void onMessage(WorkerMessage message) {
                deliver(() -> handleMessage(gen, message));
            }

            @Override
            public void onError(Throwable error) {
                deliver(() -> handleWorkerError(gen, error));
            }

            @Override
            public void onExit(int exitCode) {
                deliver(() -> handleWorkerExit(gen, exitCode));
            }
        };
    }

    private void deliver(Runnable task) {
        try {
            managerExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Worker callback dropped; manager executor is not accepting tasks");
        }
    }

    synchronized void handleMessage(int gen, WorkerMessage message) {
        if (gen != generation) {
            LOG.debug("Ignoring {} from retired worker generation {}", message, gen);
            return;
        }
        if (message instanceof WorkerReady) {
            onReady();
        } else if (message instanceof JobStatusUpdate update) {
            onStatusUpdate(update);
        } else {
            LOG.warn("Unknown worker message: {}", message);
        }
    }

    private synchronized void handleWorkerError(int gen, Throwable error) {
        if (gen != generation) {
            return;
        }
        LOG.error("Transcription worker reported a fault", error);
        handleWorkerFault(gen, "Worker error: " + error);
    }

    private synchronized void handleWorkerExit(int gen, int exitCode) {
        if (gen != generation) {
            return;
        }
        if (exitCode == 0) {
            LOG.info("Transcription worker exited cleanly");
            retireWorker();
            consecutiveFailures = 0;
            return;
        }
        handleWorkerFault(gen, "Worker exited with code " + exitCode);
    }

    private void onReady() {
        busy = false;
        consecutiveFailures = 0;
        unavailableAnnounced = false;
        cancelRecreationTimer();
        if (inFlightJobId != null) {
            int idx = indexOf(inFlightJobId);
            // The ready sent at start-up can arrive after the first job was already sent
            if (idx < 0 || jobs.get(idx).status().isTerminal()) {
                inFlightJobId = null;
            }
        }
        dispatchNext();
    }

    private void onStatusUpdate(JobStatusUpdate update) {
        int idx = indexOf(update.jobId());
        if (idx < 0) {
            LOG.warn("Status update {} for unknown job {}; dropping", update.status(), update.jobId());
            return;
        }
        TranscriptionJob current = jobs.get(idx);
        if (current.status().isTerminal()) {
            LOG.debug("Ignoring {} update for finished job {}", update.status(), update.jobId());
            return;
        }
        TranscriptionJob updated = current.transition(update.status(), update.progress(), update.error(),
                update.transcript(), update.mixedAudioPath());
        jobs.set(idx, updated);
        if (updated.status() != current.status()) {
            LOG.info("Job {} {} -> {}", updated.jobId(), current.status(), updated.status());
        } else {
            LOG.debug("Job {} progress {}%", updated.jobId(), updated.progress());
        }
        publisher.publishEvent(new TranscriptionJobUpdatedEvent(updated, Instant.now()));
        persist(updated);
    }

    private void persist(TranscriptionJob job) {
        boolean relevant = switch (job.status()) {
            case COMPLETED -> job.transcript() != null;
            case FAILED -> job.error() != null;
            case TRANSCRIBING -> job.progress() != null;
            default -> false;
        };
        if (!relevant) {
            return;
        }
        try {
            persistenceExecutor.execute(() -> {
                try {
                    store.recordTranscriptionResult(job.eventId(), job.status(), job.transcript(), job.error(),
                            job.progress());
                } catch (RuntimeException e) {
                    LOG.error("Failed to persist {} result for event {}: {}", job.status(), job.eventId(),
                            e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.error("Persistence executor rejected {} result for event {}", job.status(), job.eventId());
        }
    }

    private int indexOf(String jobId) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).jobId().equals(jobId)) {
                return i;
            }
        }
        return -1;
    }
}
