package com.phillippitts.meetingscribe.testutil;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * TaskScheduler that never runs anything on its own. Tests fire scheduled tasks explicitly with
 * {@link #runNext()}, so recovery timing is deterministic.
 *
 * <p>Only one-shot scheduling is supported; the periodic variants fail fast.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final List<ManualFuture> scheduled = new ArrayList<>();

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        ManualFuture future = new ManualFuture(task, Duration.between(Instant.now(), startTime));
        scheduled.add(future);
        return future;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("trigger scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException("fixed-rate scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException("fixed-rate scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException("fixed-delay scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException("fixed-delay scheduling not supported");
    }

    /**
     * @return number of tasks that are neither run nor cancelled
     */
    public synchronized int pendingCount() {
        return (int) scheduled.stream().filter(ManualFuture::isPending).count();
    }

    /**
     * @return total number of tasks ever scheduled
     */
    public synchronized int scheduledCount() {
        return scheduled.size();
    }

    /**
     * @return requested delay of the most recently scheduled task
     */
    public synchronized Duration lastDelay() {
        if (scheduled.isEmpty()) {
            throw new IllegalStateException("nothing scheduled");
        }
        return scheduled.get(scheduled.size() - 1).delay;
    }

    /**
     * Runs the oldest pending task on the calling thread.
     *
     * @throws IllegalStateException if nothing is pending
     */
    public void runNext() {
        ManualFuture next;
        synchronized (this) {
            next = scheduled.stream().filter(ManualFuture::isPending).findFirst()
                    .orElseThrow(() -> new IllegalStateException("no pending task"));
            next.done = true;
        }
        next.task.run();
    }

    private static final class ManualFuture implements ScheduledFuture<Object> {
        private final Runnable task;
        private final Duration delay;
        private volatile boolean cancelled;
        private volatile boolean done;

        ManualFuture(Runnable task, Duration delay) {
            this.task = task;
            this.delay = delay;
        }

        boolean isPending() {
            return !cancelled && !done;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(delay.toNanos(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
