package com.phillippitts.meetingscribe.service.process;

import com.phillippitts.meetingscribe.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * Shared helpers for tearing down subprocesses and their gobbler threads.
 */
public final class ProcessSupport {

    private static final Logger LOG = LogManager.getLogger(ProcessSupport.class);

    private ProcessSupport() {
    }

    /**
     * Destroys a process gracefully, escalating to {@link Process#destroyForcibly()} if it does not
     * exit within {@link ProcessTimeouts#GRACEFUL_SHUTDOWN_TIMEOUT}.
     */
    public static void destroy(Process process) {
        if (process == null) {
            return;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            // Interrupted mid-teardown (worker termination); make sure the child still dies
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }

    static void joinQuietly(Thread thread, long timeoutMillis) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
