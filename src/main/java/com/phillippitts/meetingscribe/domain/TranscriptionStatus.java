package com.phillippitts.meetingscribe.domain;

import java.util.Locale;

/**
 * Lifecycle states of a {@link TranscriptionJob}.
 *
 * <p>Allowed transitions: {@code queued -> mixing -> transcribing -> completed|failed},
 * and {@code mixing -> failed}. A job returned to the queue after a worker fault
 * goes back to {@code queued}.
 */
public enum TranscriptionStatus {
    QUEUED,
    MIXING,
    TRANSCRIBING,
    COMPLETED,
    FAILED;

    /** True for {@code completed} and {@code failed}. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** True while the worker holds the job ({@code mixing} or {@code transcribing}). */
    public boolean isActive() {
        return this == MIXING || this == TRANSCRIBING;
    }

    /**
     * Wire name used in JSON, persisted documents and logs.
     */
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
