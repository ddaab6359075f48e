package com.phillippitts.cvtailor.domain;

/**
 * Lifecycle state of a session. The approval lock is tracked separately on {@link Session}.
 *
 * <pre>
 * PROCESSING -> COMPLETED | FAILED       (end of a generation run)
 * COMPLETED | FAILED -> PROCESSING       (regeneration, only while unlocked)
 * </pre>
 */
public enum SessionState {
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean terminal() {
        return this != PROCESSING;
    }
}
