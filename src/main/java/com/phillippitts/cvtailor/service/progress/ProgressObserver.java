package com.phillippitts.cvtailor.service.progress;

/**
 * Receives progress events in emission order.
 *
 * <p>An observer that throws from {@link #onEvent} is detached; the run itself is unaffected.
 */
public interface ProgressObserver {

    void onEvent(ProgressEvent event);

    /**
     * Called once after the terminal event, or immediately on attach to a finished log.
     */
    default void onClose() {
    }
}
