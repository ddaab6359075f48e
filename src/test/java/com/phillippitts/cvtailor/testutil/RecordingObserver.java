package com.phillippitts.cvtailor.testutil;

import com.phillippitts.cvtailor.service.progress.ProgressEvent;
import com.phillippitts.cvtailor.service.progress.ProgressEventKind;
import com.phillippitts.cvtailor.service.progress.ProgressObserver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Observer that records every event and whether it was closed.
 */
public class RecordingObserver implements ProgressObserver {

    private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
    private volatile int closeCount;

    @Override
    public void onEvent(ProgressEvent event) {
        events.add(event);
    }

    @Override
    public void onClose() {
        closeCount++;
    }

    public List<ProgressEvent> events() {
        return List.copyOf(events);
    }

    public List<ProgressEventKind> kinds() {
        return events.stream().map(ProgressEvent::kind).collect(Collectors.toList());
    }

    public List<Long> sequences() {
        return events.stream().map(ProgressEvent::sequence).collect(Collectors.toList());
    }

    public boolean isClosed() {
        return closeCount > 0;
    }

    public int closeCount() {
        return closeCount;
    }
}
