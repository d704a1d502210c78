package com.questrail.cbd.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements TranscodeObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTranscodeCompleted(TranscodeCompletedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(TranscodeErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<TranscodeCompletedEvent> getCompletions() {
        return events.stream()
            .filter(e -> e instanceof TranscodeCompletedEvent)
            .map(e -> (TranscodeCompletedEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<TranscodeErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof TranscodeErrorEvent)
            .map(e -> (TranscodeErrorEvent) e)
            .collect(Collectors.toList());
    }
}
