package com.questrail.cbd.observability;

/**
 * Main interface for receiving transcode observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface TranscodeObservabilitySink {
    /**
     * Called after a transcode produced its complete output.
     * @param event the completion details
     */
    void onTranscodeCompleted(TranscodeCompletedEvent event);

    /**
     * Called when a transcode fails, before the failure propagates to the caller.
     * @param event the error event
     */
    void onError(TranscodeErrorEvent event);
}
