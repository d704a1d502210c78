package com.questrail.cbd.observability;

/**
 * No-op implementation of TranscodeObservabilitySink.
 */
public final class NullObservabilitySink implements TranscodeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTranscodeCompleted(TranscodeCompletedEvent event) {}

    @Override
    public void onError(TranscodeErrorEvent event) {}
}
