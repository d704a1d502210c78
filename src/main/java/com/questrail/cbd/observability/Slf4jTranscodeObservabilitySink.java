package com.questrail.cbd.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TranscodeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTranscodeObservabilitySink implements TranscodeObservabilitySink {
    private final Logger log;

    public Slf4jTranscodeObservabilitySink() {
        this(LoggerFactory.getLogger(Slf4jTranscodeObservabilitySink.class));
    }

    Slf4jTranscodeObservabilitySink(Logger log) {
        this.log = log;
    }

    @Override
    public void onTranscodeCompleted(TranscodeCompletedEvent event) {
        log.info("Transcode {}{}: {} byte(s) in, {} byte(s) out in {} ms",
            event.direction(),
            event.base64() ? " (base64)" : "",
            event.inputBytes(),
            event.outputBytes(),
            event.elapsed().toMillis());
    }

    @Override
    public void onError(TranscodeErrorEvent event) {
        log.warn("Transcode {} failed: {}", event.direction(), event.message(), event.cause());
    }
}
