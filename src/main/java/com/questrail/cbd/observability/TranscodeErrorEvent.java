package com.questrail.cbd.observability;

import com.questrail.cbd.config.TranscodeDirection;
import com.questrail.cbd.exceptions.TranscodeException;

import java.time.Instant;

/**
 * Record representing a failed transcode.
 */
public record TranscodeErrorEvent(
    Instant timestamp,
    TranscodeDirection direction,
    TranscodeException cause
) {
    /**
     * One-line description of the failure, as shown to users.
     */
    public String message() {
        return cause.describe();
    }
}
