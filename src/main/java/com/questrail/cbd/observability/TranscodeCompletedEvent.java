package com.questrail.cbd.observability;

import com.questrail.cbd.config.TranscodeDirection;

import java.time.Duration;
import java.time.Instant;

/**
 * Record describing a successful transcode.
 *
 * @param base64 whether the binary side actually went through base64
 *               (for auto-detection, whether base64 was detected)
 */
public record TranscodeCompletedEvent(
    Instant timestamp,
    TranscodeDirection direction,
    boolean base64,
    int inputBytes,
    int outputBytes,
    Duration elapsed
) {
}
