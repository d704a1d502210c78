package com.questrail.cbd.config;

/**
 * Direction of a transcode.
 */
public enum TranscodeDirection
{
    /** CBOR in, JSON out. */
    DECODE,

    /** JSON in, CBOR out. */
    ENCODE
}
