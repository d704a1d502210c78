package com.questrail.cbd.config;

/**
 * Whether the binary side of a transcode goes through base64.
 */
public enum Base64Mode
{
    /** Binary side is raw CBOR bytes. */
    OFF,

    /** Binary side is base64 text: decoded before CBOR decode, encoded after CBOR encode. */
    ON,

    /**
     * Decode direction only: treat the input as base64 if it is base64 text
     * that decodes to a well-formed CBOR item, otherwise as raw CBOR.
     * Behaves like {@link #OFF} in the encode direction.
     */
    AUTO
}
