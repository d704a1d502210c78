package com.questrail.cbd.config;

/**
 * How the JSON printer handles CBOR byte strings, which JSON cannot
 * represent natively.
 */
public enum ByteStringPolicy
{
    /** Print as a JSON string holding the unpadded base64 form of the bytes. */
    BASE64,

    /** Fail with {@code JsonPrintException.Kind#UNSUPPORTED_VALUE}. */
    REJECT
}
