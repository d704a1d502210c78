package com.questrail.cbd.codec;

import com.questrail.cbd.exceptions.Base64Exception;

/**
 * Base64Codec
 * -----------------------------------------------------------------------------
 * Pure byte-array/text conversion used as the transport layer for the
 * binary side of a transcode, and for projecting byte strings into JSON.
 */
public interface Base64Codec
{
    /**
     * Encode bytes as unpadded base64 text in the configured alphabet.
     */
    String encode(byte[] bytes);

    /**
     * Decode base64 text. Surrounding whitespace is ignored; standard and
     * URL-safe alphabets are both accepted, padded or not.
     *
     * @throws Base64Exception if the text is not base64
     */
    byte[] decode(String text);
}
