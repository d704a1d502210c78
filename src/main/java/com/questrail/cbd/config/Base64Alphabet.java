package com.questrail.cbd.config;

/**
 * Alphabet used when producing base64 text. Decoding accepts either.
 */
public enum Base64Alphabet
{
    /** RFC 4648 section 4: {@code +} and {@code /}. */
    STANDARD,

    /** RFC 4648 section 5: {@code -} and {@code _}. */
    URL_SAFE
}
