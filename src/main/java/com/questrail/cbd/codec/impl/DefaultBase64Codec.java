package com.questrail.cbd.codec.impl;

import com.questrail.cbd.codec.Base64Codec;
import com.questrail.cbd.config.Base64Alphabet;
import com.questrail.cbd.exceptions.Base64Exception;

import java.util.Base64;
import java.util.Objects;

import static com.questrail.cbd.exceptions.Base64Exception.Kind.INVALID_CHARACTER;
import static com.questrail.cbd.exceptions.Base64Exception.Kind.INVALID_LENGTH;

/**
 * DefaultBase64Codec
 * -----------------------------------------------------------------------------
 * {@link Base64Codec} backed by {@link java.util.Base64}.
 *
 * <p>Output is always unpadded, in the configured alphabet. Input is accepted
 * in either alphabet, padded or not, because base64 text handed to the tool
 * comes from many producers. A validation pass runs before the JDK decoder so
 * that failures carry a kind and a character offset instead of a bare
 * {@link IllegalArgumentException}.</p>
 */
public final class DefaultBase64Codec implements Base64Codec
{
    private final Base64.Encoder encoder;

    public DefaultBase64Codec()
    {
        this(Base64Alphabet.STANDARD);
    }

    public DefaultBase64Codec(Base64Alphabet alphabet)
    {
        Objects.requireNonNull(alphabet, "alphabet");
        this.encoder = (alphabet == Base64Alphabet.URL_SAFE)
                ? Base64.getUrlEncoder().withoutPadding()
                : Base64.getEncoder().withoutPadding();
    }

    @Override
    public String encode(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        return encoder.encodeToString(bytes);
    }

    @Override
    public byte[] decode(String text)
    {
        Objects.requireNonNull(text, "text");

        int start = 0;
        int end = text.length();
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }

        boolean standardSeen = false;
        boolean urlSafeSeen = false;
        int dataEnd = -1;

        for (int i = start; i < end; i++) {
            final char c = text.charAt(i);

            if (c == '=') {
                if (dataEnd < 0) {
                    dataEnd = i;
                }
                continue;
            }
            if (dataEnd >= 0) {
                throw new Base64Exception(INVALID_CHARACTER, i,
                        "Character '" + c + "' after padding");
            }

            if (c == '+' || c == '/') {
                standardSeen = true;
            }
            else if (c == '-' || c == '_') {
                urlSafeSeen = true;
            }
            else if (!isAlphanumeric(c)) {
                throw new Base64Exception(INVALID_CHARACTER, i,
                        "Character '" + printable(c) + "' is not in the base64 alphabet");
            }

            if (standardSeen && urlSafeSeen) {
                throw new Base64Exception(INVALID_CHARACTER, i,
                        "Standard and URL-safe base64 alphabets are mixed");
            }
        }

        if (dataEnd < 0) {
            dataEnd = end;
        }
        final int dataLength = dataEnd - start;
        final int padding = end - dataEnd;

        if (dataLength % 4 == 1) {
            throw new Base64Exception(INVALID_LENGTH, dataEnd,
                    "Base64 data length " + dataLength + " leaves a dangling character");
        }
        if (padding > 0 && (padding > 2 || (dataLength + padding) % 4 != 0)) {
            throw new Base64Exception(INVALID_LENGTH, dataEnd,
                    "Padding of " + padding + " character(s) does not complete a 4-character group");
        }

        final String data = text.substring(start, dataEnd);
        try {
            return (urlSafeSeen ? Base64.getUrlDecoder() : Base64.getDecoder()).decode(data);
        }
        catch (IllegalArgumentException e) {
            throw new Base64Exception(INVALID_LENGTH, start, e.getMessage(), e);
        }
    }

    private static boolean isAlphanumeric(char c)
    {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }

    private static String printable(char c)
    {
        return (c < 0x20 || c > 0x7E) ? String.format("U+%04X", (int) c) : String.valueOf(c);
    }
}
