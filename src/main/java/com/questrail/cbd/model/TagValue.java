package com.questrail.cbd.model;

import java.util.Objects;

/**
 * Tagged value (CBOR major type 6).
 *
 * <p>The tag number is an unsigned 64-bit quantity stored in a {@code long};
 * use {@link Long#toUnsignedString(long)} to display it. No tag is given
 * any meaning here: dates, bignums and the like stay opaque and are passed
 * through unchanged.</p>
 */
public record TagValue(long tag, Value content) implements Value
{
    public TagValue {
        Objects.requireNonNull(content, "content");
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(tag) + "(" + content + ")";
    }
}
