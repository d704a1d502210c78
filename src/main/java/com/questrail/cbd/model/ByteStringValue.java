package com.questrail.cbd.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * ByteStringValue
 * -----------------------------------------------------------------------------
 * Ordered sequence of raw bytes (CBOR major type 2).
 *
 * <p>JSON has no byte string type. How these values are projected into JSON
 * text is a printer policy, see
 * {@link com.questrail.cbd.config.ByteStringPolicy}.</p>
 *
 * <p>Immutability is enforced via defensive copying on construction and on
 * access.</p>
 */
public record ByteStringValue(byte[] value) implements Value
{
    public ByteStringValue {
        Objects.requireNonNull(value, "value");
        value = value.clone();
    }

    /**
     * Returns a copy of the content bytes.
     */
    @Override
    public byte[] value() {
        return value.clone();
    }

    public int length() {
        return value.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteStringValue that)) return false;
        return Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "h'" + HexFormat.of().formatHex(value) + "'";
    }
}
