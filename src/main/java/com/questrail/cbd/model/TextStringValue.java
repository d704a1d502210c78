package com.questrail.cbd.model;

import java.util.Objects;

/**
 * Unicode text (CBOR major type 3, JSON string).
 */
public record TextStringValue(String value) implements Value
{
    public TextStringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
