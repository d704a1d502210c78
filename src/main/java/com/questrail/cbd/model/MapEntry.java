package com.questrail.cbd.model;

import java.util.Objects;

/**
 * One key/value pair of a {@link MapValue}.
 */
public record MapEntry(Value key, Value value)
{
    public MapEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return key + ": " + value;
    }
}
