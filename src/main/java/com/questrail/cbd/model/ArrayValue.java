package com.questrail.cbd.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of values (CBOR major type 4, JSON array).
 */
public record ArrayValue(List<Value> items) implements Value
{
    public ArrayValue {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    public int size() {
        return items.size();
    }

    public Value get(int index) {
        return items.get(index);
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
