package com.questrail.cbd.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MapValue
 * -----------------------------------------------------------------------------
 * Ordered sequence of key/value pairs (CBOR major type 5, JSON object).
 *
 * <h2>Ordering and duplicates</h2>
 * <p>Entries keep insertion order end-to-end. Nothing in this model sorts
 * keys into canonical CBOR order, and nothing collapses duplicate keys:
 * a JSON object that repeats a member name yields two entries, in the order
 * they were written.</p>
 *
 * <h2>Key types</h2>
 * <p>CBOR allows any value as a key, so keys are {@link Value}s. Only some
 * of them can be printed as JSON member names; that decision belongs to the
 * printer.</p>
 */
public record MapValue(List<MapEntry> entries) implements Value
{
    public MapValue {
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }

    public int size() {
        return entries.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return entries.toString().replace('[', '{').replace(']', '}');
    }

    public static final class Builder {
        private final List<MapEntry> entries = new ArrayList<>();

        public Builder put(Value key, Value value) {
            entries.add(new MapEntry(key, value));
            return this;
        }

        public Builder put(String key, Value value) {
            return put(new TextStringValue(key), value);
        }

        public MapValue build() {
            return new MapValue(entries);
        }
    }
}
