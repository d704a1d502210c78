package com.questrail.cbd.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Value
 * -----------------------------------------------------------------------------
 * Shared in-memory representation of a single CBOR data item or JSON value.
 *
 * <p>Both codecs read and write this model, so it is the only place where the
 * CBOR value space and the JSON value space meet. The union is closed: every
 * consumer (decoder, encoder, parser, printer) handles each permitted subtype
 * explicitly.</p>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link NullValue}</li>
 *   <li>{@link BoolValue}</li>
 *   <li>{@link IntegerValue} - arbitrary precision, kept apart from floats</li>
 *   <li>{@link FloatValue} - 64-bit IEEE 754</li>
 *   <li>{@link ByteStringValue} - no native JSON form</li>
 *   <li>{@link TextStringValue}</li>
 *   <li>{@link ArrayValue}</li>
 *   <li>{@link MapValue} - ordered entries, arbitrary key types, duplicates allowed</li>
 *   <li>{@link TagValue} - opaque tag number around an inner value</li>
 *   <li>{@link SimpleValue} - CBOR simple codes without a dedicated variant</li>
 * </ul>
 *
 * <h2>Immutability</h2>
 * <p>Every variant is immutable after construction. Containers copy their
 * element lists and byte strings copy their content, so a value tree can be
 * handed from one pipeline stage to the next without sharing mutable state.</p>
 */
public sealed interface Value
        permits NullValue, BoolValue, IntegerValue, FloatValue, ByteStringValue,
                TextStringValue, ArrayValue, MapValue, TagValue, SimpleValue
{
    static Value nullValue() {
        return NullValue.INSTANCE;
    }

    static Value bool(boolean value) {
        return BoolValue.of(value);
    }

    static Value integer(long value) {
        return IntegerValue.of(value);
    }

    static Value integer(BigInteger value) {
        return new IntegerValue(value);
    }

    static Value floating(double value) {
        return new FloatValue(value);
    }

    static Value bytes(byte[] value) {
        return new ByteStringValue(value);
    }

    static Value text(String value) {
        return new TextStringValue(value);
    }

    static Value array(Value... items) {
        return new ArrayValue(List.of(items));
    }

    static Value tag(long tag, Value content) {
        return new TagValue(tag, content);
    }

    static Value simple(int code) {
        return new SimpleValue(code);
    }
}
