package com.questrail.cbd.model;

/**
 * The null value. CBOR simple value 22, JSON {@code null}.
 */
public enum NullValue implements Value
{
    INSTANCE;

    @Override
    public String toString() {
        return "null";
    }
}
