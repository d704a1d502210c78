package com.questrail.cbd.codec;

import com.questrail.cbd.exceptions.CborEncodeException;
import com.questrail.cbd.model.Value;

/**
 * CborEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for CBOR (RFC 8949).
 *
 * <p>The mechanical inverse of {@link CborDecoder}. Output always uses
 * definite lengths; map entries keep the order stored in the value.</p>
 */
public interface CborEncoder
{
    /**
     * Encode a value into one complete CBOR data item.
     *
     * @throws CborEncodeException if the value lies outside what CBOR can carry
     */
    byte[] encode(Value value);
}
