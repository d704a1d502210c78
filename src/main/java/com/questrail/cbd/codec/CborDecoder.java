package com.questrail.cbd.codec;

import com.questrail.cbd.exceptions.CborDecodeException;
import com.questrail.cbd.model.Value;

/**
 * CborDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for CBOR (RFC 8949).
 *
 * <p>This interface defines the inbound boundary between raw CBOR bytes and
 * the {@link Value} model.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Reading exactly one top-level data item</li>
 *   <li>Detecting truncation, malformed items and trailing bytes</li>
 *   <li>Bounding nesting depth</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for interpreting tags,
 * for base64 transport, or for anything JSON-related.</p>
 */
public interface CborDecoder
{
    /**
     * Decode a complete buffer holding exactly one CBOR data item.
     *
     * <p>The input is treated as a complete unit; streaming or accumulation
     * across calls is not supported.</p>
     *
     * @param bytes raw CBOR bytes
     * @return the decoded value
     * @throws CborDecodeException if the bytes are not exactly one well-formed item
     */
    Value decode(byte[] bytes);
}
