/**
 * CBD Codec Boundaries
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> interfaces of the
 * transcoder. Each interface is one direction across one format boundary:</p>
 *
 * <pre>
 *   byte[] cbor  -> CborDecoder  -> Value -> JsonPrinter -> String json
 *   String json  -> JsonParser   -> Value -> CborEncoder -> byte[] cbor
 *   byte[] / String             <-> Base64Codec
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>{@link com.questrail.cbd.model.Value} is the only type that crosses
 *       from one format to the other.</li>
 *   <li>Implementations throw the structured exceptions of
 *       {@link com.questrail.cbd.exceptions}; they never print or exit.</li>
 *   <li>All implementations live in {@code codec.impl}. Netty buffers used by
 *       the CBOR implementations never escape that package.</li>
 * </ul>
 */
package com.questrail.cbd.codec;
