/**
 * Default codec implementations.
 *
 * <p>The CBOR decoder and encoder read and write through Netty
 * {@link io.netty.buffer.ByteBuf}s; buffers are allocated per call and
 * released before returning, so callers only ever see {@code byte[]}.
 * The JSON side works on in-memory strings.</p>
 *
 * <p>Every implementation holds configuration only and is safe to share
 * between threads.</p>
 */
package com.questrail.cbd.codec.impl;
