package com.umitunal.qrunner.serialization;

/**
 * Encodes and decodes values written to disk, such as the running-jobs recovery file.
 *
 * @param <T> the type of value
 */
public interface PayloadCodec<T> {

    /**
     * Encode a value to bytes.
     */
    byte[] encode(T value);

    /**
     * Decode bytes to a value.
     *
     * @throws IllegalStateException if the bytes are not a valid encoding
     */
    T decode(byte[] bytes);
}
