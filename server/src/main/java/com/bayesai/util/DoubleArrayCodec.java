package com.bayesai.util;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;

/**
 * Packs posterior weights into BLOB columns, big-endian IEEE 754. Decoding
 * can check the blob against the row count stored beside it.
 */
public class DoubleArrayCodec {

    public static byte[] toBytes(double[] weights) {
        if (weights == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(weights.length * Double.BYTES);
        buffer.asDoubleBuffer().put(weights);
        return buffer.array();
    }

    public static double[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        if (bytes.length % Double.BYTES != 0) {
            throw new IllegalArgumentException("Blob length " + bytes.length + " is not a multiple of " + Double.BYTES);
        }
        DoubleBuffer buffer = ByteBuffer.wrap(bytes).asDoubleBuffer();
        double[] weights = new double[buffer.remaining()];
        buffer.get(weights);
        return weights;
    }

    /** Decodes a blob that must hold exactly {@code expectedCount} weights. */
    public static double[] fromBytes(byte[] bytes, int expectedCount) {
        if (bytes == null) {
            throw new IllegalArgumentException("Missing weights, expected " + expectedCount);
        }
        double[] weights = fromBytes(bytes);
        if (weights.length != expectedCount) {
            throw new IllegalArgumentException("Expected " + expectedCount + " weights but blob holds "
                    + weights.length);
        }
        return weights;
    }
}
