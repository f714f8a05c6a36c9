package com.openforge.alchemy.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Stores a float vector as a packed little-endian float32 BLOB
 * (4 bytes per component, no header; the length is implied by the blob size).
 */
@Converter
public class EmbeddingConverter implements AttributeConverter<float[], byte[]> {

    @Override
    public byte[] convertToDatabaseColumn(float[] vector) {
        if (vector == null) return null;
        ByteBuffer buf = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float f : vector) buf.putFloat(f);
        return buf.array();
    }

    @Override
    public float[] convertToEntityAttribute(byte[] blob) {
        if (blob == null) return null;
        if (blob.length % Float.BYTES != 0) {
            throw new IllegalStateException("corrupt embedding blob of " + blob.length + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[blob.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) vector[i] = buf.getFloat();
        return vector;
    }
}
