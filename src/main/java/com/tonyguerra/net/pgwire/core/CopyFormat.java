package com.tonyguerra.net.pgwire.core;

import java.util.Arrays;

import com.tonyguerra.net.pgwire.core.components.BackendMessage;

/**
 * Format of an active COPY as announced by CopyInResponse / CopyOutResponse.
 */
public final class CopyFormat {
    private final boolean binary;
    private final boolean[] fieldBinary;

    public CopyFormat(boolean binary, boolean[] fieldBinary) {
        this.binary = binary;
        this.fieldBinary = fieldBinary.clone();
    }

    static CopyFormat parse(BackendMessage msg) {
        final var body = msg.body();
        final boolean binary = body.get() != 0;
        final int count = body.getShort() & 0xffff; // Int16 count, never negative
        final boolean[] fields = new boolean[count];
        for (int i = 0; i < count; i++) {
            fields[i] = body.getShort() != 0;
        }

        return new CopyFormat(binary, fields);
    }

    public boolean isBinary() {
        return binary;
    }

    /**
     * @param fieldNumber zero-based field index
     * @return false for indexes outside the row
     */
    public boolean fieldIsBinary(int fieldNumber) {
        return fieldNumber >= 0 && fieldNumber < fieldBinary.length && fieldBinary[fieldNumber];
    }

    public int fieldCount() {
        return fieldBinary.length;
    }

    @Override
    public String toString() {
        return "CopyFormat[" + (binary ? "binary" : "text") + ", fields=" + Arrays.toString(fieldBinary) + "]";
    }
}
