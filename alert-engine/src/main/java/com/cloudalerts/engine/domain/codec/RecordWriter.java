package com.cloudalerts.engine.domain.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

/**
 * Little-endian writer for persisted alert records. Strings are a 4-byte length followed by
 * UTF-8 bytes; handle lists are a 4-byte count followed by 8-byte handles.
 */
final class RecordWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream(64);

    RecordWriter writeLong(long value) {
        for (int i = 0; i < Long.BYTES; i++) {
            out.write((int) (value >>> (8 * i)));
        }
        return this;
    }

    RecordWriter writeInt(int value) {
        for (int i = 0; i < Integer.BYTES; i++) {
            out.write(value >>> (8 * i));
        }
        return this;
    }

    RecordWriter writeHandle(long handle) {
        return writeLong(handle);
    }

    RecordWriter writeBool(boolean value) {
        out.write(value ? 1 : 0);
        return this;
    }

    RecordWriter writeString(String value) {
        byte[] bytes = (value == null ? "" : value).getBytes(StandardCharsets.UTF_8);
        writeInt(bytes.length);
        out.write(bytes, 0, bytes.length);
        return this;
    }

    RecordWriter writeHandles(Collection<Long> handles) {
        writeInt(handles.size());
        for (long handle : handles) {
            writeHandle(handle);
        }
        return this;
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }
}
