package com.cloudalerts.engine.domain.codec;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads what {@link RecordWriter} writes. Any short read or nonsensical length throws
 * {@link MalformedAlertRecordException}.
 */
final class RecordReader {

    private final byte[] data;
    private int position;

    RecordReader(byte[] data) {
        this.data = data;
    }

    long readLong() {
        require(Long.BYTES);
        long value = 0;
        for (int i = 0; i < Long.BYTES; i++) {
            value |= (data[position + i] & 0xFFL) << (8 * i);
        }
        position += Long.BYTES;
        return value;
    }

    int readInt() {
        require(Integer.BYTES);
        int value = 0;
        for (int i = 0; i < Integer.BYTES; i++) {
            value |= (data[position + i] & 0xFF) << (8 * i);
        }
        position += Integer.BYTES;
        return value;
    }

    long readHandle() {
        return readLong();
    }

    boolean readBool() {
        require(1);
        int value = data[position++];
        if (value != 0 && value != 1) {
            throw new MalformedAlertRecordException("invalid boolean byte " + value + " at " + (position - 1));
        }
        return value == 1;
    }

    String readString() {
        int length = readLength(1);
        var value = new String(data, position, length, StandardCharsets.UTF_8);
        position += length;
        return value;
    }

    Set<Long> readHandles() {
        int count = readLength(Long.BYTES);
        var handles = new LinkedHashSet<Long>(count * 2);
        for (int i = 0; i < count; i++) {
            handles.add(readHandle());
        }
        return handles;
    }

    boolean hasRemaining() {
        return position < data.length;
    }

    private int readLength(int elementSize) {
        int count = readInt();
        if (count < 0 || (long) count * elementSize > data.length - position) {
            throw new MalformedAlertRecordException("length " + count + " overruns record at " + position);
        }
        return count;
    }

    private void require(int bytes) {
        if (data.length - position < bytes) {
            throw new MalformedAlertRecordException(
                    "record truncated: need " + bytes + " bytes at " + position + ", have " + (data.length - position));
        }
    }
}
