package com.cloudalerts.common.handle;

import java.util.Base64;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Helpers for the 64-bit handles that identify users, nodes, shares and meetings.
 * User handles are 8 bytes wide on the wire, node handles 6 bytes.
 * The textual form is URL-safe base64 (no padding) over the little-endian bytes.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Handles {

    public static final long UNDEF = -1L;

    public static final int USER_HANDLE_SIZE = 8;
    public static final int NODE_HANDLE_SIZE = 6;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    public static boolean isUndef(long handle) {
        return handle == UNDEF;
    }

    public static String toBase64(long handle, int size) {
        byte[] bytes = new byte[size];
        for (int i = 0; i < size; i++) {
            bytes[i] = (byte) (handle >>> (8 * i));
        }
        return ENCODER.encodeToString(bytes);
    }

    /**
     * Decodes a handle of {@code size} bytes; returns {@link #UNDEF} when the text is not a
     * handle of that size.
     */
    public static long fromBase64(String encoded, int size) {
        if (encoded == null || encoded.isEmpty()) {
            return UNDEF;
        }
        byte[] bytes;
        try {
            bytes = DECODER.decode(encoded);
        } catch (IllegalArgumentException e) {
            return UNDEF;
        }
        if (bytes.length != size) {
            return UNDEF;
        }
        long handle = 0;
        for (int i = 0; i < size; i++) {
            handle |= (bytes[i] & 0xFFL) << (8 * i);
        }
        return handle;
    }

    public static String display(long handle) {
        return isUndef(handle) ? "UNDEF" : toBase64(handle, USER_HANDLE_SIZE);
    }
}
