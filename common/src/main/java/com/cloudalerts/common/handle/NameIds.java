package com.cloudalerts.common.handle;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Packs short ASCII codes (up to eight characters, e.g. {@code put}, {@code dshare}) into a
 * single {@code long}, first character in the most significant used byte.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class NameIds {

    public static final int MAX_LENGTH = 8;

    public static long of(String code) {
        if (code == null || code.isEmpty() || code.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("name id code must have 1.." + MAX_LENGTH + " chars: " + code);
        }
        long id = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == 0 || c > 0x7F) {
                throw new IllegalArgumentException("name id code must be ASCII: " + code);
            }
            id = (id << 8) | c;
        }
        return id;
    }

    public static String toCode(long nameId) {
        var sb = new StringBuilder(MAX_LENGTH);
        for (int shift = 56; shift >= 0; shift -= 8) {
            int c = (int) ((nameId >>> shift) & 0xFF);
            if (c != 0) {
                sb.append((char) c);
            }
        }
        return sb.toString();
    }
}
