package com.cloudalerts.engine.domain.raw;

/**
 * A node handle with its node type code as listed in raw records ({@code 0} file, {@code 1} folder).
 */
public record HandleType(long handle, int type) {

    public static final int FILE = 0;
    public static final int FOLDER = 1;

    public boolean isFolder() {
        return type == FOLDER;
    }
}
