package com.cloudalerts.engine.domain.alert;

/**
 * Share revocation. Path and name are snapshots taken when the share went away, since the
 * folder is usually no longer reachable afterwards.
 */
public record DeletedShare(long folderHandle, String folderPath, String folderName, long ownerHandle)
        implements AlertPayload {

    public DeletedShare {
        folderPath = folderPath == null ? "" : folderPath;
        folderName = folderName == null ? "" : folderName;
    }
}
