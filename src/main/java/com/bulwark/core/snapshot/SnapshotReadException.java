package com.bulwark.core.snapshot;

import java.io.IOException;

/**
 * Thrown when a snapshot file cannot be read or decoded as UTF-8 text,
 * or when its attributes are unavailable.
 */
public class SnapshotReadException extends IOException {
    public SnapshotReadException(String message) {
        super(message);
    }

    public SnapshotReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
