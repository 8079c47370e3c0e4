package com.ragsync.ingest;

import java.io.IOException;
import java.nio.file.Path;

public class StateStoreException extends IOException {
    private static final long serialVersionUID = 1L;

    public StateStoreException(Path storePath, String action, Throwable cause) {
        super("State store " + storePath + " failed to " + action + ": " + cause.getMessage(), cause);
    }
}
