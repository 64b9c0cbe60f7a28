package com.mailbox.provisioner.storage;

import java.io.IOException;

/**
 * The credential store could not be persisted after all write attempts. The
 * in-memory state has been rolled back to the last committed state.
 */
public class StoreWriteException extends RuntimeException {

    public StoreWriteException(String message, IOException cause) {
        super(message, cause);
    }
}
