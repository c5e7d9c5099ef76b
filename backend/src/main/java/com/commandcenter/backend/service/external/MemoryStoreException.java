package com.commandcenter.backend.service.external;

/** The long-term memory store could not be opened or queried. */
public class MemoryStoreException extends RuntimeException {

    public MemoryStoreException(String message) {
        super(message);
    }

    public MemoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
