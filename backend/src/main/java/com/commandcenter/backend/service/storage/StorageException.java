package com.commandcenter.backend.service.storage;

/** A collection document could not be written. */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
