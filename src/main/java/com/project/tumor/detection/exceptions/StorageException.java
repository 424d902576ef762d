package com.project.tumor.detection.exceptions;

/** Upload rejected or could not be stored. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
