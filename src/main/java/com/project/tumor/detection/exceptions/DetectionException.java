package com.project.tumor.detection.exceptions;

/** Base of all pipeline failures. Carries the category reported to clients. */
public abstract class DetectionException extends RuntimeException {
    protected DetectionException(String message) { super(message); }
    protected DetectionException(String message, Throwable cause) { super(message, cause); }

    public abstract ErrorKind kind();
}
