package com.project.tumor.detection.exceptions;

/** Numerical failure while filtering, thresholding or labelling. */
public class ProcessingException extends DetectionException {
    public ProcessingException(String message) { super(message); }
    public ProcessingException(String message, Throwable cause) { super(message, cause); }

    @Override
    public ErrorKind kind() { return ErrorKind.PROCESSING; }
}
