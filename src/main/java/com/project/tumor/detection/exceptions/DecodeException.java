package com.project.tumor.detection.exceptions;

/** The input file is unreadable or in an unsupported format. */
public class DecodeException extends DetectionException {
    public DecodeException(String message) { super(message); }
    public DecodeException(String message, Throwable cause) { super(message, cause); }

    @Override
    public ErrorKind kind() { return ErrorKind.DECODE; }
}
