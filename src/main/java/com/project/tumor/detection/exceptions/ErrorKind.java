package com.project.tumor.detection.exceptions;

/** Failure categories surfaced to callers of the detection pipeline. */
public enum ErrorKind {
    DECODE,
    PROCESSING,
    IO
}
