package com.project.tumor.detection.exceptions;

/** A visualization artifact could not be encoded or written. */
public class ArtifactWriteException extends DetectionException {
    private final String artifact;

    public ArtifactWriteException(String artifact, String message, Throwable cause) {
        super("Failed to write " + artifact + " artifact: " + message, cause);
        this.artifact = artifact;
    }

    public String artifact() { return artifact; }

    @Override
    public ErrorKind kind() { return ErrorKind.IO; }
}
