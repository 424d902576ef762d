package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.exceptions.DetectionException;
import com.project.tumor.detection.exceptions.ErrorKind;
import com.project.tumor.detection.pipeline.model.DetectionResult;

import java.util.Objects;

/**
 * Either a {@link DetectionResult} or the reason detection failed. A failure is never
 * reported as a negative finding.
 */
public final class DetectionOutcome {
    private final DetectionResult result;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private DetectionOutcome(DetectionResult result, ErrorKind errorKind, String errorMessage) {
        this.result = result;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static DetectionOutcome ok(DetectionResult result) {
        return new DetectionOutcome(Objects.requireNonNull(result), null, null);
    }

    public static DetectionOutcome failed(ErrorKind kind, String message) {
        return new DetectionOutcome(null, Objects.requireNonNull(kind), message);
    }

    public static DetectionOutcome failed(DetectionException e) {
        return failed(e.kind(), e.getMessage());
    }

    public boolean isOk() {
        return result != null;
    }

    /** @throws IllegalStateException on a failed outcome */
    public DetectionResult result() {
        if (result == null) {
            throw new IllegalStateException("Detection failed (" + errorKind + "): " + errorMessage);
        }
        return result;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public String errorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok[" + result + "]" : "Err[" + errorKind + ": " + errorMessage + "]";
    }
}
