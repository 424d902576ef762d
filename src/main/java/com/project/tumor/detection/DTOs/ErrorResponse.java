package com.project.tumor.detection.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body of the JSON endpoints. Rejected uploads only carry {@code error}; pipeline failures
 * also carry {@code resultado = "error"} and the failure category in {@code tipo}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        @JsonProperty("resultado") String status,
        @JsonProperty("error") String error,
        @JsonProperty("tipo") String kind
) {
    public static ErrorResponse rejected(String error) {
        return new ErrorResponse(null, error, null);
    }

    public static ErrorResponse failed(String kind, String error) {
        return new ErrorResponse("error", error, kind);
    }
}
