package com.project.tumor.detection.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of a successful {@code /api/analyze} call. */
public record AnalysisResponse(
        @JsonProperty("resultado") String status,
        @JsonProperty("hay_tumor") boolean hasTumor,
        @JsonProperty("imagen_marcada") String markedImageUrl
) {
    public static AnalysisResponse processed(boolean hasTumor, String markedImageUrl) {
        return new AnalysisResponse("procesado", hasTumor, markedImageUrl);
    }
}
