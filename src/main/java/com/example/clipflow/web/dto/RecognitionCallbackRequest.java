package com.example.clipflow.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RecognitionCallbackRequest(
        @JsonProperty("correlation_id")
        @NotBlank(message = "correlation_id is required")
        @Size(max = 64)
        String correlationId,

        @NotBlank(message = "status is required")
        String status,

        @JsonProperty("result_ref")
        @Size(max = 1000)
        String resultRef,

        @Size(max = 2000)
        String error
) {
}
