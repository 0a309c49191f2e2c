package com.example.clipflow.web.dto;

import com.example.clipflow.domain.WorkUnitKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record EnqueueRequest(
        @NotNull(message = "kind is required")
        WorkUnitKind kind,

        @JsonProperty("target_id")
        @NotBlank(message = "target_id is required")
        @Size(max = 100, message = "target_id cannot exceed 100 characters")
        String targetId,

        Map<String, String> params
) {
}
