package com.example.clipflow.web.dto;

import jakarta.validation.constraints.Size;

public record CancelRequest(
        @Size(max = 500, message = "reason cannot exceed 500 characters")
        String reason
) {
}
