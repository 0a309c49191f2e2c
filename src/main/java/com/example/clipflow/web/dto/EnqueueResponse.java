package com.example.clipflow.web.dto;

import com.example.clipflow.service.EnqueueResult;
import com.fasterxml.jackson.annotation.JsonProperty;

public record EnqueueResponse(
        @JsonProperty("work_unit_id") Long workUnitId,
        boolean created
) {

    public static EnqueueResponse from(EnqueueResult result) {
        return new EnqueueResponse(result.workUnitId(), result.created());
    }
}
