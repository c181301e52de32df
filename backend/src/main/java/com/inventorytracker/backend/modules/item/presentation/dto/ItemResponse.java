package com.inventorytracker.backend.modules.item.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record ItemResponse(
        long id,
        String name,
        String description,
        int quantity,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {
}
