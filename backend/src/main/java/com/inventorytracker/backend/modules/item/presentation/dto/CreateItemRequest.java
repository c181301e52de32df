package com.inventorytracker.backend.modules.item.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * {@code description} has to be sent, but it may be {@code null}.
 * A missing {@code quantity} means 0; an explicit {@code null} is rejected.
 */
public record CreateItemRequest(
        @NotEmpty String name,
        @JsonProperty(required = true) String description,
        @JsonSetter(nulls = Nulls.FAIL) @PositiveOrZero Integer quantity
) {

    public int quantityOrDefault() {
        return quantity != null ? quantity : 0;
    }
}
