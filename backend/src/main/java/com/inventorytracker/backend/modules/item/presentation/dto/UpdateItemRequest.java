package com.inventorytracker.backend.modules.item.presentation.dto;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import com.inventorytracker.backend.global.common.PatchField;
import com.inventorytracker.backend.modules.item.application.ItemPatch;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Partial update body. Jackson only calls a setter for a property that appears in the JSON,
 * which is how an omitted field is told apart from an explicit {@code null}.
 * {@code name} and {@code quantity} reject an explicit {@code null}; {@code description} accepts it.
 */
public class UpdateItemRequest {

    @Size(min = 1)
    private String name;
    private boolean namePresent;

    private String description;
    private boolean descriptionPresent;

    @PositiveOrZero
    private Integer quantity;
    private boolean quantityPresent;

    @JsonSetter(value = "name", nulls = Nulls.FAIL)
    public void setName(String name) {
        this.name = name;
        this.namePresent = true;
    }

    @JsonSetter("description")
    public void setDescription(String description) {
        this.description = description;
        this.descriptionPresent = true;
    }

    @JsonSetter(value = "quantity", nulls = Nulls.FAIL)
    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
        this.quantityPresent = true;
    }

    public ItemPatch toPatch() {
        return new ItemPatch(
                namePresent ? PatchField.of(name) : PatchField.absent(),
                descriptionPresent ? PatchField.of(description) : PatchField.absent(),
                quantityPresent ? PatchField.of(quantity) : PatchField.absent()
        );
    }
}
