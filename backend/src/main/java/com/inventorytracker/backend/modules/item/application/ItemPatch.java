package com.inventorytracker.backend.modules.item.application;

import java.util.Objects;

import com.inventorytracker.backend.global.common.PatchField;

/**
 * Fields an update request asked to change. {@code created_at} is never patchable.
 */
public record ItemPatch(
        PatchField<String> name,
        PatchField<String> description,
        PatchField<Integer> quantity
) {

    public ItemPatch {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(quantity, "quantity");
    }

    public static ItemPatch empty() {
        return new ItemPatch(PatchField.absent(), PatchField.absent(), PatchField.absent());
    }

    public boolean isEmpty() {
        return !name.isPresent() && !description.isPresent() && !quantity.isPresent();
    }
}
