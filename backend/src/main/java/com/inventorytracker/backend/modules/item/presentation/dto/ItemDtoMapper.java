package com.inventorytracker.backend.modules.item.presentation.dto;

import com.inventorytracker.backend.modules.item.domain.Item;

public final class ItemDtoMapper {

    private ItemDtoMapper() {
    }

    public static ItemResponse toResponse(Item item) {
        return new ItemResponse(
                item.getId(),
                item.getName(),
                item.getDescription(),
                item.getQuantity(),
                item.getCreatedAt()
        );
    }
}
