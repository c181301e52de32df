package com.inventorytracker.backend.modules.item.application;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inventorytracker.backend.global.error.ProblemException;
import com.inventorytracker.backend.modules.item.domain.Item;
import com.inventorytracker.backend.modules.item.infrastructure.persistence.ItemRepository;
import com.inventorytracker.backend.modules.item.presentation.dto.CreateItemRequest;
import com.inventorytracker.backend.modules.item.presentation.dto.ItemDtoMapper;
import com.inventorytracker.backend.modules.item.presentation.dto.ItemResponse;

@Service
@Transactional
public class ItemService {

    public static final String ITEM_NOT_FOUND = "ITEM_NOT_FOUND";
    public static final String ITEM_NAME_CONFLICT = "ITEM_NAME_CONFLICT";

    static final String NAME_UNIQUE_CONSTRAINT = "uq_items_name";

    private static final Logger log = LoggerFactory.getLogger(ItemService.class);

    private final ItemRepository itemRepository;

    public ItemService(ItemRepository itemRepository) {
        this.itemRepository = itemRepository;
    }

    public ItemResponse createItem(CreateItemRequest request) {
        Item item = new Item();
        item.setName(request.name());
        item.setDescription(request.description());
        item.setQuantity(request.quantityOrDefault());

        Item saved = saveAndFlush(item);
        log.info("Created item id={} name='{}'", saved.getId(), saved.getName());
        return ItemDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public Optional<ItemResponse> getItemById(long id) {
        return itemRepository.findById(id).map(ItemDtoMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public List<ItemResponse> getItems() {
        return itemRepository.findAll(Sort.by("id")).stream()
                .map(ItemDtoMapper::toResponse)
                .toList();
    }

    /**
     * Applies only the fields present in {@code patch}. An empty patch is answered from a read
     * alone so no UPDATE is issued, but a missing id is still reported.
     */
    public ItemResponse updateItem(long id, ItemPatch patch) {
        Item item = itemRepository.findById(id)
                .orElseThrow(() -> itemNotFound(id));
        if (patch.isEmpty()) {
            return ItemDtoMapper.toResponse(item);
        }

        patch.name().ifPresent(item::setName);
        patch.description().ifPresent(item::setDescription);
        patch.quantity().ifPresent(item::setQuantity);

        Item saved;
        try {
            saved = saveAndFlush(item);
        } catch (OptimisticLockingFailureException ex) {
            // row deleted between the read and the UPDATE
            log.warn("Item id={} disappeared before its update was written", id);
            throw itemNotFound(id, ex);
        }
        log.info("Updated item id={}", saved.getId());
        return ItemDtoMapper.toResponse(saved);
    }

    public void deleteItem(long id) {
        int deleted = itemRepository.deleteItemById(id);
        if (deleted == 0) {
            log.warn("Delete for item id={} completed, but no item was found", id);
        } else {
            log.info("Deleted item id={}", id);
        }
    }

    private Item saveAndFlush(Item item) {
        try {
            return itemRepository.saveAndFlush(item);
        } catch (DataIntegrityViolationException ex) {
            if (isNameConstraintViolation(ex)) {
                throw new ProblemException(HttpStatus.CONFLICT, ITEM_NAME_CONFLICT,
                        "Item with name '" + item.getName() + "' already exists.", ex);
            }
            throw ex;
        }
    }

    private boolean isNameConstraintViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(NAME_UNIQUE_CONSTRAINT);
    }

    private static ProblemException itemNotFound(long id) {
        return itemNotFound(id, null);
    }

    private static ProblemException itemNotFound(long id, Throwable cause) {
        return new ProblemException(HttpStatus.NOT_FOUND, ITEM_NOT_FOUND, "Item with ID " + id + " not found.", cause);
    }
}
