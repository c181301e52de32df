package com.inventorytracker.backend.modules.item.presentation;

import java.util.List;

import com.inventorytracker.backend.global.error.ProblemException;
import com.inventorytracker.backend.global.error.RestExceptionHandler;
import com.inventorytracker.backend.modules.item.application.ItemService;
import com.inventorytracker.backend.modules.item.presentation.dto.CreateItemRequest;
import com.inventorytracker.backend.modules.item.presentation.dto.ItemResponse;
import com.inventorytracker.backend.modules.item.presentation.dto.UpdateItemRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import com.fasterxml.jackson.databind.node.NullNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/items")
public class ItemController {

    private final ItemService itemService;

    public ItemController(ItemService itemService) {
        this.itemService = itemService;
    }

    @Operation(summary = "Create an item")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Item created"),
            @ApiResponse(responseCode = "409", description = "Name already used, code `ITEM_NAME_CONFLICT`"),
            @ApiResponse(responseCode = "422", description = "Invalid body, code `validation_error`")
    })
    @PostMapping
    public ResponseEntity<ItemResponse> createItem(@Valid @RequestBody CreateItemRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(itemService.createItem(request));
    }

    @GetMapping
    public ResponseEntity<List<ItemResponse>> getItems() {
        return ResponseEntity.ok(itemService.getItems());
    }

    @Operation(
            summary = "Get one item",
            description = "An unknown id is not an error: the response is 200 with the JSON literal `null`."
    )
    @ApiResponse(responseCode = "200", description = "The item, or `null` for an unknown id")
    @GetMapping("/{itemId}")
    public ResponseEntity<Object> getItemById(@PathVariable("itemId") long itemId) {
        requirePositiveId(itemId);
        Object body = itemService.getItemById(itemId)
                .<Object>map(item -> item)
                .orElse(NullNode.getInstance());
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(body);
    }

    @Operation(
            summary = "Partially update an item",
            description = """
                    Only the fields present in the body are written. \
                    `"description": null` clears the description, an omitted field is left unchanged. \
                    An empty body returns the item as stored.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Item after the update"),
            @ApiResponse(responseCode = "404", description = "Unknown id, code `ITEM_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "Name already used, code `ITEM_NAME_CONFLICT`")
    })
    @PatchMapping("/{itemId}")
    public ResponseEntity<ItemResponse> updateItem(
            @PathVariable("itemId") long itemId,
            @Valid @RequestBody UpdateItemRequest request
    ) {
        requirePositiveId(itemId);
        return ResponseEntity.ok(itemService.updateItem(itemId, request.toPatch()));
    }

    @Operation(summary = "Delete an item", description = "Deleting an unknown id succeeds as a no-op.")
    @DeleteMapping("/{itemId}")
    public ResponseEntity<Void> deleteItem(@PathVariable("itemId") long itemId) {
        requirePositiveId(itemId);
        itemService.deleteItem(itemId);
        return ResponseEntity.noContent().build();
    }

    private static void requirePositiveId(long itemId) {
        if (itemId <= 0) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, RestExceptionHandler.VALIDATION_ERROR,
                    "itemId: Item ID must be a positive integer");
        }
    }
}
