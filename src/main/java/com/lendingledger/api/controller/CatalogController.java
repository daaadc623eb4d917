package com.lendingledger.api.controller;

import com.lendingledger.api.dto.CreateItemRequest;
import com.lendingledger.api.dto.MintRequest;
import com.lendingledger.catalog.CatalogItem;
import com.lendingledger.catalog.CatalogService;
import com.lendingledger.inventory.InventoryLedger;
import com.lendingledger.policy.AccessPolicy;
import com.lendingledger.policy.PolicyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for catalog items and their units.
 */
@RestController
@RequestMapping("/api/v1/items")
@RequiredArgsConstructor
@Tag(name = "Catalog", description = "Catalog item management API")
public class CatalogController {

    private final CatalogService catalogService;
    private final InventoryLedger inventoryLedger;
    private final PolicyService policyService;

    @PostMapping
    @Operation(summary = "Create a catalog item (steward)")
    public ResponseEntity<CatalogItem> createItem(
            @RequestHeader("X-Caller-Id") String callerId,
            @Valid @RequestBody CreateItemRequest request) {

        AccessPolicy access = policyService.accessFor(callerId);
        CatalogItem item = catalogService.createItem(access, request.toMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(item);
    }

    @GetMapping("/{itemId}")
    @Operation(summary = "Get a catalog item")
    public ResponseEntity<CatalogItem> getItem(@PathVariable Long itemId) {
        return ResponseEntity.ok(catalogService.getItem(itemId));
    }

    @GetMapping
    @Operation(summary = "List items that are not paused")
    public ResponseEntity<List<CatalogItem>> listItems() {
        return ResponseEntity.ok(catalogService.listAvailableItems());
    }

    @PutMapping("/{itemId}")
    @Operation(summary = "Replace item metadata (steward or curator)")
    public ResponseEntity<CatalogItem> updateItem(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable Long itemId,
            @Valid @RequestBody CreateItemRequest request) {

        AccessPolicy access = policyService.accessFor(callerId);
        return ResponseEntity.ok(catalogService.updateMetadata(access, itemId, request.toMetadata()));
    }

    @PostMapping("/{itemId}/pause")
    @Operation(summary = "Pause an item (steward or curator)")
    public ResponseEntity<CatalogItem> pause(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable Long itemId) {

        return ResponseEntity.ok(catalogService.setPaused(policyService.accessFor(callerId), itemId, true));
    }

    @PostMapping("/{itemId}/unpause")
    @Operation(summary = "Unpause an item (steward or curator)")
    public ResponseEntity<CatalogItem> unpause(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable Long itemId) {

        return ResponseEntity.ok(catalogService.setPaused(policyService.accessFor(callerId), itemId, false));
    }

    @PostMapping("/{itemId}/units")
    @Operation(summary = "Mint units to the custodian (steward)")
    public ResponseEntity<Map<String, Long>> mint(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable Long itemId,
            @Valid @RequestBody MintRequest request) {

        long balance = catalogService.mintUnits(policyService.accessFor(callerId), itemId, request.getQuantity());
        return ResponseEntity.ok(Map.of("custodianBalance", balance));
    }

    @GetMapping("/{itemId}/units/{holderId}")
    @Operation(summary = "Get the units of an item a holder has")
    public ResponseEntity<Map<String, Long>> balanceOf(@PathVariable Long itemId, @PathVariable String holderId) {
        return ResponseEntity.ok(Map.of("balance", inventoryLedger.balanceOf(holderId, itemId)));
    }
}
