package com.lendingledger.api.controller;

import com.lendingledger.ledger.LedgerEntry;
import com.lendingledger.ledger.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for reading the lending ledger.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Loan and escrow event journal API")
public class LedgerController {

    private final LedgerService ledgerService;

    @GetMapping("/borrower/{borrowerId}")
    @Operation(summary = "Get ledger entries for a borrower")
    public ResponseEntity<List<LedgerEntry>> getBorrowerLedger(@PathVariable String borrowerId) {
        return ResponseEntity.ok(ledgerService.getBorrowerLedger(borrowerId));
    }

    @GetMapping("/item/{itemId}")
    @Operation(summary = "Get ledger entries for a catalog item")
    public ResponseEntity<List<LedgerEntry>> getItemLedger(@PathVariable Long itemId) {
        return ResponseEntity.ok(ledgerService.getItemLedger(itemId));
    }
}
