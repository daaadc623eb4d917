package com.lendingledger.api.controller;

import com.lendingledger.api.dto.WithdrawPoolRequest;
import com.lendingledger.common.Money;
import com.lendingledger.escrow.EscrowVault;
import com.lendingledger.policy.PolicyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the forfeited pool.
 */
@RestController
@RequestMapping("/api/v1/escrow")
@RequiredArgsConstructor
@Tag(name = "Escrow", description = "Forfeited pool API")
public class EscrowController {

    private final EscrowVault escrowVault;
    private final PolicyService policyService;

    @GetMapping("/pool")
    @Operation(summary = "Get the forfeited pool balance")
    public ResponseEntity<Money> getPoolBalance() {
        return ResponseEntity.ok(escrowVault.poolBalance());
    }

    @PostMapping("/pool/withdrawals")
    @Operation(summary = "Withdraw from the forfeited pool (steward)")
    public ResponseEntity<Money> withdraw(
            @RequestHeader("X-Caller-Id") String callerId,
            @Valid @RequestBody WithdrawPoolRequest request) {

        Money amount = Money.exact(request.getAmount(), request.getCurrency());
        Money remaining = escrowVault.withdrawPool(policyService.accessFor(callerId), request.getToAccountId(), amount);
        return ResponseEntity.ok(remaining);
    }
}
