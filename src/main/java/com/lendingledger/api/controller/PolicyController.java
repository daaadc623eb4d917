package com.lendingledger.api.controller;

import com.lendingledger.common.Currency;
import com.lendingledger.common.Money;
import com.lendingledger.policy.AccessPolicy;
import com.lendingledger.policy.LendingPolicy;
import com.lendingledger.policy.PolicyChange;
import com.lendingledger.policy.PolicyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * REST API for policy administration. Every setter requires the steward.
 * Durations are given in seconds.
 */
@RestController
@RequestMapping("/api/v1/policy")
@RequiredArgsConstructor
@Tag(name = "Policy", description = "Lending policy administration API")
public class PolicyController {

    private final PolicyService policyService;

    @GetMapping
    @Operation(summary = "Get the current lending policy")
    public ResponseEntity<LendingPolicy> getPolicy() {
        return ResponseEntity.ok(policyService.current());
    }

    @GetMapping("/history")
    @Operation(summary = "Get the policy audit trail")
    public ResponseEntity<List<PolicyChange>> getHistory() {
        return ResponseEntity.ok(policyService.history());
    }

    @PutMapping("/loan-duration")
    @Operation(summary = "Set the loan duration")
    public ResponseEntity<LendingPolicy> setLoanDuration(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam long seconds) {
        return ResponseEntity.ok(policyService.setLoanDuration(access(callerId), Duration.ofSeconds(seconds)));
    }

    @PutMapping("/deposit")
    @Operation(summary = "Set the minimum deposit")
    public ResponseEntity<LendingPolicy> setDepositAmount(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam BigDecimal amount,
            @RequestParam Currency currency) {
        Money deposit = Money.exact(amount, currency);
        return ResponseEntity.ok(policyService.setDepositAmount(access(callerId), deposit));
    }

    @PutMapping("/grace-period")
    @Operation(summary = "Set the grace period")
    public ResponseEntity<LendingPolicy> setGracePeriod(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam long seconds) {
        return ResponseEntity.ok(policyService.setGracePeriod(access(callerId), Duration.ofSeconds(seconds)));
    }

    @PutMapping("/extension-duration")
    @Operation(summary = "Set the extension duration")
    public ResponseEntity<LendingPolicy> setExtensionDuration(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam long seconds) {
        return ResponseEntity.ok(policyService.setExtensionDuration(access(callerId), Duration.ofSeconds(seconds)));
    }

    @PutMapping("/max-extensions")
    @Operation(summary = "Set the maximum number of extensions per loan")
    public ResponseEntity<LendingPolicy> setMaxExtensions(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam int count) {
        return ResponseEntity.ok(policyService.setMaxExtensions(access(callerId), count));
    }

    @PutMapping("/custodian")
    @Operation(summary = "Set the custodian units are lent from")
    public ResponseEntity<LendingPolicy> setCustodian(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam String custodianId) {
        return ResponseEntity.ok(policyService.setCustodian(access(callerId), custodianId));
    }

    @PutMapping("/steward")
    @Operation(summary = "Hand stewardship to another account")
    public ResponseEntity<LendingPolicy> transferStewardship(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam String stewardId) {
        return ResponseEntity.ok(policyService.transferStewardship(access(callerId), stewardId));
    }

    @DeleteMapping("/steward")
    @Operation(summary = "Renounce stewardship for good")
    public ResponseEntity<LendingPolicy> renounceStewardship(@RequestHeader("X-Caller-Id") String callerId) {
        return ResponseEntity.ok(policyService.renounceStewardship(access(callerId)));
    }

    @PutMapping("/curators/{curatorId}")
    @Operation(summary = "Grant the curator role")
    public ResponseEntity<LendingPolicy> grantCurator(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String curatorId) {
        return ResponseEntity.ok(policyService.grantCurator(access(callerId), curatorId));
    }

    @DeleteMapping("/curators/{curatorId}")
    @Operation(summary = "Revoke the curator role")
    public ResponseEntity<LendingPolicy> revokeCurator(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String curatorId) {
        return ResponseEntity.ok(policyService.revokeCurator(access(callerId), curatorId));
    }

    private AccessPolicy access(String callerId) {
        return policyService.accessFor(callerId);
    }
}
