package com.lendingledger.api.controller;

import com.lendingledger.membership.Membership;
import com.lendingledger.membership.MembershipRegistry;
import com.lendingledger.membership.MembershipTier;
import com.lendingledger.policy.PolicyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for borrowing rights.
 */
@RestController
@RequestMapping("/api/v1/members")
@RequiredArgsConstructor
@Tag(name = "Membership", description = "Membership management API")
public class MembershipController {

    private final MembershipRegistry membershipRegistry;
    private final PolicyService policyService;

    @PutMapping("/{accountId}")
    @Operation(summary = "Grant borrowing rights (steward or curator)")
    public ResponseEntity<Membership> grant(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String accountId,
            @RequestParam(defaultValue = "STANDARD") MembershipTier tier) {

        return ResponseEntity.ok(membershipRegistry.grant(policyService.accessFor(callerId), accountId, tier));
    }

    @DeleteMapping("/{accountId}")
    @Operation(summary = "Revoke borrowing rights (steward or curator)")
    public ResponseEntity<Void> revoke(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String accountId) {

        membershipRegistry.revoke(policyService.accessFor(callerId), accountId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Check whether an account may borrow")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String accountId) {
        return ResponseEntity.ok(Map.of(
            "member", membershipRegistry.isMember(accountId),
            "tier", membershipRegistry.tierOf(accountId).map(Enum::name).orElse("NONE")
        ));
    }

    @GetMapping
    @Operation(summary = "List active members")
    public ResponseEntity<List<Membership>> activeMembers() {
        return ResponseEntity.ok(membershipRegistry.activeMembers());
    }
}
