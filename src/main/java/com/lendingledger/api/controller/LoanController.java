package com.lendingledger.api.controller;

import com.lendingledger.api.dto.BorrowRequest;
import com.lendingledger.api.dto.LoanResponse;
import com.lendingledger.api.dto.ReturnResponse;
import com.lendingledger.common.Money;
import com.lendingledger.common.exception.ResourceNotFoundException;
import com.lendingledger.loan.ExtensionResult;
import com.lendingledger.loan.Loan;
import com.lendingledger.loan.LoanLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for borrowing, returning and extending loans.
 * The borrower is the caller named in the {@code X-Caller-Id} header.
 */
@RestController
@RequestMapping("/api/v1/loans")
@RequiredArgsConstructor
@Tag(name = "Loans", description = "Loan lifecycle API")
public class LoanController {

    private final LoanLedger loanLedger;

    @PostMapping
    @Operation(summary = "Borrow a catalog item against a deposit")
    public ResponseEntity<LoanResponse> borrow(
            @RequestHeader("X-Caller-Id") String callerId,
            @Valid @RequestBody BorrowRequest request) {

        Money deposit = Money.exact(request.getDepositAmount(), request.getCurrency());
        Loan loan = loanLedger.openLoan(callerId, request.getItemId(), deposit);
        return ResponseEntity.status(HttpStatus.CREATED).body(LoanResponse.from(loan));
    }

    @PostMapping("/{itemId}/return")
    @Operation(summary = "Return a borrowed item")
    public ResponseEntity<ReturnResponse> returnItem(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable Long itemId) {

        boolean late = loanLedger.returnItem(callerId, itemId);
        return ResponseEntity.ok(new ReturnResponse(callerId, itemId, late));
    }

    @PostMapping("/{itemId}/extension")
    @Operation(summary = "Push back the due date of an open loan")
    public ResponseEntity<ExtensionResult> requestExtension(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable Long itemId) {

        return ResponseEntity.ok(loanLedger.requestExtension(callerId, itemId));
    }

    @GetMapping("/{borrowerId}/{itemId}")
    @Operation(summary = "Get an open loan")
    public ResponseEntity<LoanResponse> getLoan(@PathVariable String borrowerId, @PathVariable Long itemId) {
        LoanResponse loan = loanLedger.findLoan(borrowerId, itemId)
            .map(LoanResponse::from)
            .orElseThrow(() -> ResourceNotFoundException.loan(borrowerId, itemId));
        return ResponseEntity.ok(loan);
    }

    @GetMapping("/borrower/{borrowerId}")
    @Operation(summary = "Get all open loans of a borrower")
    public ResponseEntity<List<LoanResponse>> getLoansOf(@PathVariable String borrowerId) {
        List<LoanResponse> loans = loanLedger.loansOf(borrowerId).stream()
            .map(LoanResponse::from)
            .toList();
        return ResponseEntity.ok(loans);
    }

    @GetMapping("/overdue")
    @Operation(summary = "Get loans past their due date")
    public ResponseEntity<List<LoanResponse>> getOverdueLoans() {
        List<LoanResponse> loans = loanLedger.overdueLoans().stream()
            .map(LoanResponse::from)
            .toList();
        return ResponseEntity.ok(loans);
    }
}
