package com.lendingledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Lending Ledger.
 *
 * Lending Ledger tracks who has borrowed which catalog item, holds their
 * deposits in escrow, and settles each deposit on return: refunded in full when
 * the item comes back within its due date plus grace, forfeited to a
 * steward-controlled pool otherwise.
 */
@SpringBootApplication
public class LendingLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendingLedgerApplication.class, args);
    }
}
