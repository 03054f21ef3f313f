package com.repledger.domain.enums;

/**
 * Lifecycle status of a loan slot.
 * Legal transitions are NONE -> ACTIVE -> {REPAID, DEFAULTED}; REPAID and DEFAULTED are terminal.
 * LIQUIDATED is reserved for collateral seizure and is never assigned today.
 */
public enum LoanStatus {
    NONE,
    ACTIVE,
    REPAID,
    DEFAULTED,
    LIQUIDATED;

    public boolean isTerminal() {
        return this == REPAID || this == DEFAULTED || this == LIQUIDATED;
    }
}
