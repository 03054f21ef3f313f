package com.repledger.risk;

import com.repledger.domain.model.BorrowRequest;

/**
 * Admission and collateral policy consulted by the ledger before opening a loan.
 * Implementations never mutate ledger state and may be swapped at runtime.
 */
public interface RiskPolicy {

    int collateralRatioBps(String borrower);

    boolean isDefaulter(String borrower);

    RiskResult assessBorrow(String borrower, BorrowRequest request);
}
