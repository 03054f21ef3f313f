package com.repledger.domain.model;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ephemeral borrow input. Not persisted; the ledger copies what it needs into a {@link Loan}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BorrowRequest {

    private String asset;
    private BigInteger amount;

    /** Null or blank when the borrower pledges nothing. */
    private String collateralAsset;

    private BigInteger collateralAmount;
    private long durationSeconds;

    /** Optional identity proof, checked only when the risk policy requires it. */
    private String proof;

    public BigInteger collateralAmountOrZero() {
        return collateralAmount != null ? collateralAmount : BigInteger.ZERO;
    }

    public boolean hasCollateral() {
        return collateralAsset != null && !collateralAsset.isBlank() && collateralAmountOrZero().signum() > 0;
    }
}
