package com.repledger.domain.model;

import com.repledger.domain.enums.LoanStatus;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A borrowing position held by the ledger.
 *
 * <p>Amounts are integral units of the respective asset. Timestamps are epoch seconds.
 * {@code principal} is the requested amount: the origination fee is carved out of the
 * disbursement, but interest accrues on the full principal.
 *
 * <p>Instances handed out by the ledger are copies; mutating them has no effect on ledger state.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Loan {

    private long id;
    private String borrower;

    /** Borrowed asset. */
    private String asset;

    /** Pledged asset, may equal {@link #asset}. */
    private String collateralAsset;

    private BigInteger principal;

    /** Cumulative amount credited toward the debt. Never decreases while ACTIVE. */
    private BigInteger principalRepaid;

    private BigInteger collateralAmount;

    /** Fee withheld from the disbursement at origination. */
    private BigInteger originationFee;

    private long startTs;
    private long dueTs;

    /** Set when the loan reaches a terminal status. */
    private Long closedTs;

    private LoanStatus status;

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }

    public Loan copy() {
        return toBuilder().build();
    }
}
