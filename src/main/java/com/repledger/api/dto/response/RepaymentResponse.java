package com.repledger.api.dto.response;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class RepaymentResponse {

    private final long loanId;

    /** Amount applied to the debt, after any overpayment refund. */
    private final BigInteger paidNet;

    private final BigInteger totalRepaid;
    private final BigInteger totalDebt;
    private final boolean fullyRepaid;
}
