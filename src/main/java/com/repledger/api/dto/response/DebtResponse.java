package com.repledger.api.dto.response;

import com.repledger.domain.enums.LoanStatus;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class DebtResponse {

    private final long loanId;
    private final LoanStatus status;

    /** Principal plus accrued interest and penalty, ignoring repayments. */
    private final BigInteger debt;

    /** What the borrower still has to pay to close the loan. */
    private final BigInteger outstanding;
}
