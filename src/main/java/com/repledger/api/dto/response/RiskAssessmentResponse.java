package com.repledger.api.dto.response;

import com.repledger.domain.enums.RiskReason;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Getter;

/**
 * Dry-run result of the active risk policy for a borrow request. Nothing is reserved.
 */
@Getter
@Builder
public class RiskAssessmentResponse {

    private final String borrower;
    private final boolean allowed;
    private final RiskReason reason;
    private final int collateralRatioBps;
    private final BigInteger maxBorrow;
}
