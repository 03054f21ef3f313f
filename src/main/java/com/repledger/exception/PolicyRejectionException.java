package com.repledger.exception;

import com.repledger.domain.enums.RiskReason;
import java.math.BigInteger;
import java.util.Map;
import lombok.Getter;

/**
 * Borrow request refused by the risk policy. Carries the reason code and the
 * ceiling the policy computed, so a {@link RiskReason#LIMIT} rejection can be
 * retried with a smaller amount.
 */
@Getter
public class PolicyRejectionException extends BusinessException {

    private final RiskReason reason;
    private final BigInteger maxBorrow;

    public PolicyRejectionException(RiskReason reason, BigInteger maxBorrow) {
        super(
                ErrorCode.POLICY_REJECTION,
                "Borrow not allowed: " + reason,
                Map.of("reason", reason.name(), "maxBorrow", maxBorrow));
        this.reason = reason;
        this.maxBorrow = maxBorrow;
    }
}
