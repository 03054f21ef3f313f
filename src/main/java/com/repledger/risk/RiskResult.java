package com.repledger.risk;

import com.repledger.domain.enums.RiskReason;
import java.math.BigInteger;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a borrow assessment.
 *
 * <p>Either ALLOWED (reason {@link RiskReason#OK}) or REJECTED with the reason of the first
 * failing check. {@code maxBorrow} is the ceiling the policy computed, reported on
 * {@link RiskReason#LIMIT} rejections too so callers can retry with a smaller amount.
 * Value semantics: two assessments of identical state compare equal.
 */
@Getter
@EqualsAndHashCode
@ToString
public class RiskResult {

    private final boolean allowed;
    private final int collateralRatioBps;
    private final BigInteger maxBorrow;
    private final RiskReason reason;

    private RiskResult(boolean allowed, int collateralRatioBps, BigInteger maxBorrow, RiskReason reason) {
        this.allowed = allowed;
        this.collateralRatioBps = collateralRatioBps;
        this.maxBorrow = maxBorrow;
        this.reason = reason;
    }

    public static RiskResult allowed(int collateralRatioBps, BigInteger maxBorrow) {
        return new RiskResult(true, collateralRatioBps, maxBorrow, RiskReason.OK);
    }

    public static RiskResult rejected(RiskReason reason, int collateralRatioBps, BigInteger maxBorrow) {
        return new RiskResult(false, collateralRatioBps, maxBorrow, reason);
    }

    public static RiskResult rejected(RiskReason reason, int collateralRatioBps) {
        return rejected(reason, collateralRatioBps, BigInteger.ZERO);
    }

    public boolean isRejected() {
        return !allowed;
    }
}
