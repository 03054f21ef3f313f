package com.repledger.interest;

import com.repledger.exception.InvalidInputException;
import java.math.BigInteger;

/**
 * Simple (non-compounding) interest at an annual rate in basis points, with a separate
 * penalty rate for every second past the due date.
 *
 * <p>Interest for a window of {@code t} seconds is
 * {@code floor(principal * rateBps * t / (SECONDS_PER_YEAR * 10000))}. When a loan is past
 * due the normal-rate window {@code [start, due]} and the penalty window {@code (due, now]}
 * are each truncated on their own before being summed, so the penalty regime never charges
 * more than the two windows would separately.
 *
 * <p>Zero rates are legal and yield zero interest.
 */
public class LinearInterestModel implements InterestModel {

    public static final long SECONDS_PER_YEAR = 365L * 24 * 60 * 60;

    private static final BigInteger YEAR_BPS =
            BigInteger.valueOf(SECONDS_PER_YEAR).multiply(WideMath.BPS_DENOMINATOR);

    private final int aprBps;
    private final int penaltyAprBps;

    public LinearInterestModel(int aprBps, int penaltyAprBps) {
        if (aprBps < 0 || penaltyAprBps < 0) {
            throw new InvalidInputException(
                    "Interest rates must be non-negative: apr=" + aprBps + ", penaltyApr=" + penaltyAprBps);
        }
        this.aprBps = aprBps;
        this.penaltyAprBps = penaltyAprBps;
    }

    @Override
    public BigInteger debt(BigInteger principal, long startTs, long nowTs) {
        if (principal.signum() == 0 || nowTs <= startTs) {
            return principal;
        }
        return principal.add(interest(principal, aprBps, nowTs - startTs));
    }

    @Override
    public BigInteger debtWithPenalty(BigInteger principal, long startTs, long dueTs, long nowTs) {
        if (principal.signum() == 0 || nowTs <= startTs) {
            return principal;
        }
        long effectiveDue = Math.max(dueTs, startTs);
        if (nowTs <= effectiveDue) {
            return debt(principal, startTs, nowTs);
        }
        BigInteger normal = interest(principal, aprBps, effectiveDue - startTs);
        BigInteger penalty = interest(principal, penaltyAprBps, nowTs - effectiveDue);
        return principal.add(normal).add(penalty);
    }

    public int getAprBps() {
        return aprBps;
    }

    public int getPenaltyAprBps() {
        return penaltyAprBps;
    }

    private static BigInteger interest(BigInteger principal, int rateBps, long seconds) {
        if (rateBps == 0 || seconds <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger rateTime = BigInteger.valueOf(rateBps).multiply(BigInteger.valueOf(seconds));
        return WideMath.mulDiv(principal, rateTime, YEAR_BPS);
    }

    @Override
    public String toString() {
        return "LinearInterestModel{aprBps=" + aprBps + ", penaltyAprBps=" + penaltyAprBps + "}";
    }
}
