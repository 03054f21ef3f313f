package com.repledger.interest;

import java.math.BigInteger;

/**
 * Computes what a borrower owes as a pure function of principal and time.
 * Implementations hold only their own immutable rate configuration and can be
 * swapped on the ledger at runtime.
 */
public interface InterestModel {

    /**
     * Principal plus interest at the normal rate for {@code [startTs, nowTs]}.
     * Returns {@code principal} when it is zero or when {@code nowTs <= startTs}.
     */
    BigInteger debt(BigInteger principal, long startTs, long nowTs);

    /**
     * Principal plus interest, switching to the penalty rate for time after {@code dueTs}.
     */
    BigInteger debtWithPenalty(BigInteger principal, long startTs, long dueTs, long nowTs);
}
