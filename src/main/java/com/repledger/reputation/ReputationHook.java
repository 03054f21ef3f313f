package com.repledger.reputation;

import java.math.BigInteger;

/**
 * Receives loan lifecycle notifications from the ledger, inside the ledger's unit of work.
 * Throwing from any callback aborts and rolls back the ledger operation that triggered it.
 */
public interface ReputationHook {

    void onLoanOpened(long loanId, String borrower);

    void onLoanRepaid(
            long loanId,
            String borrower,
            BigInteger paidAmount,
            BigInteger totalRepaid,
            BigInteger totalDebt,
            boolean fullyRepaid);

    void onLoanDefaulted(long loanId, String borrower);
}
