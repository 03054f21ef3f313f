package com.repledger.domain.model;

import java.math.BigInteger;

/**
 * Outcome of a repayment.
 *
 * @param paidNet      amount kept by the ledger from this call (the payment minus any refunded overpay)
 * @param totalRepaid  cumulative amount credited to the loan after this call
 * @param totalDebt    debt including interest and penalty at the time of the call
 * @param fullyRepaid  whether this call closed the loan
 */
public record RepaymentResult(BigInteger paidNet, BigInteger totalRepaid, BigInteger totalDebt, boolean fullyRepaid) {}
