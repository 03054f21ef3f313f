package com.repledger.domain.enums;

/**
 * Kind of loan lifecycle notification published after a ledger operation commits.
 * LOAN_REPAID is a partial repayment; LOAN_CLOSED is the repayment that settled the debt.
 */
public enum LoanEventType {
    LOAN_OPENED,
    LOAN_REPAID,
    LOAN_CLOSED,
    LOAN_DEFAULTED
}
