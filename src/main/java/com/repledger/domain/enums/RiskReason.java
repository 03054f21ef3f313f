package com.repledger.domain.enums;

/**
 * Reason code attached to every borrow assessment.
 * OK accompanies an allowed result; every other value identifies the first check that failed.
 */
public enum RiskReason {

    OK,

    /** Borrower carries a default badge. */
    DEFAULTER,

    /** Proof verification is required but no proof was supplied. */
    MISSING_PROOF,

    /** Proof was supplied but could not be verified (invalid, verifier missing or failing). */
    BAD_PROOF,

    /** Collateral is required but the request pledges none. */
    NO_COLLATERAL,

    /** The pledged asset is not on the accepted collateral list. */
    UNSUPPORTED_COLLATERAL,

    /** No usable price for the collateral/debt pair. */
    NO_ORACLE,

    /** The price feed reported a zero or negative price. */
    BAD_PRICE,

    /** Requested amount exceeds the computed borrow ceiling. */
    LIMIT
}
