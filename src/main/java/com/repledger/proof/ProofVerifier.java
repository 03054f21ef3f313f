package com.repledger.proof;

public interface ProofVerifier {

    /** True when {@code proof} attests the identity of {@code borrower}. */
    boolean verify(String borrower, String proof);
}
