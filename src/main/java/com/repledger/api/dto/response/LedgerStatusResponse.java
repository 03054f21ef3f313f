package com.repledger.api.dto.response;

import java.math.BigInteger;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Snapshot of ledger state for operators: pause flag, loan counters, escrowed collateral
 * and the modules currently plugged in (null when not configured).
 */
@Getter
@Builder
public class LedgerStatusResponse {

    private final boolean paused;
    private final int activeLoanCount;
    private final long nextLoanId;
    private final Map<String, BigInteger> lockedCollateral;
    private final String ledgerAccount;
    private final String treasuryAccount;
    private final String riskPolicy;
    private final String interestModel;
    private final String reputationHook;
}
