package com.repledger.risk;

import com.repledger.exception.InvalidInputException;
import java.math.BigInteger;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/**
 * Tunables of the reputation-based collateral policy.
 *
 * <p>The collateral ratio falls linearly from {@code maxRatioBps} at score 0 to zero at
 * {@code scoreFree}. Borrowers at or above {@code scoreFree} borrow without collateral, up to
 * {@code noCollateralCap}.
 *
 * <p>Loaded from application.properties (repledger.risk.*) and updatable at runtime through
 * the admin API; every change is recorded in the parameter history.
 */
@Data
@Builder
public class RiskParameters {

    /** Ratio required at score 0, e.g. 15000 = 150%. */
    private int maxRatioBps;

    /** Score at which collateral is no longer required. Must be positive. */
    private int scoreFree;

    /** Flat ceiling for collateral-free loans. */
    private BigInteger noCollateralCap;

    /** Whether every borrow request must carry a verifiable identity proof. */
    private boolean proofRequired;

    /** Assets accepted as collateral. Empty = any asset. */
    private Set<String> acceptedCollateralAssets;

    /** Same checks the admin setters apply; throws {@link InvalidInputException} on the first failure. */
    public void validate() {
        requireMaxRatioBps(maxRatioBps);
        requireScoreFree(scoreFree);
        requireNoCollateralCap(noCollateralCap);
    }

    public static void requireMaxRatioBps(int maxRatioBps) {
        if (maxRatioBps < 0) {
            throw new InvalidInputException("maxRatioBps must be non-negative");
        }
    }

    public static void requireScoreFree(int scoreFree) {
        if (scoreFree <= 0) {
            throw new InvalidInputException("scoreFree must be positive");
        }
    }

    public static void requireNoCollateralCap(BigInteger cap) {
        if (cap == null || cap.signum() < 0) {
            throw new InvalidInputException("noCollateralCap must be non-negative");
        }
    }
}
