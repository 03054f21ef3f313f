package com.repledger.risk;

import com.repledger.domain.enums.RiskReason;
import com.repledger.domain.model.BorrowRequest;
import com.repledger.domain.model.PriceQuote;
import com.repledger.interest.WideMath;
import com.repledger.oracle.PriceFeed;
import com.repledger.proof.ProofVerifier;
import com.repledger.reputation.ReputationStore;
import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Collateral policy driven by the borrower's reputation score.
 *
 * <p>Checks (in order, first failure wins):
 * <ol>
 *   <li>Default badge: defaulters are refused outright</li>
 *   <li>Identity proof, when {@link RiskParameters#isProofRequired()}</li>
 *   <li>Score at or above {@code scoreFree}: collateral-free up to {@code noCollateralCap}</li>
 *   <li>Otherwise the collateral is valued in the debt asset and the ceiling is
 *       {@code value * 10000 / ratioBps}</li>
 *   <li>Requested amount against the ceiling</li>
 * </ol>
 *
 * <p>Every collaborator is optional. A missing reputation store means nobody is a defaulter and
 * everybody has score 0. A missing or failing price feed or proof verifier turns into a
 * rejection reason, never an exception.
 */
@Service
public class ReputationRiskPolicy implements RiskPolicy {

    private static final Logger log = LoggerFactory.getLogger(ReputationRiskPolicy.class);

    private final RiskParameters riskParameters;
    private final Optional<ReputationStore> reputationStore;
    private final Optional<PriceFeed> priceFeed;
    private final Optional<ProofVerifier> proofVerifier;

    public ReputationRiskPolicy(
            RiskParameters riskParameters,
            Optional<ReputationStore> reputationStore,
            Optional<PriceFeed> priceFeed,
            Optional<ProofVerifier> proofVerifier) {
        this.riskParameters = riskParameters;
        this.reputationStore = reputationStore;
        this.priceFeed = priceFeed;
        this.proofVerifier = proofVerifier;
    }

    // ========================
    // SCORE -> RATIO
    // ========================

    @Override
    public int collateralRatioBps(String borrower) {
        return ratioForScore(scoreOf(borrower));
    }

    /**
     * {@code ceil(maxRatioBps * (scoreFree - score) / scoreFree)}, zero once the score reaches
     * {@code scoreFree}. Rounding up keeps a borrower from reaching a more lenient ratio early.
     */
    public int ratioForScore(int score) {
        int scoreFree = riskParameters.getScoreFree();
        if (score >= scoreFree) {
            return 0;
        }
        int clamped = Math.max(score, 0);
        return WideMath.mulDivUp(
                        BigInteger.valueOf(riskParameters.getMaxRatioBps()),
                        BigInteger.valueOf((long) scoreFree - clamped),
                        BigInteger.valueOf(scoreFree))
                .intValueExact();
    }

    public int scoreOf(String borrower) {
        return reputationStore.map(store -> store.scoreOf(borrower)).orElse(0);
    }

    @Override
    public boolean isDefaulter(String borrower) {
        return reputationStore.map(store -> store.hasBadge(borrower)).orElse(false);
    }

    // ========================
    // ASSESSMENT
    // ========================

    @Override
    public RiskResult assessBorrow(String borrower, BorrowRequest request) {
        int ratioBps = collateralRatioBps(borrower);

        if (isDefaulter(borrower)) {
            log.warn("Borrow refused for {}: default badge present", borrower);
            return RiskResult.rejected(RiskReason.DEFAULTER, ratioBps);
        }

        if (riskParameters.isProofRequired()) {
            RiskReason proofFailure = checkProof(borrower, request.getProof());
            if (proofFailure != null) {
                log.warn("Borrow refused for {}: {}", borrower, proofFailure);
                return RiskResult.rejected(proofFailure, ratioBps);
            }
        }

        BigInteger amount = request.getAmount() != null ? request.getAmount() : BigInteger.ZERO;

        if (ratioBps == 0) {
            BigInteger cap = riskParameters.getNoCollateralCap() != null
                    ? riskParameters.getNoCollateralCap()
                    : BigInteger.ZERO;
            return withinCeiling(borrower, amount, ratioBps, cap);
        }

        if (!request.hasCollateral()) {
            return RiskResult.rejected(RiskReason.NO_COLLATERAL, ratioBps);
        }

        Set<String> accepted = riskParameters.getAcceptedCollateralAssets();
        if (accepted != null && !accepted.isEmpty() && !accepted.contains(request.getCollateralAsset())) {
            return RiskResult.rejected(RiskReason.UNSUPPORTED_COLLATERAL, ratioBps);
        }

        BigInteger collateralValue;
        if (request.getCollateralAsset().equals(request.getAsset())) {
            collateralValue = request.getCollateralAmount();
        } else {
            Optional<PriceQuote> quote = lookupPrice(request.getCollateralAsset(), request.getAsset());
            if (quote.isEmpty()) {
                return RiskResult.rejected(RiskReason.NO_ORACLE, ratioBps);
            }
            if (quote.get().price().signum() <= 0) {
                return RiskResult.rejected(RiskReason.BAD_PRICE, ratioBps);
            }
            collateralValue = WideMath.mulDiv(
                    request.getCollateralAmount(), quote.get().price(), quote.get().scale());
        }

        BigInteger maxBorrow =
                WideMath.mulDiv(collateralValue, WideMath.BPS_DENOMINATOR, BigInteger.valueOf(ratioBps));
        return withinCeiling(borrower, amount, ratioBps, maxBorrow);
    }

    // ========================
    // INTERNALS
    // ========================

    private RiskResult withinCeiling(String borrower, BigInteger amount, int ratioBps, BigInteger maxBorrow) {
        if (amount.compareTo(maxBorrow) > 0) {
            log.info("Borrow for {} over limit: requested {} > max {}", borrower, amount, maxBorrow);
            return RiskResult.rejected(RiskReason.LIMIT, ratioBps, maxBorrow);
        }
        return RiskResult.allowed(ratioBps, maxBorrow);
    }

    /** Returns the failure reason, or null when the proof checks out. */
    private RiskReason checkProof(String borrower, String proof) {
        if (proof == null || proof.isBlank()) {
            return RiskReason.MISSING_PROOF;
        }
        if (proofVerifier.isEmpty()) {
            log.warn("Proof required but no verifier configured; treating proof as unverifiable");
            return RiskReason.BAD_PROOF;
        }
        try {
            return proofVerifier.get().verify(borrower, proof) ? null : RiskReason.BAD_PROOF;
        } catch (RuntimeException e) {
            log.warn("Proof verification failed for {}: {}", borrower, e.getMessage());
            return RiskReason.BAD_PROOF;
        }
    }

    private Optional<PriceQuote> lookupPrice(String base, String quote) {
        if (priceFeed.isEmpty()) {
            return Optional.empty();
        }
        try {
            Optional<PriceQuote> price = priceFeed.get().getPrice(base, quote);
            return price != null ? price : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Price lookup {}/{} failed: {}", base, quote, e.getMessage());
            return Optional.empty();
        }
    }
}
