package com.repledger.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.repledger.domain.enums.RiskReason;
import com.repledger.domain.model.BorrowRequest;
import com.repledger.domain.model.PriceQuote;
import com.repledger.oracle.PriceFeed;
import com.repledger.oracle.StaticPriceFeed;
import com.repledger.proof.DigestProofVerifier;
import com.repledger.proof.ProofVerifier;
import com.repledger.reputation.InMemoryReputationStore;
import com.repledger.risk.ReputationRiskPolicy;
import com.repledger.risk.RiskParameters;
import com.repledger.risk.RiskResult;
import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for ReputationRiskPolicy covering the score-to-ratio ladder, collateral valuation,
 * the order of rejection reasons and degraded collaborators.
 */
@ExtendWith(MockitoExtension.class)
class ReputationRiskPolicyTest {

    private static final String BORROWER = "alice";
    private static final long DURATION = 30 * 86_400L;

    @Mock
    private PriceFeed failingPriceFeed;

    @Mock
    private ProofVerifier failingProofVerifier;

    private RiskParameters riskParameters;
    private InMemoryReputationStore reputationStore;
    private StaticPriceFeed priceFeed;
    private DigestProofVerifier proofVerifier;
    private ReputationRiskPolicy policy;

    @BeforeEach
    void setUp() {
        riskParameters = RiskParameters.builder()
                .maxRatioBps(15000)
                .scoreFree(800)
                .noCollateralCap(BigInteger.valueOf(1000))
                .proofRequired(false)
                .acceptedCollateralAssets(Set.of())
                .build();
        reputationStore = new InMemoryReputationStore();
        priceFeed = new StaticPriceFeed();
        proofVerifier = new DigestProofVerifier("kyc-secret");
        policy = new ReputationRiskPolicy(
                riskParameters, Optional.of(reputationStore), Optional.of(priceFeed), Optional.of(proofVerifier));
    }

    private static BorrowRequest request(long amount, String collateralAsset, long collateralAmount) {
        return BorrowRequest.builder()
                .asset("USDC")
                .amount(BigInteger.valueOf(amount))
                .collateralAsset(collateralAsset)
                .collateralAmount(BigInteger.valueOf(collateralAmount))
                .durationSeconds(DURATION)
                .build();
    }

    // ==============================
    // SCORE -> RATIO
    // ==============================

    @Nested
    @DisplayName("Collateral ratio ladder")
    class RatioLadder {

        @Test
        @DisplayName("Score 0 with maxRatio 15000 and scoreFree 800 requires exactly 15000 bps")
        void scoreZero_fullRatio() {
            assertThat(policy.collateralRatioBps(BORROWER)).isEqualTo(15000);
        }

        @Test
        @DisplayName("Ratio reaches zero at scoreFree and stays there")
        void atScoreFree_ratioZero() {
            assertThat(policy.ratioForScore(800)).isZero();
            assertThat(policy.ratioForScore(5000)).isZero();
        }

        @Test
        @DisplayName("Intermediate scores round the ratio up")
        void intermediateScore_roundsUp() {
            assertThat(policy.ratioForScore(400)).isEqualTo(7500);
            // 15000 * 799 / 800 = 14981.25
            assertThat(policy.ratioForScore(1)).isEqualTo(14982);
        }

        @Test
        @DisplayName("Negative scores are treated as zero")
        void negativeScore_clamped() {
            assertThat(policy.ratioForScore(-50)).isEqualTo(15000);
        }

        @Test
        @DisplayName("Ratio never increases as score rises")
        void monotonicRelief() {
            int previous = Integer.MAX_VALUE;
            for (int score = 0; score <= 1000; score++) {
                int ratio = policy.ratioForScore(score);
                assertThat(ratio).isLessThanOrEqualTo(previous);
                previous = ratio;
            }
        }

        @Test
        @DisplayName("Ratio follows the borrower's stored score")
        void followsStoredScore() {
            reputationStore.setScore(BORROWER, 400);

            assertThat(policy.collateralRatioBps(BORROWER)).isEqualTo(7500);
        }
    }

    // ==============================
    // COLLATERAL VALUATION
    // ==============================

    @Nested
    @DisplayName("Collateral valuation")
    class Valuation {

        @Test
        @DisplayName("Same-asset collateral is valued 1:1: 150 units back at most 100 at 150%")
        void sameAsset_valuedOneToOne() {
            RiskResult result = policy.assessBorrow(BORROWER, request(100, "USDC", 150));

            assertThat(result.isAllowed()).isTrue();
            assertThat(result.getReason()).isEqualTo(RiskReason.OK);
            assertThat(result.getMaxBorrow()).isEqualTo(BigInteger.valueOf(100));
        }

        @Test
        @DisplayName("Request above the ceiling is rejected with LIMIT and reports the ceiling")
        void overCeiling_limit() {
            RiskResult result = policy.assessBorrow(BORROWER, request(101, "USDC", 150));

            assertThat(result.isRejected()).isTrue();
            assertThat(result.getReason()).isEqualTo(RiskReason.LIMIT);
            assertThat(result.getMaxBorrow()).isEqualTo(BigInteger.valueOf(100));
        }

        @Test
        @DisplayName("Cross-asset collateral is valued through the price feed")
        void crossAsset_usesPrice() {
            priceFeed.setPrice("WETH", "USDC", new PriceQuote(BigInteger.valueOf(2_000_000_000L), 6));

            RiskResult result = policy.assessBorrow(BORROWER, request(4000, "WETH", 3));

            // 3 WETH * 2000 = 6000 USDC of collateral, 6000 / 1.5 = 4000
            assertThat(result.isAllowed()).isTrue();
            assertThat(result.getMaxBorrow()).isEqualTo(BigInteger.valueOf(4000));
        }

        @Test
        @DisplayName("Missing quote is NO_ORACLE, non-positive quote is BAD_PRICE")
        void priceProblems() {
            assertThat(policy.assessBorrow(BORROWER, request(10, "WETH", 3)).getReason())
                    .isEqualTo(RiskReason.NO_ORACLE);

            priceFeed.setPrice("WETH", "USDC", new PriceQuote(BigInteger.ZERO, 6));

            assertThat(policy.assessBorrow(BORROWER, request(10, "WETH", 3)).getReason())
                    .isEqualTo(RiskReason.BAD_PRICE);
        }

        @Test
        @DisplayName("Quotes are directional: USDC/WETH does not price WETH collateral")
        void reversePair_notUsed() {
            priceFeed.setPrice("USDC", "WETH", new PriceQuote(BigInteger.ONE, 0));

            assertThat(policy.assessBorrow(BORROWER, request(10, "WETH", 3)).getReason())
                    .isEqualTo(RiskReason.NO_ORACLE);
        }

        @Test
        @DisplayName("Collateral outside the accepted set is UNSUPPORTED_COLLATERAL")
        void unsupportedCollateral() {
            riskParameters.setAcceptedCollateralAssets(Set.of("WETH"));

            RiskResult result = policy.assessBorrow(BORROWER, request(10, "DAI", 100));

            assertThat(result.getReason()).isEqualTo(RiskReason.UNSUPPORTED_COLLATERAL);
            assertThat(result.getMaxBorrow()).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("Below scoreFree without collateral is NO_COLLATERAL")
        void noCollateral() {
            RiskResult result = policy.assessBorrow(BORROWER, request(10, null, 0));

            assertThat(result.getReason()).isEqualTo(RiskReason.NO_COLLATERAL);
            assertThat(result.getCollateralRatioBps()).isEqualTo(15000);
        }
    }

    // ==============================
    // COLLATERAL-FREE TIER
    // ==============================

    @Nested
    @DisplayName("Collateral-free tier")
    class CollateralFree {

        @BeforeEach
        void trusted() {
            reputationStore.setScore(BORROWER, 800);
        }

        @Test
        @DisplayName("Trusted borrower may borrow up to the cap without collateral")
        void withinCap_allowed() {
            RiskResult result = policy.assessBorrow(BORROWER, request(1000, null, 0));

            assertThat(result.isAllowed()).isTrue();
            assertThat(result.getCollateralRatioBps()).isZero();
            assertThat(result.getMaxBorrow()).isEqualTo(BigInteger.valueOf(1000));
        }

        @Test
        @DisplayName("Above the cap is LIMIT even with collateral attached")
        void aboveCap_limit() {
            RiskResult result = policy.assessBorrow(BORROWER, request(1001, "USDC", 1_000_000));

            assertThat(result.getReason()).isEqualTo(RiskReason.LIMIT);
            assertThat(result.getMaxBorrow()).isEqualTo(BigInteger.valueOf(1000));
        }
    }

    // ==============================
    // REASON ORDER
    // ==============================

    @Nested
    @DisplayName("Rejection order")
    class RejectionOrder {

        @Test
        @DisplayName("A defaulter is always DEFAULTER regardless of amount, collateral or proof")
        void defaulter_firstReason() {
            reputationStore.setScore(BORROWER, 1000);
            reputationStore.mintBadge(BORROWER);
            riskParameters.setProofRequired(true);

            assertThat(policy.assessBorrow(BORROWER, request(1, "USDC", 1_000_000)).getReason())
                    .isEqualTo(RiskReason.DEFAULTER);
            assertThat(policy.assessBorrow(BORROWER, request(1_000_000, null, 0)).getReason())
                    .isEqualTo(RiskReason.DEFAULTER);
            assertThat(policy.isDefaulter(BORROWER)).isTrue();
        }

        @Test
        @DisplayName("Proof is checked before collateral")
        void proof_beforeCollateral() {
            riskParameters.setProofRequired(true);

            assertThat(policy.assessBorrow(BORROWER, request(10, null, 0)).getReason())
                    .isEqualTo(RiskReason.MISSING_PROOF);
        }

        @Test
        @DisplayName("Wrong proof is BAD_PROOF, issued proof passes")
        void proofVerification() {
            riskParameters.setProofRequired(true);
            BorrowRequest bad = request(100, "USDC", 150);
            bad.setProof("deadbeef");
            BorrowRequest good = request(100, "USDC", 150);
            good.setProof(proofVerifier.issue(BORROWER));

            assertThat(policy.assessBorrow(BORROWER, bad).getReason()).isEqualTo(RiskReason.BAD_PROOF);
            assertThat(policy.assessBorrow(BORROWER, good).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("Proof issued for another borrower is rejected")
        void proofForOtherBorrower_rejected() {
            riskParameters.setProofRequired(true);
            BorrowRequest stolen = request(100, "USDC", 150);
            stolen.setProof(proofVerifier.issue("mallory"));

            assertThat(policy.assessBorrow(BORROWER, stolen).getReason()).isEqualTo(RiskReason.BAD_PROOF);
        }
    }

    // ==============================
    // DEGRADED COLLABORATORS
    // ==============================

    @Nested
    @DisplayName("Degraded collaborators")
    class Degraded {

        @Test
        @DisplayName("Without a reputation store everyone has score 0 and no badge")
        void noStore_defaults() {
            ReputationRiskPolicy bare =
                    new ReputationRiskPolicy(riskParameters, Optional.empty(), Optional.empty(), Optional.empty());

            assertThat(bare.scoreOf(BORROWER)).isZero();
            assertThat(bare.isDefaulter(BORROWER)).isFalse();
            assertThat(bare.collateralRatioBps(BORROWER)).isEqualTo(15000);
        }

        @Test
        @DisplayName("Required proof with no verifier configured is BAD_PROOF")
        void noVerifier_badProof() {
            riskParameters.setProofRequired(true);
            ReputationRiskPolicy noVerifier = new ReputationRiskPolicy(
                    riskParameters, Optional.of(reputationStore), Optional.of(priceFeed), Optional.empty());
            BorrowRequest withProof = request(100, "USDC", 150);
            withProof.setProof("anything");

            assertThat(noVerifier.assessBorrow(BORROWER, withProof).getReason()).isEqualTo(RiskReason.BAD_PROOF);
        }

        @Test
        @DisplayName("Verifier failure is BAD_PROOF, not an exception")
        void verifierThrows_badProof() {
            riskParameters.setProofRequired(true);
            when(failingProofVerifier.verify(anyString(), anyString())).thenThrow(new IllegalStateException("down"));
            ReputationRiskPolicy flaky = new ReputationRiskPolicy(
                    riskParameters, Optional.of(reputationStore), Optional.of(priceFeed), Optional.of(failingProofVerifier));
            BorrowRequest withProof = request(100, "USDC", 150);
            withProof.setProof("abc");

            assertThat(flaky.assessBorrow(BORROWER, withProof).getReason()).isEqualTo(RiskReason.BAD_PROOF);
        }

        @Test
        @DisplayName("Price feed failure is NO_ORACLE, not an exception")
        void feedThrows_noOracle() {
            when(failingPriceFeed.getPrice(any(), any())).thenThrow(new IllegalStateException("timeout"));
            ReputationRiskPolicy flaky = new ReputationRiskPolicy(
                    riskParameters, Optional.of(reputationStore), Optional.of(failingPriceFeed), Optional.empty());

            assertThat(flaky.assessBorrow(BORROWER, request(10, "WETH", 3)).getReason())
                    .isEqualTo(RiskReason.NO_ORACLE);
        }
    }

    @Test
    @DisplayName("Assessing the same request twice yields equal results")
    void assessment_isIdempotent() {
        priceFeed.setPrice("WETH", "USDC", new PriceQuote(BigInteger.valueOf(2000), 0));
        reputationStore.setScore(BORROWER, 400);
        BorrowRequest request = request(500, "WETH", 2);

        RiskResult first = policy.assessBorrow(BORROWER, request);
        RiskResult second = policy.assessBorrow(BORROWER, request);

        assertThat(second).isEqualTo(first);
        assertThat(reputationStore.scoreOf(BORROWER)).isEqualTo(400);
    }
}
