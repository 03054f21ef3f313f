package com.repledger.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.repledger.audit.ParameterHistoryService;
import com.repledger.custody.InMemoryAssetCustody;
import com.repledger.domain.model.BorrowRequest;
import com.repledger.domain.model.PriceQuote;
import com.repledger.event.EventPublisherHelper;
import com.repledger.exception.DependencyUnavailableException;
import com.repledger.exception.InvalidInputException;
import com.repledger.exception.ReentrancyException;
import com.repledger.exception.StateConflictException;
import com.repledger.exception.StateConflictException.Conflict;
import com.repledger.exception.UnauthorizedException;
import com.repledger.interest.LinearInterestModel;
import com.repledger.ledger.LedgerAdminService;
import com.repledger.ledger.LedgerParameters;
import com.repledger.ledger.LoanLedger;
import com.repledger.oracle.StaticPriceFeed;
import com.repledger.reputation.InMemoryReputationStore;
import com.repledger.reputation.ReputationHook;
import com.repledger.risk.ReputationRiskPolicy;
import com.repledger.risk.RiskParameters;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
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
 * Unit tests for LedgerAdminService: admin gating, parameter validation, module swaps and
 * parameter-history recording.
 */
@ExtendWith(MockitoExtension.class)
class LedgerAdminServiceTest {

    private static final String ADMIN = "admin";
    private static final String OUTSIDER = "mallory";

    @Mock
    private Clock clock;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private ParameterHistoryService parameterHistoryService;

    @Mock
    private ReputationHook reputationHook;

    private InMemoryAssetCustody custody;
    private InMemoryReputationStore reputationStore;
    private StaticPriceFeed priceFeed;
    private RiskParameters riskParameters;
    private LedgerParameters ledgerParameters;
    private LoanLedger ledger;
    private LedgerAdminService adminService;

    @BeforeEach
    void setUp() {
        lenient().when(clock.instant()).thenReturn(Instant.ofEpochSecond(1_700_000_000L));
        custody = new InMemoryAssetCustody();
        reputationStore = new InMemoryReputationStore();
        priceFeed = new StaticPriceFeed();
        riskParameters = RiskParameters.builder()
                .maxRatioBps(15000)
                .scoreFree(1000)
                .noCollateralCap(BigInteger.valueOf(1000))
                .acceptedCollateralAssets(Set.of())
                .build();
        ledgerParameters = LedgerParameters.builder()
                .ledgerAccount("ledger")
                .treasuryAccount("treasury")
                .minDurationSeconds(86_400)
                .maxDurationSeconds(31_536_000)
                .gracePeriodSeconds(259_200)
                .build();
        ledger = new LoanLedger(
                custody,
                new ReputationRiskPolicy(
                        riskParameters, Optional.of(reputationStore), Optional.of(priceFeed), Optional.empty()),
                new LinearInterestModel(1000, 2000),
                Optional.of(reputationHook),
                ledgerParameters,
                clock,
                eventPublisherHelper);
        adminService = new LedgerAdminService(
                ledger,
                riskParameters,
                priceFeed,
                custody,
                parameterHistoryService,
                Optional.of(reputationStore),
                Set.of(ADMIN));
    }

    private static BorrowRequest sameAssetRequest(long durationSeconds) {
        return BorrowRequest.builder()
                .asset("USDC")
                .amount(BigInteger.valueOf(100))
                .collateralAsset("USDC")
                .collateralAmount(BigInteger.valueOf(150))
                .durationSeconds(durationSeconds)
                .build();
    }

    // ==============================
    // AUTHORIZATION
    // ==============================

    @Nested
    @DisplayName("Authorization")
    class Authorization {

        @Test
        @DisplayName("Non-admin callers are rejected and nothing changes")
        void nonAdmin_rejected() {
            assertThatThrownBy(() -> adminService.pause(OUTSIDER)).isInstanceOf(UnauthorizedException.class);
            assertThatThrownBy(() -> adminService.setOriginationFeeBps(OUTSIDER, 50))
                    .isInstanceOf(UnauthorizedException.class);
            assertThatThrownBy(() -> adminService.mint(OUTSIDER, "USDC", OUTSIDER, BigInteger.TEN))
                    .isInstanceOf(UnauthorizedException.class);
            assertThatThrownBy(() -> adminService.setInterestModel(null, new LinearInterestModel(0, 0)))
                    .isInstanceOf(UnauthorizedException.class);

            assertThat(ledger.isPaused()).isFalse();
            assertThat(ledgerParameters.getOriginationFeeBps()).isZero();
            assertThat(custody.balanceOf("USDC", OUTSIDER)).isEqualTo(BigInteger.ZERO);
            verifyNoInteractions(parameterHistoryService);
        }

        @Test
        @DisplayName("isAdmin reflects the configured account set")
        void isAdmin() {
            assertThat(adminService.isAdmin(ADMIN)).isTrue();
            assertThat(adminService.isAdmin(OUTSIDER)).isFalse();
            assertThat(adminService.isAdmin(null)).isFalse();
        }
    }

    // ==============================
    // PARAMETERS
    // ==============================

    @Nested
    @DisplayName("Parameters")
    class Parameters {

        @Test
        @DisplayName("Pause and unpause flip the flag and are recorded")
        void pauseUnpause_recorded() {
            adminService.pause(ADMIN);
            assertThat(ledger.isPaused()).isTrue();

            adminService.unpause(ADMIN);
            assertThat(ledger.isPaused()).isFalse();

            verify(parameterHistoryService).recordChange("LEDGER", "paused", false, true, ADMIN);
            verify(parameterHistoryService).recordChange("LEDGER", "paused", true, false, ADMIN);
        }

        @Test
        @DisplayName("Fee rates must lie within [0, 10000] bps")
        void feeBounds() {
            assertThatThrownBy(() -> adminService.setOriginationFeeBps(ADMIN, 10_001))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> adminService.setProtocolFeeBps(ADMIN, -1))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> adminService.setDefaultBountyBps(ADMIN, 20_000))
                    .isInstanceOf(InvalidInputException.class);

            adminService.setOriginationFeeBps(ADMIN, 10_000);
            adminService.setProtocolFeeBps(ADMIN, 250);
            adminService.setDefaultBountyBps(ADMIN, 0);

            assertThat(ledgerParameters.getOriginationFeeBps()).isEqualTo(10_000);
            assertThat(ledgerParameters.getProtocolFeeBps()).isEqualTo(250);
            verify(parameterHistoryService).recordChange("LEDGER", "originationFeeBps", 0, 10_000, ADMIN);
            verify(parameterHistoryService).recordChange("LEDGER", "protocolFeeBps", 0, 250, ADMIN);
        }

        @Test
        @DisplayName("Duration window requires 0 < min <= max")
        void durationBounds() {
            assertThatThrownBy(() -> adminService.setDurationBounds(ADMIN, 0, 100))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> adminService.setDurationBounds(ADMIN, 200, 100))
                    .isInstanceOf(InvalidInputException.class);

            adminService.setDurationBounds(ADMIN, 3_600, 3_600);

            assertThat(ledgerParameters.getMinDurationSeconds()).isEqualTo(3_600);
            assertThat(ledgerParameters.getMaxDurationSeconds()).isEqualTo(3_600);
        }

        @Test
        @DisplayName("Grace period and treasury are validated")
        void graceAndTreasury() {
            assertThatThrownBy(() -> adminService.setGracePeriodSeconds(ADMIN, -1))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> adminService.setTreasuryAccount(ADMIN, " "))
                    .isInstanceOf(InvalidInputException.class);

            adminService.setGracePeriodSeconds(ADMIN, 0);
            adminService.setTreasuryAccount(ADMIN, "vault");

            assertThat(ledgerParameters.getGracePeriodSeconds()).isZero();
            assertThat(ledgerParameters.getTreasuryAccount()).isEqualTo("vault");
            verify(parameterHistoryService).recordChange("LEDGER", "treasuryAccount", "treasury", "vault", ADMIN);
        }

        @Test
        @DisplayName("A Long.MAX_VALUE grace period never makes a fresh loan defaultable")
        void maxGracePeriod_freshLoanNotDefaultable() {
            custody.mint("USDC", "ledger", BigInteger.valueOf(1_000));
            custody.mint("USDC", "alice", BigInteger.valueOf(150));
            adminService.setGracePeriodSeconds(ADMIN, Long.MAX_VALUE);
            long loanId = ledger.open("alice", sameAssetRequest(86_400));

            assertThatThrownBy(() -> ledger.markDefault("keeper", loanId))
                    .isInstanceOf(StateConflictException.class)
                    .extracting("conflict")
                    .isEqualTo(Conflict.NOT_PAST_DUE);
            assertThat(custody.balanceOf("USDC", "keeper")).isEqualTo(BigInteger.ZERO);
            assertThat(reputationStore.hasBadge("alice")).isFalse();
        }

        @Test
        @DisplayName("An unbounded duration window still rejects a duration that overflows the due date")
        void unboundedDurationWindow_overflowRejected() {
            custody.mint("USDC", "ledger", BigInteger.valueOf(1_000));
            custody.mint("USDC", "alice", BigInteger.valueOf(150));
            adminService.setDurationBounds(ADMIN, 86_400, Long.MAX_VALUE);

            assertThatThrownBy(() -> ledger.open("alice", sameAssetRequest(Long.MAX_VALUE - 1_000)))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(ledger.getActiveLoanId("alice")).isEmpty();
            assertThat(custody.balanceOf("USDC", "alice")).isEqualTo(BigInteger.valueOf(150));
        }

        @Test
        @DisplayName("Risk tunables are validated and applied to the live parameters")
        void riskTunables() {
            assertThatThrownBy(() -> adminService.setScoreFree(ADMIN, 0)).isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> adminService.setMaxRatioBps(ADMIN, -5)).isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> adminService.setNoCollateralCap(ADMIN, BigInteger.valueOf(-1)))
                    .isInstanceOf(InvalidInputException.class);

            adminService.setScoreFree(ADMIN, 500);
            adminService.setMaxRatioBps(ADMIN, 20_000);
            adminService.setNoCollateralCap(ADMIN, BigInteger.valueOf(5_000));
            adminService.setProofRequired(ADMIN, true);

            assertThat(riskParameters.getScoreFree()).isEqualTo(500);
            assertThat(riskParameters.getMaxRatioBps()).isEqualTo(20_000);
            assertThat(riskParameters.getNoCollateralCap()).isEqualTo(BigInteger.valueOf(5_000));
            assertThat(riskParameters.isProofRequired()).isTrue();
            verify(parameterHistoryService).recordChange("RISK", "scoreFree", 1000, 500, ADMIN);
        }
    }

    // ==============================
    // MODULES
    // ==============================

    @Nested
    @DisplayName("Module swaps")
    class Modules {

        @Test
        @DisplayName("Swapping the interest model changes debt for existing loans")
        void swapInterestModel() {
            LinearInterestModel replacement = new LinearInterestModel(500, 900);

            adminService.setInterestModel(ADMIN, replacement);

            assertThat(ledger.getInterestModel()).containsSame(replacement);
            verify(parameterHistoryService)
                    .recordChange(eq("MODULE"), eq("interestModel"), any(), eq(replacement.toString()), eq(ADMIN));
        }

        @Test
        @DisplayName("Removing the risk policy makes open fail as a dependency problem")
        void removeRiskPolicy() {
            custody.mint("USDC", "ledger", BigInteger.valueOf(1_000));
            custody.mint("USDC", "alice", BigInteger.valueOf(150));

            adminService.setRiskPolicy(ADMIN, null);

            assertThat(ledger.getRiskPolicy()).isEmpty();
            assertThatThrownBy(() -> ledger.open("alice", BorrowRequest.builder()
                            .asset("USDC")
                            .amount(BigInteger.valueOf(100))
                            .collateralAsset("USDC")
                            .collateralAmount(BigInteger.valueOf(150))
                            .durationSeconds(86_400)
                            .build()))
                    .isInstanceOf(DependencyUnavailableException.class);
            assertThat(custody.balanceOf("USDC", "alice")).isEqualTo(BigInteger.valueOf(150));
        }

        @Test
        @DisplayName("Removing the reputation hook disables notifications")
        void removeReputationHook() {
            adminService.setReputationHook(ADMIN, null);

            assertThat(ledger.getReputationHook()).isEmpty();
        }

        @Test
        @DisplayName("Reconfiguring from inside a running ledger operation is rejected")
        void reconfigureDuringOperation_rejected() {
            custody.mint("USDC", "ledger", BigInteger.valueOf(1_000));
            custody.mint("USDC", "alice", BigInteger.valueOf(150));
            doAnswer(invocation -> {
                        adminService.setOriginationFeeBps(ADMIN, 9_000);
                        return null;
                    })
                    .when(reputationHook)
                    .onLoanOpened(anyLong(), anyString());

            assertThatThrownBy(() -> ledger.open("alice", BorrowRequest.builder()
                            .asset("USDC")
                            .amount(BigInteger.valueOf(100))
                            .collateralAsset("USDC")
                            .collateralAmount(BigInteger.valueOf(150))
                            .durationSeconds(86_400)
                            .build()))
                    .isInstanceOf(ReentrancyException.class);

            assertThat(ledgerParameters.getOriginationFeeBps()).isZero();
            assertThat(ledger.getActiveLoanId("alice")).isEmpty();
        }
    }

    // ==============================
    // ORACLE, LIQUIDITY, REPUTATION
    // ==============================

    @Nested
    @DisplayName("Oracle, liquidity and reputation")
    class OracleLiquidityReputation {

        @Test
        @DisplayName("Prices are set on the feed and recorded")
        void setPrice() {
            PriceQuote quote = new PriceQuote(BigInteger.valueOf(2_000_000_000L), 6);

            adminService.setPrice(ADMIN, "WETH", "USDC", quote);

            assertThat(priceFeed.getPrice("WETH", "USDC")).contains(quote);
            verify(parameterHistoryService).recordChange("PRICE", "WETH/USDC", null, quote, ADMIN);
        }

        @Test
        @DisplayName("Removing a price clears the quote and records the removal")
        void removePrice() {
            PriceQuote quote = new PriceQuote(BigInteger.valueOf(2_000_000_000L), 6);
            priceFeed.setPrice("WETH", "USDC", quote);

            adminService.removePrice(ADMIN, "WETH", "USDC");

            assertThat(priceFeed.getPrice("WETH", "USDC")).isEmpty();
            verify(parameterHistoryService).recordChange("PRICE", "WETH/USDC", quote.toString(), null, ADMIN);
        }

        @Test
        @DisplayName("Mint credits the owner and rejects non-positive amounts")
        void mint() {
            adminService.mint(ADMIN, "USDC", "ledger", BigInteger.valueOf(5_000));

            assertThat(custody.balanceOf("USDC", "ledger")).isEqualTo(BigInteger.valueOf(5_000));
            assertThatThrownBy(() -> adminService.mint(ADMIN, "USDC", "ledger", BigInteger.ZERO))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("Score corrections go to the reputation store")
        void setReputationScore() {
            adminService.setReputationScore(ADMIN, "alice", 750);

            assertThat(reputationStore.scoreOf("alice")).isEqualTo(750);
            verify(parameterHistoryService).recordChange("REPUTATION", "score:alice", 0, 750, ADMIN);
        }

        @Test
        @DisplayName("Score corrections without a reputation store fail as a dependency problem")
        void setReputationScore_noStore() {
            LedgerAdminService storeless = new LedgerAdminService(
                    ledger, riskParameters, priceFeed, custody, parameterHistoryService, Optional.empty(), Set.of(ADMIN));

            assertThatThrownBy(() -> storeless.setReputationScore(ADMIN, "alice", 10))
                    .isInstanceOf(DependencyUnavailableException.class);
        }
    }
}
