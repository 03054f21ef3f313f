package com.repledger.ledger;

import com.repledger.audit.ParameterHistoryService;
import com.repledger.custody.InMemoryAssetCustody;
import com.repledger.domain.model.PriceQuote;
import com.repledger.exception.DependencyUnavailableException;
import com.repledger.exception.InvalidInputException;
import com.repledger.exception.UnauthorizedException;
import com.repledger.interest.InterestModel;
import com.repledger.oracle.StaticPriceFeed;
import com.repledger.reputation.ReputationHook;
import com.repledger.reputation.ReputationStore;
import com.repledger.risk.RiskParameters;
import com.repledger.risk.RiskPolicy;
import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Administrative operations on the ledger: pause switch, module swapping, fee and duration
 * settings, risk tunables, oracle prices, reputation corrections and liquidity minting.
 *
 * <p>Every method requires the caller to be one of the configured admin accounts
 * ({@code repledger.admin.accounts}). Changes are applied under the ledger lock, so they never
 * interleave with a running loan operation, and then written to the parameter history.
 */
@Service
public class LedgerAdminService {

    private static final Logger log = LoggerFactory.getLogger(LedgerAdminService.class);

    static final String LEDGER = "LEDGER";
    static final String RISK = "RISK";
    static final String MODULE = "MODULE";
    static final String PRICE = "PRICE";
    static final String REPUTATION = "REPUTATION";

    private final LoanLedger loanLedger;
    private final RiskParameters riskParameters;
    private final StaticPriceFeed staticPriceFeed;
    private final InMemoryAssetCustody inMemoryAssetCustody;
    private final ParameterHistoryService parameterHistoryService;
    private final Optional<ReputationStore> reputationStore;
    private final Set<String> adminAccounts;

    public LedgerAdminService(
            LoanLedger loanLedger,
            RiskParameters riskParameters,
            StaticPriceFeed staticPriceFeed,
            InMemoryAssetCustody inMemoryAssetCustody,
            ParameterHistoryService parameterHistoryService,
            Optional<ReputationStore> reputationStore,
            @Value("${repledger.admin.accounts:}") Set<String> adminAccounts) {
        this.loanLedger = loanLedger;
        this.riskParameters = riskParameters;
        this.staticPriceFeed = staticPriceFeed;
        this.inMemoryAssetCustody = inMemoryAssetCustody;
        this.parameterHistoryService = parameterHistoryService;
        this.reputationStore = reputationStore;
        this.adminAccounts = Set.copyOf(adminAccounts);
    }

    public boolean isAdmin(String account) {
        return account != null && adminAccounts.contains(account);
    }

    // ========================
    // PAUSE
    // ========================

    public void pause(String caller) {
        setPaused(caller, true);
    }

    public void unpause(String caller) {
        setPaused(caller, false);
    }

    private void setPaused(String caller, boolean paused) {
        requireAdmin(caller);
        boolean previous = loanLedger.isPaused();
        loanLedger.reconfigure("setPaused", () -> loanLedger.setPaused(paused));
        log.warn("Ledger {} by {}", paused ? "paused" : "unpaused", caller);
        parameterHistoryService.recordChange(LEDGER, "paused", previous, paused, caller);
    }

    // ========================
    // MODULES
    // ========================

    /** Replaces the risk policy consulted by {@code open}. Null leaves the ledger unable to open loans. */
    public void setRiskPolicy(String caller, RiskPolicy riskPolicy) {
        requireAdmin(caller);
        String previous = describe(loanLedger.getRiskPolicy().orElse(null));
        loanLedger.reconfigure("setRiskPolicy", () -> loanLedger.setRiskPolicy(riskPolicy));
        parameterHistoryService.recordChange(MODULE, "riskPolicy", previous, describe(riskPolicy), caller);
    }

    public void setInterestModel(String caller, InterestModel interestModel) {
        requireAdmin(caller);
        String previous = describe(loanLedger.getInterestModel().orElse(null));
        loanLedger.reconfigure("setInterestModel", () -> loanLedger.setInterestModel(interestModel));
        parameterHistoryService.recordChange(MODULE, "interestModel", previous, describe(interestModel), caller);
    }

    /** Null disables reputation notifications. */
    public void setReputationHook(String caller, ReputationHook reputationHook) {
        requireAdmin(caller);
        String previous = describe(loanLedger.getReputationHook().orElse(null));
        loanLedger.reconfigure("setReputationHook", () -> loanLedger.setReputationHook(reputationHook));
        parameterHistoryService.recordChange(MODULE, "reputationHook", previous, describe(reputationHook), caller);
    }

    // ========================
    // LEDGER PARAMETERS
    // ========================

    public void setOriginationFeeBps(String caller, int bps) {
        requireAdmin(caller);
        LedgerParameters.requireBps("originationFeeBps", bps);
        LedgerParameters params = loanLedger.getLedgerParameters();
        int previous = params.getOriginationFeeBps();
        loanLedger.reconfigure("setOriginationFeeBps", () -> params.setOriginationFeeBps(bps));
        parameterHistoryService.recordChange(LEDGER, "originationFeeBps", previous, bps, caller);
    }

    public void setProtocolFeeBps(String caller, int bps) {
        requireAdmin(caller);
        LedgerParameters.requireBps("protocolFeeBps", bps);
        LedgerParameters params = loanLedger.getLedgerParameters();
        int previous = params.getProtocolFeeBps();
        loanLedger.reconfigure("setProtocolFeeBps", () -> params.setProtocolFeeBps(bps));
        parameterHistoryService.recordChange(LEDGER, "protocolFeeBps", previous, bps, caller);
    }

    public void setDefaultBountyBps(String caller, int bps) {
        requireAdmin(caller);
        LedgerParameters.requireBps("defaultBountyBps", bps);
        LedgerParameters params = loanLedger.getLedgerParameters();
        int previous = params.getDefaultBountyBps();
        loanLedger.reconfigure("setDefaultBountyBps", () -> params.setDefaultBountyBps(bps));
        parameterHistoryService.recordChange(LEDGER, "defaultBountyBps", previous, bps, caller);
    }

    public void setDurationBounds(String caller, long minSeconds, long maxSeconds) {
        requireAdmin(caller);
        LedgerParameters.requireDurationWindow(minSeconds, maxSeconds);
        LedgerParameters params = loanLedger.getLedgerParameters();
        long previousMin = params.getMinDurationSeconds();
        long previousMax = params.getMaxDurationSeconds();
        loanLedger.reconfigure("setDurationBounds", () -> {
            params.setMinDurationSeconds(minSeconds);
            params.setMaxDurationSeconds(maxSeconds);
        });
        parameterHistoryService.recordChange(LEDGER, "minDurationSeconds", previousMin, minSeconds, caller);
        parameterHistoryService.recordChange(LEDGER, "maxDurationSeconds", previousMax, maxSeconds, caller);
    }

    public void setGracePeriodSeconds(String caller, long seconds) {
        requireAdmin(caller);
        LedgerParameters.requireGracePeriod(seconds);
        LedgerParameters params = loanLedger.getLedgerParameters();
        long previous = params.getGracePeriodSeconds();
        loanLedger.reconfigure("setGracePeriodSeconds", () -> params.setGracePeriodSeconds(seconds));
        parameterHistoryService.recordChange(LEDGER, "gracePeriodSeconds", previous, seconds, caller);
    }

    public void setTreasuryAccount(String caller, String treasuryAccount) {
        requireAdmin(caller);
        if (treasuryAccount == null || treasuryAccount.isBlank()) {
            throw new InvalidInputException("Treasury account must not be blank");
        }
        LedgerParameters params = loanLedger.getLedgerParameters();
        String previous = params.getTreasuryAccount();
        loanLedger.reconfigure("setTreasuryAccount", () -> params.setTreasuryAccount(treasuryAccount));
        parameterHistoryService.recordChange(LEDGER, "treasuryAccount", previous, treasuryAccount, caller);
    }

    // ========================
    // RISK PARAMETERS
    // ========================

    public void setMaxRatioBps(String caller, int maxRatioBps) {
        requireAdmin(caller);
        RiskParameters.requireMaxRatioBps(maxRatioBps);
        int previous = riskParameters.getMaxRatioBps();
        loanLedger.reconfigure("setMaxRatioBps", () -> riskParameters.setMaxRatioBps(maxRatioBps));
        parameterHistoryService.recordChange(RISK, "maxRatioBps", previous, maxRatioBps, caller);
    }

    public void setScoreFree(String caller, int scoreFree) {
        requireAdmin(caller);
        RiskParameters.requireScoreFree(scoreFree);
        int previous = riskParameters.getScoreFree();
        loanLedger.reconfigure("setScoreFree", () -> riskParameters.setScoreFree(scoreFree));
        parameterHistoryService.recordChange(RISK, "scoreFree", previous, scoreFree, caller);
    }

    public void setNoCollateralCap(String caller, BigInteger cap) {
        requireAdmin(caller);
        RiskParameters.requireNoCollateralCap(cap);
        BigInteger previous = riskParameters.getNoCollateralCap();
        loanLedger.reconfigure("setNoCollateralCap", () -> riskParameters.setNoCollateralCap(cap));
        parameterHistoryService.recordChange(RISK, "noCollateralCap", previous, cap, caller);
    }

    public void setProofRequired(String caller, boolean proofRequired) {
        requireAdmin(caller);
        boolean previous = riskParameters.isProofRequired();
        loanLedger.reconfigure("setProofRequired", () -> riskParameters.setProofRequired(proofRequired));
        parameterHistoryService.recordChange(RISK, "proofRequired", previous, proofRequired, caller);
    }

    // ========================
    // ORACLE & LIQUIDITY
    // ========================

    public void setPrice(String caller, String base, String quote, PriceQuote priceQuote) {
        requireAdmin(caller);
        if (priceQuote == null || priceQuote.price() == null) {
            throw new InvalidInputException("Price is required");
        }
        String previous = staticPriceFeed.getPrice(base, quote).map(PriceQuote::toString).orElse(null);
        staticPriceFeed.setPrice(base, quote, priceQuote);
        parameterHistoryService.recordChange(PRICE, base + "/" + quote, previous, priceQuote, caller);
    }

    /** Deletes a quote; borrowing against that pair is rejected with NO_ORACLE afterwards. */
    public void removePrice(String caller, String base, String quote) {
        requireAdmin(caller);
        String previous = staticPriceFeed.getPrice(base, quote).map(PriceQuote::toString).orElse(null);
        staticPriceFeed.removePrice(base, quote);
        parameterHistoryService.recordChange(PRICE, base + "/" + quote, previous, null, caller);
    }

    /** Funds an account with newly created units (ledger liquidity, test borrowers). */
    public void mint(String caller, String asset, String owner, BigInteger amount) {
        requireAdmin(caller);
        if (owner == null || owner.isBlank() || amount == null || amount.signum() <= 0) {
            throw new InvalidInputException("Mint requires an owner and a positive amount");
        }
        inMemoryAssetCustody.mint(asset, owner, amount);
    }

    /** Manual score correction. Badges cannot be revoked. */
    public void setReputationScore(String caller, String account, int score) {
        requireAdmin(caller);
        if (account == null || account.isBlank() || score < 0) {
            throw new InvalidInputException("Score update requires an account and a non-negative score");
        }
        ReputationStore store = reputationStore.orElseThrow(() -> new DependencyUnavailableException("reputation store"));
        int previous = store.scoreOf(account);
        store.setScore(account, score);
        parameterHistoryService.recordChange(REPUTATION, "score:" + account, previous, score, caller);
    }

    // ========================
    // INTERNALS
    // ========================

    /** Throws {@link UnauthorizedException} unless {@code caller} is a configured admin. */
    public void requireAdmin(String caller) {
        if (!isAdmin(caller)) {
            log.warn("Rejected admin call from {}", caller);
            throw new UnauthorizedException("Account " + caller + " is not an administrator");
        }
    }

    private static String describe(Object module) {
        return module != null ? module.toString() : null;
    }
}
