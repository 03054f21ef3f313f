package com.repledger.ledger;

import com.repledger.custody.AssetCustody;
import com.repledger.domain.enums.LoanStatus;
import com.repledger.domain.enums.RiskReason;
import com.repledger.domain.model.BorrowRequest;
import com.repledger.domain.model.Loan;
import com.repledger.domain.model.RepaymentResult;
import com.repledger.event.EventPublisherHelper;
import com.repledger.exception.DependencyUnavailableException;
import com.repledger.exception.InsufficientLiquidityException;
import com.repledger.exception.InvalidInputException;
import com.repledger.exception.PolicyRejectionException;
import com.repledger.exception.ReentrancyException;
import com.repledger.exception.ResourceNotFoundException;
import com.repledger.exception.StateConflictException;
import com.repledger.exception.StateConflictException.Conflict;
import com.repledger.exception.UnauthorizedException;
import com.repledger.interest.InterestModel;
import com.repledger.interest.WideMath;
import com.repledger.reputation.ReputationHook;
import com.repledger.risk.RiskPolicy;
import com.repledger.risk.RiskResult;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns every loan record and the collateral escrow, and enforces the loan state machine.
 *
 * <p>Operations:
 * <ul>
 *   <li><b>open:</b> risk check, escrow collateral, disburse principal net of the origination
 *       fee, record the loan ACTIVE</li>
 *   <li><b>repay:</b> credit a payment; when it covers the debt, refund overpay, release
 *       collateral, route the protocol fee, mark REPAID</li>
 *   <li><b>markDefault:</b> permissionless once past due plus grace; pays the caller a bounty
 *       out of the collateral and marks DEFAULTED</li>
 * </ul>
 *
 * <p><b>Atomicity:</b> each mutating call runs in a {@link LedgerTransaction}. Any failure
 * (precondition, custody, reputation hook) rolls back loan records, locked collateral and custody
 * movements. Loan events are published only after commit.
 *
 * <p><b>Ordering:</b> all public methods are synchronized, giving one global order across callers.
 * A call arriving while another mutating call is still running on the same thread (a collaborator
 * calling back into the ledger) is rejected with {@link ReentrancyException}. The pause flag is
 * checked before anything else and gates mutations only.
 *
 * <p><b>Invariant:</b> for every asset, locked collateral equals the sum of
 * {@code collateralAmount} over ACTIVE loans pledging that asset.
 */
@Service
public class LoanLedger {

    private static final Logger log = LoggerFactory.getLogger(LoanLedger.class);

    private final AssetCustody assetCustody;
    private final LedgerParameters ledgerParameters;
    private final Clock clock;
    private final EventPublisherHelper eventPublisherHelper;

    // Swappable modules, null = not configured
    private RiskPolicy riskPolicy;
    private InterestModel interestModel;
    private ReputationHook reputationHook;

    private final Map<Long, Loan> loans = new LinkedHashMap<>();
    private final Map<String, Long> activeLoanOf = new HashMap<>();
    private final Map<String, BigInteger> lockedCollateral = new HashMap<>();
    private long nextLoanId = 1;

    private boolean paused;
    private boolean entered;

    public LoanLedger(
            AssetCustody assetCustody,
            RiskPolicy riskPolicy,
            InterestModel interestModel,
            Optional<ReputationHook> reputationHook,
            LedgerParameters ledgerParameters,
            Clock clock,
            EventPublisherHelper eventPublisherHelper) {
        this.assetCustody = assetCustody;
        this.riskPolicy = riskPolicy;
        this.interestModel = interestModel;
        this.reputationHook = reputationHook.orElse(null);
        this.ledgerParameters = ledgerParameters;
        this.clock = clock;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // OPEN
    // ========================

    /**
     * Opens a loan for {@code borrower}.
     *
     * @return the new loan id
     * @throws InvalidInputException          blank borrower/asset, non-positive amount, duration outside the window
     * @throws StateConflictException         ledger paused or borrower already has an ACTIVE loan
     * @throws PolicyRejectionException       risk policy refused the request
     * @throws InsufficientLiquidityException free liquidity of the asset does not cover the amount
     */
    public synchronized long open(String borrower, BorrowRequest request) {
        return execute("open", tx -> {
            requireText(borrower, "borrower");
            if (request == null) {
                throw new InvalidInputException("Borrow request is required");
            }
            requireText(request.getAsset(), "asset");
            requirePositive(request.getAmount(), "amount");
            BigInteger collateralAmount = request.collateralAmountOrZero();
            if (collateralAmount.signum() < 0) {
                throw new InvalidInputException("Collateral amount must be non-negative");
            }
            if (collateralAmount.signum() > 0) {
                requireText(request.getCollateralAsset(), "collateralAsset");
            }
            long duration = request.getDurationSeconds();
            if (duration < ledgerParameters.getMinDurationSeconds()
                    || duration > ledgerParameters.getMaxDurationSeconds()) {
                throw new InvalidInputException(String.format(
                        "Duration %ds outside [%d, %d]",
                        duration,
                        ledgerParameters.getMinDurationSeconds(),
                        ledgerParameters.getMaxDurationSeconds()));
            }
            long now = nowSeconds();
            long dueTs = dueTimestamp(now, duration);
            if (activeLoanOf.containsKey(borrower)) {
                throw new StateConflictException(
                        Conflict.LOAN_ALREADY_ACTIVE,
                        "Borrower " + borrower + " already has active loan " + activeLoanOf.get(borrower));
            }

            RiskPolicy policy = requireRiskPolicy();
            requireInterestModel();
            BigInteger amount = request.getAmount();
            RiskResult risk = policy.assessBorrow(borrower, request);
            if (!risk.isAllowed() || amount.compareTo(risk.getMaxBorrow()) > 0) {
                RiskReason reason = risk.isAllowed() ? RiskReason.LIMIT : risk.getReason();
                log.warn("Borrow by {} rejected: {} (requested {}, max {})", borrower, reason, amount, risk.getMaxBorrow());
                throw new PolicyRejectionException(reason, risk.getMaxBorrow());
            }

            String asset = request.getAsset();
            BigInteger free = freeLiquidity(asset);
            if (free.compareTo(amount) < 0) {
                throw new InsufficientLiquidityException(asset, amount, free);
            }

            String ledgerAccount = ledgerParameters.getLedgerAccount();
            long loanId = nextLoanId++;
            tx.onRollback(() -> nextLoanId = loanId);

            String collateralAsset = collateralAmount.signum() > 0 ? request.getCollateralAsset() : asset;
            if (collateralAmount.signum() > 0) {
                tx.move(collateralAsset, borrower, ledgerAccount, collateralAmount);
                lock(tx, collateralAsset, collateralAmount);
            }

            BigInteger fee = WideMath.applyBps(amount, ledgerParameters.getOriginationFeeBps());
            tx.move(asset, ledgerAccount, borrower, amount.subtract(fee));
            payTreasury(tx, asset, fee);

            Loan loan = Loan.builder()
                    .id(loanId)
                    .borrower(borrower)
                    .asset(asset)
                    .collateralAsset(collateralAsset)
                    .principal(amount)
                    .principalRepaid(BigInteger.ZERO)
                    .collateralAmount(collateralAmount)
                    .originationFee(fee)
                    .startTs(now)
                    .dueTs(dueTs)
                    .status(LoanStatus.ACTIVE)
                    .build();
            loans.put(loanId, loan);
            tx.onRollback(() -> loans.remove(loanId));
            activeLoanOf.put(borrower, loanId);
            tx.onRollback(() -> activeLoanOf.remove(borrower));

            if (reputationHook != null) {
                reputationHook.onLoanOpened(loanId, borrower);
            }

            log.info(
                    "Loan {} opened: borrower={}, amount={} {}, fee={}, collateral={} {}, ratio={}bps, due={}",
                    loanId,
                    borrower,
                    amount,
                    asset,
                    fee,
                    collateralAmount,
                    collateralAsset,
                    risk.getCollateralRatioBps(),
                    loan.getDueTs());

            Loan snapshot = loan.copy();
            Map<String, Object> details = Map.of(
                    "amount", amount,
                    "originationFee", fee,
                    "collateralAmount", collateralAmount,
                    "collateralRatioBps", risk.getCollateralRatioBps());
            tx.afterCommit(() -> eventPublisherHelper.publishLoanOpened(this, snapshot, details));
            return loanId;
        });
    }

    // ========================
    // REPAY
    // ========================

    /**
     * Credits {@code amount} from {@code payer} toward loan {@code loanId}. Only the borrower may repay.
     * When the cumulative repayment reaches the current debt the loan closes; any excess is refunded
     * in the same call.
     */
    public synchronized RepaymentResult repay(String payer, long loanId, BigInteger amount) {
        return execute("repay", tx -> {
            requireText(payer, "payer");
            requirePositive(amount, "amount");
            Loan loan = requireActiveLoan(loanId);
            if (!payer.equals(loan.getBorrower())) {
                throw new UnauthorizedException("Only the borrower can repay loan " + loanId);
            }
            InterestModel model = requireInterestModel();

            Loan before = loan.copy();
            tx.onRollback(() -> loans.put(loanId, before));

            String ledgerAccount = ledgerParameters.getLedgerAccount();
            tx.move(loan.getAsset(), payer, ledgerAccount, amount);

            long now = nowSeconds();
            BigInteger repaid = loan.getPrincipalRepaid().add(amount);
            BigInteger totalDebt =
                    model.debtWithPenalty(loan.getPrincipal(), loan.getStartTs(), loan.getDueTs(), now);
            boolean fullyRepaid = repaid.compareTo(totalDebt) >= 0;
            BigInteger paidNet = amount;
            BigInteger refund = BigInteger.ZERO;
            BigInteger protocolFee = BigInteger.ZERO;

            if (fullyRepaid) {
                refund = repaid.subtract(totalDebt);
                tx.move(loan.getAsset(), ledgerAccount, payer, refund);
                paidNet = amount.subtract(refund);
                repaid = totalDebt;

                closeLoan(tx, loan, LoanStatus.REPAID, now);
                tx.move(loan.getCollateralAsset(), ledgerAccount, loan.getBorrower(), loan.getCollateralAmount());

                BigInteger interest = totalDebt.subtract(loan.getPrincipal()).max(BigInteger.ZERO);
                protocolFee = WideMath.applyBps(interest, ledgerParameters.getProtocolFeeBps());
                payTreasury(tx, loan.getAsset(), protocolFee);
            }
            loan.setPrincipalRepaid(repaid);

            if (reputationHook != null) {
                reputationHook.onLoanRepaid(loanId, loan.getBorrower(), paidNet, repaid, totalDebt, fullyRepaid);
            }

            if (fullyRepaid) {
                log.info(
                        "Loan {} repaid: totalDebt={}, refund={}, protocolFee={}, collateral released={} {}",
                        loanId,
                        totalDebt,
                        refund,
                        protocolFee,
                        loan.getCollateralAmount(),
                        loan.getCollateralAsset());
            } else {
                log.info("Loan {} partial repayment {}: {} of {}", loanId, paidNet, repaid, totalDebt);
            }

            Loan snapshot = loan.copy();
            boolean closed = fullyRepaid;
            Map<String, Object> details = Map.of(
                    "paidNet", paidNet,
                    "refund", refund,
                    "totalRepaid", repaid,
                    "totalDebt", totalDebt,
                    "protocolFee", protocolFee);
            tx.afterCommit(() -> eventPublisherHelper.publishLoanRepaid(this, snapshot, payer, closed, details));
            return new RepaymentResult(paidNet, repaid, totalDebt, fullyRepaid);
        });
    }

    // ========================
    // DEFAULT
    // ========================

    /**
     * Marks an overdue loan as defaulted. Anyone may call this once
     * {@code now > dueTs + gracePeriod}; the caller receives the default bounty.
     * The rest of the collateral stays in ledger custody.
     */
    public synchronized Loan markDefault(String keeper, long loanId) {
        return execute("markDefault", tx -> {
            requireText(keeper, "keeper");
            Loan loan = requireActiveLoan(loanId);
            long now = nowSeconds();
            long deadline = defaultDeadline(loan);
            if (now <= deadline) {
                throw new StateConflictException(
                        Conflict.NOT_PAST_DUE, "Loan " + loanId + " not past due until " + deadline + " (now " + now + ")");
            }

            Loan before = loan.copy();
            tx.onRollback(() -> loans.put(loanId, before));

            BigInteger bounty = WideMath.applyBps(loan.getCollateralAmount(), ledgerParameters.getDefaultBountyBps());
            tx.move(loan.getCollateralAsset(), ledgerParameters.getLedgerAccount(), keeper, bounty);
            closeLoan(tx, loan, LoanStatus.DEFAULTED, now);

            if (reputationHook != null) {
                reputationHook.onLoanDefaulted(loanId, loan.getBorrower());
            }

            log.warn(
                    "Loan {} defaulted: borrower={}, keeper={}, bounty={} {}, collateral retained={}",
                    loanId,
                    loan.getBorrower(),
                    keeper,
                    bounty,
                    loan.getCollateralAsset(),
                    loan.getCollateralAmount().subtract(bounty));

            Loan snapshot = loan.copy();
            Map<String, Object> details = Map.of(
                    "bounty", bounty,
                    "collateralRetained", loan.getCollateralAmount().subtract(bounty));
            tx.afterCommit(() -> eventPublisherHelper.publishLoanDefaulted(this, snapshot, keeper, details));
            return snapshot;
        });
    }

    // ========================
    // READS
    // ========================

    /**
     * Current debt (principal + interest + penalty) of an ACTIVE loan, ignoring what has already
     * been repaid. Zero for closed loans: nothing accrues after closure.
     */
    public synchronized BigInteger getDebt(long loanId) {
        Loan loan = requireLoan(loanId);
        if (!loan.isActive()) {
            return BigInteger.ZERO;
        }
        return requireInterestModel()
                .debtWithPenalty(loan.getPrincipal(), loan.getStartTs(), loan.getDueTs(), nowSeconds());
    }

    /** Debt still to be paid: {@code max(0, debt - principalRepaid)}. */
    public synchronized BigInteger getOutstanding(long loanId) {
        Loan loan = requireLoan(loanId);
        if (!loan.isActive()) {
            return BigInteger.ZERO;
        }
        return getDebt(loanId).subtract(loan.getPrincipalRepaid()).max(BigInteger.ZERO);
    }

    public synchronized Loan getLoan(long loanId) {
        return requireLoan(loanId).copy();
    }

    public synchronized Optional<Long> getActiveLoanId(String borrower) {
        return Optional.ofNullable(activeLoanOf.get(borrower));
    }

    public synchronized List<Loan> getLoansOf(String borrower) {
        List<Loan> result = new ArrayList<>();
        for (Loan loan : loans.values()) {
            if (loan.getBorrower().equals(borrower)) {
                result.add(loan.copy());
            }
        }
        return result;
    }

    public synchronized BigInteger getLockedCollateral(String asset) {
        return lockedCollateral.getOrDefault(asset, BigInteger.ZERO);
    }

    public synchronized BigInteger getTotalLockedCollateral() {
        return lockedCollateral.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    public synchronized Map<String, BigInteger> getLockedCollateralByAsset() {
        return Map.copyOf(lockedCollateral);
    }

    /** Ledger custody balance of {@code asset} not backing any ACTIVE loan's collateral. */
    public synchronized BigInteger getFreeLiquidity(String asset) {
        return freeLiquidity(asset);
    }

    public synchronized int getActiveLoanCount() {
        return activeLoanOf.size();
    }

    public synchronized long getNextLoanId() {
        return nextLoanId;
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    public synchronized Optional<RiskPolicy> getRiskPolicy() {
        return Optional.ofNullable(riskPolicy);
    }

    public synchronized Optional<InterestModel> getInterestModel() {
        return Optional.ofNullable(interestModel);
    }

    public synchronized Optional<ReputationHook> getReputationHook() {
        return Optional.ofNullable(reputationHook);
    }

    public LedgerParameters getLedgerParameters() {
        return ledgerParameters;
    }

    // ========================
    // ADMINISTRATION (via LedgerAdminService)
    // ========================

    synchronized void setPaused(boolean paused) {
        this.paused = paused;
    }

    synchronized void setRiskPolicy(RiskPolicy riskPolicy) {
        this.riskPolicy = riskPolicy;
    }

    synchronized void setInterestModel(InterestModel interestModel) {
        this.interestModel = interestModel;
    }

    synchronized void setReputationHook(ReputationHook reputationHook) {
        this.reputationHook = reputationHook;
    }

    /** Applies a configuration change serialized with ledger operations. */
    synchronized void reconfigure(String description, Runnable change) {
        if (entered) {
            throw new ReentrancyException(description);
        }
        change.run();
    }

    // ========================
    // INTERNALS
    // ========================

    private <T> T execute(String operation, Function<LedgerTransaction, T> body) {
        if (paused) {
            throw new StateConflictException(Conflict.LEDGER_PAUSED, "Ledger is paused");
        }
        if (entered) {
            throw new ReentrancyException(operation);
        }
        entered = true;
        LedgerTransaction tx = new LedgerTransaction(operation, assetCustody);
        T result;
        try {
            result = body.apply(tx);
        } catch (RuntimeException e) {
            tx.rollback(e);
            throw e;
        } finally {
            entered = false;
        }
        tx.commit();
        return result;
    }

    private void closeLoan(LedgerTransaction tx, Loan loan, LoanStatus status, long now) {
        loan.setStatus(status);
        loan.setClosedTs(now);
        String borrower = loan.getBorrower();
        long loanId = loan.getId();
        activeLoanOf.remove(borrower);
        tx.onRollback(() -> activeLoanOf.put(borrower, loanId));
        unlock(tx, loan.getCollateralAsset(), loan.getCollateralAmount());
    }

    private void lock(LedgerTransaction tx, String asset, BigInteger amount) {
        adjustLocked(asset, amount);
        tx.onRollback(() -> adjustLocked(asset, amount.negate()));
    }

    private void unlock(LedgerTransaction tx, String asset, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        adjustLocked(asset, amount.negate());
        tx.onRollback(() -> adjustLocked(asset, amount));
    }

    private void adjustLocked(String asset, BigInteger delta) {
        BigInteger updated = lockedCollateral.getOrDefault(asset, BigInteger.ZERO).add(delta);
        if (updated.signum() < 0) {
            throw new IllegalStateException("Locked collateral for " + asset + " would go negative: " + updated);
        }
        if (updated.signum() == 0) {
            lockedCollateral.remove(asset);
        } else {
            lockedCollateral.put(asset, updated);
        }
    }

    private void payTreasury(LedgerTransaction tx, String asset, BigInteger fee) {
        if (fee.signum() == 0) {
            return;
        }
        String treasury = ledgerParameters.getTreasuryAccount();
        if (treasury == null || treasury.isBlank()) {
            throw new DependencyUnavailableException("treasury account");
        }
        tx.move(asset, ledgerParameters.getLedgerAccount(), treasury, fee);
    }

    private BigInteger freeLiquidity(String asset) {
        BigInteger balance = assetCustody.balanceOf(asset, ledgerParameters.getLedgerAccount());
        return balance.subtract(lockedCollateral.getOrDefault(asset, BigInteger.ZERO)).max(BigInteger.ZERO);
    }

    private Loan requireLoan(long loanId) {
        Loan loan = loans.get(loanId);
        if (loan == null) {
            throw new ResourceNotFoundException("Loan", loanId);
        }
        return loan;
    }

    private Loan requireActiveLoan(long loanId) {
        Loan loan = requireLoan(loanId);
        if (!loan.isActive()) {
            throw new StateConflictException(
                    Conflict.LOAN_NOT_ACTIVE, "Loan " + loanId + " is " + loan.getStatus());
        }
        return loan;
    }

    private RiskPolicy requireRiskPolicy() {
        if (riskPolicy == null) {
            throw new DependencyUnavailableException("risk policy");
        }
        return riskPolicy;
    }

    private InterestModel requireInterestModel() {
        if (interestModel == null) {
            throw new DependencyUnavailableException("interest model");
        }
        return interestModel;
    }

    private static long dueTimestamp(long now, long duration) {
        try {
            return Math.addExact(now, duration);
        } catch (ArithmeticException e) {
            throw new InvalidInputException("Duration " + duration + "s overflows the due timestamp");
        }
    }

    /** {@code dueTs + gracePeriod}, saturating at {@link Long#MAX_VALUE}. */
    private long defaultDeadline(Loan loan) {
        long dueTs = loan.getDueTs();
        long grace = ledgerParameters.getGracePeriodSeconds();
        return dueTs > Long.MAX_VALUE - grace ? Long.MAX_VALUE : dueTs + grace;
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " must not be blank");
        }
    }

    private static void requirePositive(BigInteger value, String field) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidInputException(field + " must be positive");
        }
    }
}
