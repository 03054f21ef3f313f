package com.repledger.reputation;

import com.repledger.exception.DependencyUnavailableException;
import java.math.BigInteger;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reputation hook that turns loan outcomes into score and badge updates.
 *
 * <ul>
 *   <li>Full repayment: score += {@code scoreIncrement}, capped at {@code maxScore}</li>
 *   <li>Partial repayment and opening: no reputation effect</li>
 *   <li>Default: mints the default badge</li>
 * </ul>
 *
 * <p>In strict mode a missing store raises {@link DependencyUnavailableException}, which aborts the
 * ledger operation that triggered the callback. Otherwise the update is skipped with a warning.
 */
public class ScoreReputationHook implements ReputationHook {

    private static final Logger log = LoggerFactory.getLogger(ScoreReputationHook.class);

    private final Optional<ReputationStore> reputationStore;
    private final int scoreIncrement;
    private final int maxScore;
    private final boolean strict;

    public ScoreReputationHook(
            Optional<ReputationStore> reputationStore, int scoreIncrement, int maxScore, boolean strict) {
        this.reputationStore = reputationStore;
        this.scoreIncrement = scoreIncrement;
        this.maxScore = maxScore;
        this.strict = strict;
    }

    @Override
    public void onLoanOpened(long loanId, String borrower) {
        log.debug("Loan {} opened by {}", loanId, borrower);
    }

    @Override
    public void onLoanRepaid(
            long loanId,
            String borrower,
            BigInteger paidAmount,
            BigInteger totalRepaid,
            BigInteger totalDebt,
            boolean fullyRepaid) {
        if (!fullyRepaid) {
            log.debug("Loan {} partial repayment {} ({} of {})", loanId, paidAmount, totalRepaid, totalDebt);
            return;
        }
        Optional<ReputationStore> store = requireStore("onLoanRepaid");
        if (store.isEmpty()) {
            return;
        }
        int current = store.get().scoreOf(borrower);
        int updated = (int) Math.min((long) current + scoreIncrement, maxScore);
        if (updated != current) {
            store.get().setScore(borrower, updated);
        }
        log.info("Loan {} repaid in full by {}: score {} -> {}", loanId, borrower, current, updated);
    }

    @Override
    public void onLoanDefaulted(long loanId, String borrower) {
        Optional<ReputationStore> store = requireStore("onLoanDefaulted");
        if (store.isEmpty()) {
            return;
        }
        store.get().mintBadge(borrower);
        log.warn("Loan {} defaulted: badge recorded for {}", loanId, borrower);
    }

    private Optional<ReputationStore> requireStore(String callback) {
        if (reputationStore.isEmpty()) {
            if (strict) {
                throw new DependencyUnavailableException("reputation store");
            }
            log.warn("No reputation store configured; {} skipped", callback);
        }
        return reputationStore;
    }
}
