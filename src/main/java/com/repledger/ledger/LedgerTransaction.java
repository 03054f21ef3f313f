package com.repledger.ledger;

import com.repledger.custody.AssetCustody;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undo log for a single ledger operation.
 *
 * <p>Every state change and every custody movement registers its compensating action before the
 * operation continues. If the operation fails, {@link #rollback(RuntimeException)} replays the
 * compensations newest-first, leaving ledger state and custody balances as they were before the
 * call. Work that must only happen once the operation has committed (event publication) is
 * queued with {@link #afterCommit(Runnable)}.
 */
class LedgerTransaction {

    private static final Logger log = LoggerFactory.getLogger(LedgerTransaction.class);

    private final String operation;
    private final AssetCustody custody;
    private final Deque<Runnable> compensations = new ArrayDeque<>();
    private final List<Runnable> afterCommit = new ArrayList<>();

    LedgerTransaction(String operation, AssetCustody custody) {
        this.operation = operation;
        this.custody = custody;
    }

    void onRollback(Runnable compensation) {
        compensations.push(compensation);
    }

    void afterCommit(Runnable action) {
        afterCommit.add(action);
    }

    /**
     * Moves {@code amount} of {@code asset} from one custody account to another.
     * A half-done move (debit succeeded, credit failed) is undone before the failure propagates.
     */
    void move(String asset, String from, String to, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        custody.debit(asset, from, amount);
        try {
            custody.credit(asset, to, amount);
        } catch (RuntimeException e) {
            custody.credit(asset, from, amount);
            throw e;
        }
        onRollback(() -> {
            custody.debit(asset, to, amount);
            custody.credit(asset, from, amount);
        });
    }

    /**
     * Replays compensations newest-first. A failing compensation is logged and attached to
     * {@code cause} as suppressed; the remaining compensations still run.
     */
    void rollback(RuntimeException cause) {
        log.warn("Rolling back {} ({} steps): {}", operation, compensations.size(), cause.getMessage());
        while (!compensations.isEmpty()) {
            Runnable compensation = compensations.pop();
            try {
                compensation.run();
            } catch (RuntimeException e) {
                log.error("Compensation step failed during rollback of {}", operation, e);
                cause.addSuppressed(e);
            }
        }
        afterCommit.clear();
    }

    void commit() {
        compensations.clear();
        for (Runnable action : afterCommit) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("Post-commit action failed for {}", operation, e);
            }
        }
        afterCommit.clear();
    }
}
