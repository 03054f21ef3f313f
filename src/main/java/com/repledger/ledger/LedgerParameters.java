package com.repledger.ledger;

import com.repledger.exception.InvalidInputException;
import lombok.Builder;
import lombok.Data;

/**
 * Ledger-wide configuration: accounts, duration window, grace period and fee rates.
 *
 * <p>Loaded from application.properties (repledger.ledger.*) on startup. Runtime changes go
 * through {@link LedgerAdminService} so they are serialized with ledger operations and recorded
 * in the parameter history. All rates are basis points of the amount they apply to.
 *
 * <p>The static checks below back both {@link #validate()}, run by the startup bean factory,
 * and the admin setters.
 */
@Data
@Builder
public class LedgerParameters {

    /** Custody account holding liquidity and escrowed collateral. */
    private String ledgerAccount;

    /** Receives origination and protocol fees. */
    private String treasuryAccount;

    private long minDurationSeconds;
    private long maxDurationSeconds;

    /** Extra time after the due date before a loan may be marked defaulted. */
    private long gracePeriodSeconds;

    /** Withheld from the disbursement at origination. */
    private int originationFeeBps;

    /** Share of the interest portion routed to the treasury at full repayment. */
    private int protocolFeeBps;

    /** Share of the escrowed collateral paid to whoever marks a loan defaulted. */
    private int defaultBountyBps;

    /** Throws {@link InvalidInputException} on the first invalid field. */
    public void validate() {
        if (ledgerAccount == null || ledgerAccount.isBlank()) {
            throw new InvalidInputException("Ledger account must not be blank");
        }
        requireDurationWindow(minDurationSeconds, maxDurationSeconds);
        requireGracePeriod(gracePeriodSeconds);
        requireBps("originationFeeBps", originationFeeBps);
        requireBps("protocolFeeBps", protocolFeeBps);
        requireBps("defaultBountyBps", defaultBountyBps);
    }

    public static void requireBps(String name, int bps) {
        if (bps < 0 || bps > 10_000) {
            throw new InvalidInputException(name + " must be within [0, 10000]: " + bps);
        }
    }

    public static void requireDurationWindow(long minSeconds, long maxSeconds) {
        if (minSeconds <= 0 || maxSeconds < minSeconds) {
            throw new InvalidInputException("Invalid duration window [" + minSeconds + ", " + maxSeconds + "]");
        }
    }

    public static void requireGracePeriod(long seconds) {
        if (seconds < 0) {
            throw new InvalidInputException("Grace period must be non-negative");
        }
    }
}
