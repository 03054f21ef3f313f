package com.repledger.reputation;

/**
 * Credit-score and default-badge storage keyed by account.
 * The ledger only reads from it; writes happen through a {@link ReputationHook}.
 */
public interface ReputationStore {

    int scoreOf(String account);

    void setScore(String account, int score);

    boolean hasBadge(String account);

    void mintBadge(String account);
}
