package com.repledger.reputation;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-local reputation store. Scores default to 0 and badges, once minted, are never removed.
 */
@Component
public class InMemoryReputationStore implements ReputationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReputationStore.class);

    private final Map<String, Integer> scores = new ConcurrentHashMap<>();
    private final Set<String> badges = ConcurrentHashMap.newKeySet();

    @Override
    public int scoreOf(String account) {
        return scores.getOrDefault(account, 0);
    }

    @Override
    public void setScore(String account, int score) {
        Integer previous = scores.put(account, score);
        log.debug("Score for {} set: {} -> {}", account, previous, score);
    }

    @Override
    public boolean hasBadge(String account) {
        return badges.contains(account);
    }

    @Override
    public void mintBadge(String account) {
        if (badges.add(account)) {
            log.info("Default badge minted for {}", account);
        }
    }
}
