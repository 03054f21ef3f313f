package com.repledger.custody;

import com.repledger.exception.InsufficientBalanceException;
import com.repledger.exception.InvalidInputException;
import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-local custody: one balance per (asset, owner), kept in a ConcurrentHashMap.
 * Zero-amount movements are no-ops; negative amounts are rejected.
 */
@Component
public class InMemoryAssetCustody implements AssetCustody {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAssetCustody.class);

    private final Map<String, Map<String, BigInteger>> balances = new ConcurrentHashMap<>();

    @Override
    public void debit(String asset, String owner, BigInteger amount) {
        requireNonNegative(amount);
        if (amount.signum() == 0) {
            return;
        }
        balancesOf(asset).compute(owner, (key, current) -> {
            BigInteger balance = current != null ? current : BigInteger.ZERO;
            if (balance.compareTo(amount) < 0) {
                throw new InsufficientBalanceException(asset, owner, amount, balance);
            }
            return balance.subtract(amount);
        });
        log.debug("Debited {} {} from {}", amount, asset, owner);
    }

    @Override
    public void credit(String asset, String owner, BigInteger amount) {
        requireNonNegative(amount);
        if (amount.signum() == 0) {
            return;
        }
        balancesOf(asset).merge(owner, amount, BigInteger::add);
        log.debug("Credited {} {} to {}", amount, asset, owner);
    }

    @Override
    public BigInteger balanceOf(String asset, String owner) {
        Map<String, BigInteger> assetBalances = balances.get(asset);
        return assetBalances != null ? assetBalances.getOrDefault(owner, BigInteger.ZERO) : BigInteger.ZERO;
    }

    /** Creates new units out of thin air. Funding path for liquidity providers and tests. */
    public void mint(String asset, String owner, BigInteger amount) {
        credit(asset, owner, amount);
        log.info("Minted {} {} to {}", amount, asset, owner);
    }

    private Map<String, BigInteger> balancesOf(String asset) {
        if (asset == null || asset.isBlank()) {
            throw new InvalidInputException("Asset must not be blank");
        }
        return balances.computeIfAbsent(asset, key -> new ConcurrentHashMap<>());
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new InvalidInputException("Amount must be non-negative: " + amount);
        }
    }
}
