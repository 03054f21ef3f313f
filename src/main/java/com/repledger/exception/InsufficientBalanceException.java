package com.repledger.exception;

import java.math.BigInteger;
import java.util.Map;

public class InsufficientBalanceException extends BusinessException {

    public InsufficientBalanceException(String asset, String owner, BigInteger requested, BigInteger balance) {
        super(
                ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Insufficient %s balance for %s: requested %s, balance %s", asset, owner, requested, balance),
                Map.of("asset", asset, "owner", owner, "requested", requested, "balance", balance));
    }
}
