package com.repledger.exception;

import java.math.BigInteger;
import java.util.Map;

public class InsufficientLiquidityException extends BusinessException {

    public InsufficientLiquidityException(String asset, BigInteger requested, BigInteger available) {
        super(
                ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Insufficient free liquidity in %s: requested %s, available %s", asset, requested, available),
                Map.of("asset", asset, "requested", requested, "available", available));
    }
}
