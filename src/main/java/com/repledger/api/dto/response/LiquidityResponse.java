package com.repledger.api.dto.response;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class LiquidityResponse {

    private final String asset;

    /** Ledger account balance, including escrowed collateral. */
    private final BigInteger balance;

    private final BigInteger lockedCollateral;

    /** Available for new loans. */
    private final BigInteger free;
}
