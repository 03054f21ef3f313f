package com.repledger.domain.model;

import java.math.BigInteger;

/**
 * Price of one unit of a base asset in units of a quote asset, scaled by {@code 10^decimals}.
 */
public record PriceQuote(BigInteger price, int decimals) {

    public BigInteger scale() {
        return BigInteger.TEN.pow(decimals);
    }
}
