package com.repledger.oracle;

import com.repledger.domain.model.PriceQuote;
import java.util.Optional;

public interface PriceFeed {

    /**
     * Price of one unit of {@code base} expressed in {@code quote}.
     * Empty when the pair is not quoted.
     */
    Optional<PriceQuote> getPrice(String base, String quote);
}
