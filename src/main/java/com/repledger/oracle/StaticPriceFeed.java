package com.repledger.oracle;

import com.repledger.domain.model.PriceQuote;
import com.repledger.exception.InvalidInputException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Price feed backed by administrator-set quotes. Pairs are directional:
 * a quote for {@code WETH/USDC} says nothing about {@code USDC/WETH}.
 */
@Component
public class StaticPriceFeed implements PriceFeed {

    private static final Logger log = LoggerFactory.getLogger(StaticPriceFeed.class);

    private final Map<String, PriceQuote> quotes = new ConcurrentHashMap<>();

    @Override
    public Optional<PriceQuote> getPrice(String base, String quote) {
        return Optional.ofNullable(quotes.get(pairKey(base, quote)));
    }

    public void setPrice(String base, String quote, PriceQuote priceQuote) {
        if (base == null || base.isBlank() || quote == null || quote.isBlank()) {
            throw new InvalidInputException("Price pair requires base and quote assets");
        }
        if (priceQuote.decimals() < 0) {
            throw new InvalidInputException("Price decimals must be non-negative");
        }
        PriceQuote previous = quotes.put(pairKey(base, quote), priceQuote);
        log.info("Price {}/{} set: {} -> {}", base, quote, previous, priceQuote);
    }

    public void removePrice(String base, String quote) {
        quotes.remove(pairKey(base, quote));
    }

    private static String pairKey(String base, String quote) {
        return base + "/" + quote;
    }
}
