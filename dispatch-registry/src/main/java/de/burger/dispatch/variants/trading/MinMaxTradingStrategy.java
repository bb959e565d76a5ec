package de.burger.dispatch.variants.trading;

import de.burger.dispatch.config.Configuration;

import java.util.List;

/** Buys below a floor price and sells above a ceiling price. */
public final class MinMaxTradingStrategy implements TradingStrategy {
    public static final String MIN_PRICE = "minPrice";
    public static final String MAX_PRICE = "maxPrice";
    public static final double DEFAULT_MIN_PRICE = 32_000.0;
    public static final double DEFAULT_MAX_PRICE = 33_000.0;

    private final double minPrice;
    private final double maxPrice;

    public MinMaxTradingStrategy() {
        this(DEFAULT_MIN_PRICE, DEFAULT_MAX_PRICE);
    }

    public MinMaxTradingStrategy(double minPrice, double maxPrice) {
        if (minPrice > maxPrice) {
            throw new IllegalArgumentException("minPrice " + minPrice + " exceeds maxPrice " + maxPrice);
        }
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
    }

    public static MinMaxTradingStrategy from(Configuration configuration) {
        return new MinMaxTradingStrategy(
            configuration.getDouble(MIN_PRICE, DEFAULT_MIN_PRICE),
            configuration.getDouble(MAX_PRICE, DEFAULT_MAX_PRICE));
    }

    @Override
    public boolean shouldBuy(List<Double> prices) {
        return prices.get(prices.size() - 1) < minPrice;
    }

    @Override
    public boolean shouldSell(List<Double> prices) {
        return prices.get(prices.size() - 1) > maxPrice;
    }
}
