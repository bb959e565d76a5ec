package de.burger.dispatch.variants.trading;

import de.burger.dispatch.config.Configuration;

import java.util.List;

/** Buys below and sells above the mean of the last {@code windowSize} prices. */
public final class AverageTradingStrategy implements TradingStrategy {
    public static final String WINDOW_SIZE = "windowSize";
    public static final int DEFAULT_WINDOW_SIZE = 3;

    private final int windowSize;

    public AverageTradingStrategy() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public AverageTradingStrategy(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    public static AverageTradingStrategy from(Configuration configuration) {
        return new AverageTradingStrategy(configuration.getInt(WINDOW_SIZE, DEFAULT_WINDOW_SIZE));
    }

    public int windowSize() {
        return windowSize;
    }

    @Override
    public boolean shouldBuy(List<Double> prices) {
        return last(prices) < windowMean(prices);
    }

    @Override
    public boolean shouldSell(List<Double> prices) {
        return last(prices) > windowMean(prices);
    }

    private double windowMean(List<Double> prices) {
        List<Double> window = prices.subList(Math.max(0, prices.size() - windowSize), prices.size());
        return window.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    }

    private static double last(List<Double> prices) {
        return prices.get(prices.size() - 1);
    }
}
