package de.burger.dispatch.variants.trading;

import java.util.List;

/** Market the trading bot reads prices from and places orders on. */
public interface Exchange {
    /** Price history for {@code symbol}, most recent price last. */
    List<Double> marketData(String symbol);

    void buy(String symbol, int amount);

    void sell(String symbol, int amount);
}
