package de.burger.dispatch.variants.trading;

import de.burger.dispatch.capability.Capability;

import java.util.List;

/**
 * Decides whether to buy or sell given the price history, most recent price last.
 * A buy decision wins over a sell decision.
 */
public interface TradingStrategy extends Capability<List<Double>, TradeSignal> {
    boolean shouldBuy(List<Double> prices);

    boolean shouldSell(List<Double> prices);

    @Override
    default TradeSignal perform(List<Double> prices) {
        if (prices == null || prices.isEmpty()) {
            throw new IllegalArgumentException("Price history must not be empty");
        }
        if (shouldBuy(prices)) {
            return TradeSignal.BUY;
        }
        if (shouldSell(prices)) {
            return TradeSignal.SELL;
        }
        return TradeSignal.HOLD;
    }
}
