package de.burger.dispatch.variants.trading;

import de.burger.dispatch.context.StrategyContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/** Runs one trading decision per call against an exchange using the selected strategy. */
public final class TradingBot {
    private static final Logger LOG = LoggerFactory.getLogger(TradingBot.class);
    static final int ORDER_AMOUNT = 10;

    private final Exchange exchange;
    private final StrategyContext<List<Double>, TradeSignal> strategy;

    public TradingBot(Exchange exchange, StrategyContext<List<Double>, TradeSignal> strategy) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public TradeSignal run(String symbol) {
        TradeSignal signal = strategy.execute(exchange.marketData(symbol));
        switch (signal) {
            case BUY -> exchange.buy(symbol, ORDER_AMOUNT);
            case SELL -> exchange.sell(symbol, ORDER_AMOUNT);
            case HOLD -> LOG.info("No action needed for {}.", symbol);
        }
        return signal;
    }
}
