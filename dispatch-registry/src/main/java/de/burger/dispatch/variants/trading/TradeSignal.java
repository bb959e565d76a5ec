package de.burger.dispatch.variants.trading;

public enum TradeSignal {
    BUY,
    SELL,
    HOLD
}
