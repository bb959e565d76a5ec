package de.burger.dispatch.variants.trading;

import de.burger.dispatch.registry.TypeRegistry;

public final class TradingStrategies {
    public static final String AVERAGE = "average";
    public static final String MIN_MAX = "minmax";

    private TradingStrategies() {
    }

    public static TypeRegistry<TradingStrategy> registry() {
        return new TypeRegistry<TradingStrategy>()
            .register(AVERAGE, AverageTradingStrategy::from)
            .register(MIN_MAX, MinMaxTradingStrategy::from);
    }
}
