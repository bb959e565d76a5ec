package de.burger.dispatch.variants.ticket;

import de.burger.dispatch.registry.TypeRegistry;

public final class TicketOrderings {
    public static final String FIFO = "fifo";
    public static final String FILO = "filo";
    public static final String RANDOM = "random";

    private TicketOrderings() {
    }

    public static TypeRegistry<TicketOrderingStrategy> registry() {
        return new TypeRegistry<TicketOrderingStrategy>()
            .register(FIFO, FifoOrderingStrategy::new)
            .register(FILO, FiloOrderingStrategy::new)
            .register(RANDOM, configuration -> new RandomOrderingStrategy(configuration));
    }
}
