package de.burger.dispatch.variants.ticket;

import de.burger.dispatch.config.Configuration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Shuffles the queue. With option {@value #SEED} every call shuffles with a generator seeded
 * by that value, so equal queues get equal orderings.
 */
public final class RandomOrderingStrategy implements TicketOrderingStrategy {
    public static final String SEED = "seed";

    private final OptionalLong seed;

    public RandomOrderingStrategy() {
        this(Configuration.empty());
    }

    public RandomOrderingStrategy(Configuration configuration) {
        this.seed = configuration.has(SEED)
            ? OptionalLong.of(configuration.getLong(SEED, 0L))
            : OptionalLong.empty();
    }

    @Override
    public List<SupportTicket> createOrdering(List<SupportTicket> tickets) {
        List<SupportTicket> copy = new ArrayList<>(tickets);
        Random random = seed.isPresent() ? new Random(seed.getAsLong()) : new Random();
        Collections.shuffle(copy, random);
        return Collections.unmodifiableList(copy);
    }
}
