package de.burger.dispatch.variants.ticket;

import java.util.List;

/** First in, first out. */
public final class FifoOrderingStrategy implements TicketOrderingStrategy {
    @Override
    public List<SupportTicket> createOrdering(List<SupportTicket> tickets) {
        return List.copyOf(tickets);
    }
}
