package de.burger.dispatch.variants.ticket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** First in, last out. */
public final class FiloOrderingStrategy implements TicketOrderingStrategy {
    @Override
    public List<SupportTicket> createOrdering(List<SupportTicket> tickets) {
        List<SupportTicket> copy = new ArrayList<>(tickets);
        Collections.reverse(copy);
        return Collections.unmodifiableList(copy);
    }
}
