package de.burger.dispatch.variants.ticket;

import de.burger.dispatch.capability.Capability;

import java.util.List;

/** Decides the order in which queued tickets are processed. Returns a new list. */
public interface TicketOrderingStrategy extends Capability<List<SupportTicket>, List<SupportTicket>> {
    List<SupportTicket> createOrdering(List<SupportTicket> tickets);

    @Override
    default List<SupportTicket> perform(List<SupportTicket> tickets) {
        return createOrdering(tickets);
    }
}
