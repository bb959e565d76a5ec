package de.burger.dispatch.variants.ticket;

import de.burger.dispatch.context.StrategyContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Support desk whose processing order is decided by a swappable ordering strategy. */
public final class CustomerSupport {
    private static final Logger LOG = LoggerFactory.getLogger(CustomerSupport.class);

    private final List<SupportTicket> tickets = new ArrayList<>();
    private final StrategyContext<List<SupportTicket>, List<SupportTicket>> ordering;

    public CustomerSupport(StrategyContext<List<SupportTicket>, List<SupportTicket>> ordering) {
        this.ordering = Objects.requireNonNull(ordering, "ordering");
    }

    public SupportTicket createTicket(String customer, String issue) {
        SupportTicket ticket = SupportTicket.open(customer, issue);
        tickets.add(ticket);
        return ticket;
    }

    public List<SupportTicket> tickets() {
        return List.copyOf(tickets);
    }

    /** Processes every queued ticket in the order chosen by the current strategy, then empties the queue. */
    public List<SupportTicket> processTickets() {
        List<SupportTicket> ordered = ordering.execute(List.copyOf(tickets));
        if (ordered.isEmpty()) {
            LOG.info("There are no tickets to process, well done!");
            return List.of();
        }
        ordered.forEach(this::processTicket);
        tickets.clear();
        return ordered;
    }

    private void processTicket(SupportTicket ticket) {
        LOG.info("Processing ticket id={} customer={} issue={}", ticket.id(), ticket.customer(), ticket.issue());
    }
}
