package de.burger.dispatch.variants.ticket;

import java.security.SecureRandom;
import java.util.Objects;

/** A customer issue waiting in the support queue. */
public record SupportTicket(String id, String customer, String issue) {
    private static final String ID_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int ID_LENGTH = 8;
    private static final SecureRandom ID_SOURCE = new SecureRandom();

    public SupportTicket {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(customer, "customer");
        Objects.requireNonNull(issue, "issue");
    }

    /** New ticket with a generated 8-character upper-case alphanumeric id. */
    public static SupportTicket open(String customer, String issue) {
        return new SupportTicket(generateId(), customer, issue);
    }

    static String generateId() {
        StringBuilder sb = new StringBuilder(ID_LENGTH);
        for (int i = 0; i < ID_LENGTH; i++) {
            sb.append(ID_ALPHABET.charAt(ID_SOURCE.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }
}
