package org.pokernight.model.settlement;

/** One payment the debt minimizer asks a debtor to make to a creditor, in cents. */
public record Transfer(String fromUser, String toUser, long amount) {
}
