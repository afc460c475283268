package org.pokernight.model.settlement.rules;

import org.pokernight.exception.UnbalancedLedgerException;
import org.pokernight.model.settlement.NetBalance;
import org.pokernight.model.settlement.Transfer;

import java.util.*;

/**
 * Greedy largest-pair matching of debtors against creditors.
 *
 * <p>Each round pays the largest remaining debt towards the largest remaining credit,
 * so every round zeroes at least one player and the result has at most {@code n - 1}
 * transfers for {@code n} players with a nonzero balance. This is not always the
 * smallest possible number of transfers once four or more players are involved.
 *
 * <p>Queues are ordered by remaining magnitude, then by user id, so the output does
 * not depend on the order of the input.
 */
public final class DebtMinimizer {
    private DebtMinimizer(){}

    private static final Comparator<Remaining> LARGEST_FIRST =
            Comparator.comparingLong((Remaining r) -> r.amount).reversed()
                    .thenComparing(r -> r.userId);

    // amount is always the positive magnitude still to be paid or received
    private static final class Remaining {
        private final String userId;
        private long amount;

        private Remaining(String userId, long amount) {
            this.userId = userId;
            this.amount = amount;
        }
    }

    public static List<Transfer> minimize(List<NetBalance> balances) {
        if (balances == null || balances.isEmpty()) return List.of();

        PriorityQueue<Remaining> creditors = new PriorityQueue<>(LARGEST_FIRST);
        PriorityQueue<Remaining> debtors = new PriorityQueue<>(LARGEST_FIRST);
        long sum = 0;
        for (NetBalance b : balances) {
            sum = Math.addExact(sum, b.amount());
            if (b.amount() > 0) creditors.add(new Remaining(b.userId(), b.amount()));
            else if (b.amount() < 0) debtors.add(new Remaining(b.userId(), -b.amount()));
        }
        if (sum != 0) {
            throw new UnbalancedLedgerException(sum, "Balances must sum to zero, got " + sum + " cents");
        }

        List<Transfer> transfers = new ArrayList<>();
        while (!creditors.isEmpty() && !debtors.isEmpty()) {
            Remaining creditor = creditors.poll();
            Remaining debtor = debtors.poll();

            long amount = Math.min(creditor.amount, debtor.amount);
            transfers.add(new Transfer(debtor.userId, creditor.userId, amount));

            creditor.amount -= amount;
            debtor.amount -= amount;
            if (creditor.amount > 0) creditors.add(creditor);
            if (debtor.amount > 0) debtors.add(debtor);
        }
        return transfers;
    }
}
