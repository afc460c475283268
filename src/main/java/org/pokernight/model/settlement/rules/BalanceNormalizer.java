package org.pokernight.model.settlement.rules;

import lombok.extern.slf4j.Slf4j;
import org.pokernight.exception.InvalidRecordException;
import org.pokernight.exception.UnbalancedLedgerException;
import org.pokernight.model.settlement.NetBalance;
import org.pokernight.model.settlement.PlayerRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

/**
 * Turns raw buy-in/cash-out records into integer-cent net balances that sum to exactly zero.
 */
@Slf4j
public final class BalanceNormalizer {
    private BalanceNormalizer(){}

    /**
     * @param records                  one record per player of the game
     * @param tolerancePerPlayerCents  rounding residue accepted per player
     * @return balances in input order, summing to zero
     * @throws InvalidRecordException     negative money, missing cash-out, blank or repeated user id,
     *                                    or amounts beyond the range of a cent count
     * @throws UnbalancedLedgerException  residue larger than {@code tolerancePerPlayerCents * players}
     */
    public static List<NetBalance> normalize(List<PlayerRecord> records, long tolerancePerPlayerCents) {
        if (records == null || records.isEmpty()) return List.of();
        validate(records);

        List<NetBalance> balances = new ArrayList<>(records.size());
        long sum = 0;
        for (PlayerRecord r : records) {
            long amount;
            try {
                amount = Math.subtractExact(toCents(r.cashOut()), toCents(r.totalBuyIn()));
                sum = Math.addExact(sum, amount);
            } catch (ArithmeticException e) {
                throw new InvalidRecordException("Player " + r.userId() + " has an amount too large to settle", e);
            }
            balances.add(new NetBalance(r.userId(), amount));
        }
        if (sum == 0) return balances;

        long bound = tolerancePerPlayerCents * balances.size();
        if (Math.abs(sum) > bound) {
            throw new UnbalancedLedgerException(sum,
                    "Net balances are off by " + sum + " cents (tolerance " + bound + " cents)");
        }

        int target = largestMagnitude(balances);
        NetBalance adjusted = balances.get(target);
        balances.set(target, adjusted.withAmount(adjusted.amount() - sum));
        log.debug("Absorbed rounding residue of {} cents into balance of {}", sum, adjusted.userId());
        return balances;
    }

    /**
     * Rounds to the nearest cent, half to even. Null counts as zero.
     * @throws ArithmeticException if the cent count does not fit in a long
     */
    static long toCents(BigDecimal money) {
        if (money == null) return 0L;
        return money.setScale(2, RoundingMode.HALF_EVEN).movePointRight(2).longValueExact();
    }

    private static void validate(List<PlayerRecord> records) {
        Set<String> seen = new HashSet<>();
        List<String> notCashedOut = new ArrayList<>();
        for (PlayerRecord r : records) {
            if (r == null || r.userId() == null || r.userId().isBlank()) {
                throw new InvalidRecordException("Every player record needs a user id");
            }
            if (!seen.add(r.userId())) {
                throw new InvalidRecordException("Player " + r.userId() + " appears more than once");
            }
            if (isNegative(r.totalBuyIn())) {
                throw new InvalidRecordException("Player " + r.userId() + " has a negative buy-in");
            }
            if (isNegative(r.cashOut())) {
                throw new InvalidRecordException("Player " + r.userId() + " has a negative cash-out");
            }
            if (r.cashOut() == null && r.totalBuyIn() != null && r.totalBuyIn().signum() > 0) {
                notCashedOut.add(r.userId());
            }
        }
        if (!notCashedOut.isEmpty()) {
            throw new InvalidRecordException("Players have not cashed out: " + String.join(", ", notCashedOut));
        }
    }

    private static boolean isNegative(BigDecimal money) {
        return money != null && money.signum() < 0;
    }

    // largest |amount|, ties to the smallest user id
    private static int largestMagnitude(List<NetBalance> balances) {
        int best = 0;
        for (int i = 1; i < balances.size(); i++) {
            NetBalance b = balances.get(i);
            NetBalance current = balances.get(best);
            int cmp = Long.compare(Math.abs(b.amount()), Math.abs(current.amount()));
            if (cmp > 0 || (cmp == 0 && b.userId().compareTo(current.userId()) < 0)) {
                best = i;
            }
        }
        return best;
    }
}
