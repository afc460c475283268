package org.pokernight.model.settlement.rules;

import org.junit.jupiter.api.Test;
import org.pokernight.exception.UnbalancedLedgerException;
import org.pokernight.model.settlement.NetBalance;
import org.pokernight.model.settlement.Transfer;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DebtMinimizerTest {

    private static NetBalance nb(String userId, long amount) {
        return new NetBalance(userId, amount);
    }

    // received - paid, per user
    private static Map<String, Long> applied(List<Transfer> transfers) {
        Map<String, Long> net = new HashMap<>();
        for (Transfer t : transfers) {
            net.merge(t.toUser(), t.amount(), Long::sum);
            net.merge(t.fromUser(), -t.amount(), Long::sum);
        }
        return net;
    }

    private static List<NetBalance> randomZeroSum(Random rnd, int players) {
        List<NetBalance> balances = new ArrayList<>();
        long sum = 0;
        for (int i = 0; i < players - 1; i++) {
            long amount = rnd.nextInt(100_001) - 50_000;
            if (rnd.nextInt(6) == 0) amount = 0;
            balances.add(nb("p" + i, amount));
            sum += amount;
        }
        balances.add(nb("p" + (players - 1), -sum));
        return balances;
    }

    @Test
    void minimize_oneCreditorTwoDebtors() {
        List<Transfer> result = DebtMinimizer.minimize(List.of(
                nb("A", 1500), nb("B", -1000), nb("C", -500)));

        assertThat(result).containsExactly(
                new Transfer("B", "A", 1000),
                new Transfer("C", "A", 500));
    }

    @Test
    void minimize_twoCreditorsTwoDebtors() {
        List<Transfer> result = DebtMinimizer.minimize(List.of(
                nb("A", 2000), nb("B", 500), nb("C", -1500), nb("D", -1000)));

        assertThat(result).containsExactly(
                new Transfer("C", "A", 1500),
                new Transfer("D", "A", 500),
                new Transfer("D", "B", 500));
    }

    @Test
    void minimize_allBreakEven_returnsNoPayments() {
        assertThat(DebtMinimizer.minimize(List.of(nb("A", 0), nb("B", 0)))).isEmpty();
        assertThat(DebtMinimizer.minimize(List.of())).isEmpty();
    }

    @Test
    void minimize_zeroBalancesNeverAppearInPayments() {
        List<Transfer> result = DebtMinimizer.minimize(List.of(
                nb("A", 700), nb("Z", 0), nb("B", -700)));

        assertThat(result).containsExactly(new Transfer("B", "A", 700));
    }

    @Test
    void minimize_sameInputInAnyOrder_givesIdenticalList() {
        List<NetBalance> balances = new ArrayList<>(List.of(
                nb("dave", 1200), nb("erin", 1200), nb("carl", -800),
                nb("bea", -800), nb("ann", -800), nb("fay", 0)));
        List<Transfer> expected = DebtMinimizer.minimize(balances);

        Random rnd = new Random(42);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(balances, rnd);
            assertThat(DebtMinimizer.minimize(balances)).isEqualTo(expected);
        }
    }

    @Test
    void minimize_equalMagnitudes_breakTiesByUserId() {
        List<Transfer> result = DebtMinimizer.minimize(List.of(
                nb("zed", 500), nb("amy", 500), nb("max", -500), nb("bob", -500)));

        assertThat(result).containsExactly(
                new Transfer("bob", "amy", 500),
                new Transfer("max", "zed", 500));
    }

    @Test
    void minimize_randomLedgers_conserveBalancesWithinNMinusOnePayments() {
        Random rnd = new Random(7);
        for (int round = 0; round < 200; round++) {
            List<NetBalance> balances = randomZeroSum(rnd, 2 + rnd.nextInt(12));
            List<Transfer> transfers = DebtMinimizer.minimize(balances);

            Map<String, Long> net = applied(transfers);
            for (NetBalance b : balances) {
                assertThat(net.getOrDefault(b.userId(), 0L)).isEqualTo(b.amount());
            }

            long nonZero = balances.stream().filter(b -> b.amount() != 0).count();
            assertThat((long) transfers.size()).isLessThanOrEqualTo(Math.max(0, nonZero - 1));
            assertThat(transfers).allSatisfy(t -> assertThat(t.amount()).isPositive());
        }
    }

    @Test
    void minimize_paysOnlyFromDebtorsToCreditors() {
        List<NetBalance> balances = List.of(nb("a", 3000), nb("b", -2500), nb("c", 1000), nb("d", -1500));
        List<Transfer> transfers = DebtMinimizer.minimize(balances);

        assertThat(transfers).allSatisfy(t -> {
            assertThat(t.fromUser()).isIn("b", "d");
            assertThat(t.toUser()).isIn("a", "c");
        });
    }

    @Test
    void minimize_unbalancedInput_throws() {
        assertThatThrownBy(() -> DebtMinimizer.minimize(List.of(nb("A", 100), nb("B", -90))))
                .isInstanceOf(UnbalancedLedgerException.class);
    }
}
