package org.pokernight.exception;

import lombok.Getter;

/**
 * Net balances do not sum to zero beyond the rounding tolerance.
 * Usually means chips were not fully reconciled before the game ended.
 */
@Getter
public class UnbalancedLedgerException extends SettlementException {

    private final long residueCents;

    public UnbalancedLedgerException(long residueCents, String msg) {
        super(ErrorCode.UNBALANCED_LEDGER, msg);
        this.residueCents = residueCents;
    }
}
