package org.pokernight.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    PARAM_ERROR(400, "Invalid request", HttpStatus.BAD_REQUEST),
    SYSTEM_ERROR(500, "Internal error", HttpStatus.INTERNAL_SERVER_ERROR),

    // settlement computation 1000+
    INVALID_RECORD(1001, "Cannot settle: check buy-ins and cash-outs", HttpStatus.BAD_REQUEST),
    UNBALANCED_LEDGER(1002, "Cannot settle: buy-ins and cash-outs do not balance", HttpStatus.UNPROCESSABLE_ENTITY),

    // concurrency 1100+
    CONCURRENT_SETTLEMENT(1101, "Settlement could not be completed, please retry", HttpStatus.CONFLICT),

    // ledger 1200+
    GAME_NOT_FOUND(1201, "No settlement exists for this game", HttpStatus.NOT_FOUND),
    LEDGER_ENTRY_NOT_FOUND(1202, "Ledger entry not found", HttpStatus.NOT_FOUND),
    NOT_A_PARTY(1203, "Only the payer or the payee can update this payment", HttpStatus.FORBIDDEN);

    private final int code;
    private final String msg;
    private final HttpStatus httpStatus;
}
