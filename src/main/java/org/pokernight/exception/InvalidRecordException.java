package org.pokernight.exception;

/**
 * A player record holds a value that cannot describe a real game
 * (negative money, missing cash-out, missing or repeated player).
 */
public class InvalidRecordException extends SettlementException {

    public InvalidRecordException(String msg) {
        super(ErrorCode.INVALID_RECORD, msg);
    }

    public InvalidRecordException(String msg, Throwable cause) {
        super(ErrorCode.INVALID_RECORD, msg, cause);
    }
}
