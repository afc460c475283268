package org.pokernight.exception;

import lombok.Getter;

@Getter
public class SettlementException extends RuntimeException {

    private final ErrorCode errorCode;

    public SettlementException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.errorCode = errorCode;
    }

    public SettlementException(ErrorCode errorCode, String msg) {
        super(msg);
        this.errorCode = errorCode;
    }

    public SettlementException(ErrorCode errorCode, String msg, Throwable cause) {
        super(msg, cause);
        this.errorCode = errorCode;
    }
}
