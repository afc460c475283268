package org.pokernight.exception;

public class ConcurrentSettlementException extends SettlementException {

    public ConcurrentSettlementException(String msg) {
        super(ErrorCode.CONCURRENT_SETTLEMENT, msg);
    }

    public ConcurrentSettlementException(String msg, Throwable cause) {
        super(ErrorCode.CONCURRENT_SETTLEMENT, msg, cause);
    }
}
