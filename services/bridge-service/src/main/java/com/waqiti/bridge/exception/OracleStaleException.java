package com.waqiti.bridge.exception;

import lombok.Getter;

import java.time.Instant;

@Getter
public class OracleStaleException extends BridgeException {

    private final String pair;
    private final Instant lastUpdate;

    public OracleStaleException(String pair, Instant lastUpdate, String message) {
        super(BridgeErrorCode.ORACLE_STALE, message);
        this.pair = pair;
        this.lastUpdate = lastUpdate;
    }

    public OracleStaleException(String pair, String message, Throwable cause) {
        super(BridgeErrorCode.ORACLE_STALE, message, cause);
        this.pair = pair;
        this.lastUpdate = null;
    }
}
