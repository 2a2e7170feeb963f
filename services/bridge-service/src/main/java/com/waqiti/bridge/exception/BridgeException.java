package com.waqiti.bridge.exception;

import lombok.Getter;

import java.util.Objects;

/**
 * Base exception for bridge failures. Carries a {@link BridgeErrorCode} so callers can branch
 * on the failure class without matching exception types.
 */
@Getter
public class BridgeException extends RuntimeException {

    private final BridgeErrorCode errorCode;

    public BridgeException(BridgeErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public BridgeException(BridgeErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }
}
