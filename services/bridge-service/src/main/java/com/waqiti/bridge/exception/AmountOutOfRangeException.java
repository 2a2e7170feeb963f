package com.waqiti.bridge.exception;

public class AmountOutOfRangeException extends BridgeException {
    public AmountOutOfRangeException(String message) {
        super(BridgeErrorCode.AMOUNT_OUT_OF_RANGE, message);
    }

    public AmountOutOfRangeException(String message, Throwable cause) {
        super(BridgeErrorCode.AMOUNT_OUT_OF_RANGE, message, cause);
    }
}
