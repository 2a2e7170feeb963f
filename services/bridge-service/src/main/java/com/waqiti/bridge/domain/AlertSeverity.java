package com.waqiti.bridge.domain;

public enum AlertSeverity {
    INFO,
    WARNING,
    HIGH,
    CRITICAL
}
