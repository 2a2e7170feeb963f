package com.waqiti.bridge.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Structured alert consumed by the external alerting sink.
 */
@Value
@Builder
public class AlertTriggered {

    String alertId;
    AlertType type;
    AlertSeverity severity;
    String transferId;
    String validatorId;
    String chainId;
    BigDecimal amount;
    String description;
    Instant timestamp;
}
