package com.waqiti.bridge.chain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Governance change to a chain's parameters. Null fields keep their current value.
 */
@Value
@Builder
public class ThresholdUpdate {

    Integer attestationThreshold;
    Integer confirmationsRequired;
    BigDecimal minAmount;
    BigDecimal maxAmount;
    Integer feeBasisPoints;
}
