package com.waqiti.bridge.monitoring;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class BridgeHealthReport {

    boolean healthy;

    @Singular
    List<String> issues;

    /**
     * chainId to whether its watch loop reached the ledger on the last poll
     */
    @Singular("chainStatus")
    Map<String, Boolean> chainStatuses;

    int eligibleValidators;

    @Singular
    List<String> stuckTransfers;

    boolean paused;

    Instant checkedAt;
}
