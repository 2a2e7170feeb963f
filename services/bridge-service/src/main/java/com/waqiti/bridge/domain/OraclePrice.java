package com.waqiti.bridge.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class OraclePrice {

    String pair;
    BigDecimal price;
    Instant timestamp;
    long round;
}
