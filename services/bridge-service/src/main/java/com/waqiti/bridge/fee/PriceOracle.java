package com.waqiti.bridge.fee;

import com.waqiti.bridge.domain.OraclePrice;

/**
 * External price feed. Implementations may throw on transport failure; the fee calculator
 * treats any failure like stale data.
 */
public interface PriceOracle {

    OraclePrice getPrice(String pair);
}
