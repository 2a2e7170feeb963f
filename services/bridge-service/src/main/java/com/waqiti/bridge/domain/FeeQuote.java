package com.waqiti.bridge.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class FeeQuote {

    String sourceChain;
    BigDecimal amount;
    BigDecimal baseFee;
    BigDecimal proportionalFee;

    /**
     * Fee after fiat minimum/cap, never above {@link #amount}.
     */
    BigDecimal totalFee;

    BigDecimal netAmount;

    /**
     * Whether oracle-derived fiat bounds were applied.
     */
    boolean fiatBoundsApplied;

    /**
     * Oracle round the fiat bounds were derived from, or -1.
     */
    long priceRound;
}
