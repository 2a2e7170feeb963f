package com.waqiti.bridge.fee;

import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.ChainConfig;
import com.waqiti.bridge.domain.FeeQuote;
import com.waqiti.bridge.domain.OraclePrice;
import com.waqiti.bridge.exception.AmountOutOfRangeException;
import com.waqiti.bridge.exception.OracleStaleException;
import com.waqiti.bridge.exception.ValidationException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fee Calculator
 *
 * <p>{@code fee = baseFee + amount * feeBasisPoints / 10000}, computed exactly in
 * {@link BigDecimal}. The oracle price only converts the optional fiat minimum and cap into
 * tokens; it never decides whether a transfer is valid.</p>
 *
 * <p>When the oracle is stale or unreachable, {@link #quote} fails with
 * {@link OracleStaleException} while {@link #feeForTransfer} keeps working on the unclamped
 * core fee, so consensus processing is never blocked by the oracle.</p>
 *
 * @author Waqiti Platform Team
 * @since 1.0.0
 */
@Slf4j
public class FeeCalculator {

    private static final BigDecimal BASIS_POINTS = BigDecimal.valueOf(10_000);
    private static final int TOKEN_SCALE = 18;

    private final BridgeProperties.FeeSettings settings;
    private final PriceOracle oracle;
    private final CircuitBreaker oracleCircuitBreaker;
    private final Clock clock;

    /**
     * @param oracle may be null when no price feed is deployed; fiat bounds are then never applied
     */
    public FeeCalculator(BridgeProperties properties, PriceOracle oracle, CircuitBreaker oracleCircuitBreaker, Clock clock) {
        this.settings = properties.getFee();
        this.oracle = oracle;
        this.oracleCircuitBreaker = oracleCircuitBreaker;
        this.clock = clock;
    }

    public BigDecimal proportionalFee(BigDecimal amount, ChainConfig source) {
        return amount.multiply(BigDecimal.valueOf(source.getFeeBasisPoints())).divide(BASIS_POINTS);
    }

    public BigDecimal coreFee(BigDecimal amount, ChainConfig source) {
        requirePositive(amount);
        return settings.getBaseFee().add(proportionalFee(amount, source));
    }

    /**
     * Fee charged when a transfer is created. Applies fiat bounds only with fresh oracle data.
     */
    public BigDecimal feeForTransfer(BigDecimal amount, ChainConfig source) {
        BigDecimal fee = coreFee(amount, source);
        if (hasFiatBounds() && source.getPriceFeedPair() != null) {
            Optional<OraclePrice> price = freshPrice(source.getPriceFeedPair());
            if (price.isPresent()) {
                fee = applyFiatBounds(fee, price.get().getPrice());
            } else {
                log.warn("Oracle stale, charging unclamped fee: chainId={}, pair={}, fee={}",
                        source.getChainId(), source.getPriceFeedPair(), fee);
            }
        }
        return fee.min(amount);
    }

    /**
     * Fee quote for callers that need the oracle-bounded figure.
     *
     * @throws AmountOutOfRangeException if the amount is outside the source chain's range
     * @throws OracleStaleException if fiat bounds are configured and the price is stale or unavailable
     */
    public FeeQuote quote(BigDecimal amount, ChainConfig source) {
        BigDecimal fee = coreFee(amount, source);
        if (!source.acceptsAmount(amount)) {
            throw new AmountOutOfRangeException(String.format("Amount %s outside [%s, %s] for chain %s",
                    amount, source.getMinAmount(), source.getMaxAmount(), source.getChainId()));
        }
        BigDecimal proportional = proportionalFee(amount, source);
        boolean bounded = false;
        long round = -1;

        if (hasFiatBounds()) {
            String pair = source.getPriceFeedPair();
            if (pair == null) {
                throw new ValidationException("Chain " + source.getChainId() + " has no price feed for fiat fee bounds");
            }
            OraclePrice price = freshPrice(pair)
                    .orElseThrow(() -> new OracleStaleException(pair, lastUpdate(pair),
                            "Price for " + pair + " is older than " + settings.getStalenessCutoff() + " or unavailable"));
            fee = applyFiatBounds(fee, price.getPrice());
            bounded = true;
            round = price.getRound();
        }

        BigDecimal total = fee.min(amount);
        return FeeQuote.builder()
                .sourceChain(source.getChainId())
                .amount(amount)
                .baseFee(settings.getBaseFee())
                .proportionalFee(proportional)
                .totalFee(total)
                .netAmount(amount.subtract(total))
                .fiatBoundsApplied(bounded)
                .priceRound(round)
                .build();
    }

    public boolean isOracleStale(String pair) {
        return freshPrice(pair).isEmpty();
    }

    /**
     * @return the latest price if it is within the staleness cutoff
     */
    public Optional<OraclePrice> freshPrice(String pair) {
        return fetch(pair).filter(price -> {
            Duration age = Duration.between(price.getTimestamp(), clock.instant());
            boolean fresh = age.compareTo(settings.getStalenessCutoff()) <= 0
                    && price.getPrice() != null && price.getPrice().signum() > 0;
            if (!fresh) {
                log.warn("Stale oracle price: pair={}, round={}, age={}", pair, price.getRound(), age);
            }
            return fresh;
        });
    }

    private Optional<OraclePrice> fetch(String pair) {
        if (oracle == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(oracleCircuitBreaker.executeSupplier(() -> oracle.getPrice(pair)));
        } catch (CallNotPermittedException e) {
            log.warn("Oracle circuit open: pair={}", pair);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Oracle unavailable: pair={}, error={}", pair, e.getMessage());
            return Optional.empty();
        }
    }

    private Instant lastUpdate(String pair) {
        return fetch(pair).map(OraclePrice::getTimestamp).orElse(null);
    }

    private BigDecimal applyFiatBounds(BigDecimal fee, BigDecimal price) {
        BigDecimal fiatFee = fee.multiply(price);
        if (settings.getFiatMinimum() != null && fiatFee.compareTo(settings.getFiatMinimum()) < 0) {
            return settings.getFiatMinimum().divide(price, TOKEN_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        }
        if (settings.getFiatMaximum() != null && fiatFee.compareTo(settings.getFiatMaximum()) > 0) {
            return settings.getFiatMaximum().divide(price, TOKEN_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        }
        return fee;
    }

    private boolean hasFiatBounds() {
        return settings.getFiatMinimum() != null || settings.getFiatMaximum() != null;
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
    }
}
