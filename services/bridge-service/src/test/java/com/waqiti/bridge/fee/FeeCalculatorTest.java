package com.waqiti.bridge.fee;

import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.ChainConfig;
import com.waqiti.bridge.domain.ChainRole;
import com.waqiti.bridge.domain.FeeQuote;
import com.waqiti.bridge.domain.OraclePrice;
import com.waqiti.bridge.exception.AmountOutOfRangeException;
import com.waqiti.bridge.exception.OracleStaleException;
import com.waqiti.bridge.exception.ValidationException;
import com.waqiti.bridge.support.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FeeCalculator
 *
 * @author Waqiti Platform Team
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("FeeCalculator Tests")
class FeeCalculatorTest {

    private static final String PAIR = "LDAO/USD";
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private PriceOracle oracle;

    private final MutableClock clock = new MutableClock(NOW);
    private BridgeProperties properties;
    private ChainConfig source;

    @BeforeEach
    void setUp() {
        properties = new BridgeProperties();
        source = ChainConfig.builder()
                .chainId("chain-a")
                .role(ChainRole.BIDIRECTIONAL)
                .minAmount(BigDecimal.ONE)
                .maxAmount(new BigDecimal("1000000"))
                .feeBasisPoints(30)
                .confirmationsRequired(12)
                .attestationThreshold(3)
                .priceFeedPair(PAIR)
                .build();
    }

    private FeeCalculator calculator() {
        return new FeeCalculator(properties, oracle, CircuitBreaker.ofDefaults("price-oracle"), clock);
    }

    private OraclePrice price(String value, Instant at) {
        return OraclePrice.builder().pair(PAIR).price(new BigDecimal(value)).timestamp(at).round(42).build();
    }

    @Nested
    @DisplayName("Without fiat bounds")
    class WithoutBounds {

        @Test
        @DisplayName("Should charge base fee plus basis points exactly")
        void shouldComputeCoreFee() {
            FeeCalculator calculator = calculator();

            assertThat(calculator.feeForTransfer(new BigDecimal("500"), source)).isEqualByComparingTo("2.5");
            assertThat(calculator.proportionalFee(new BigDecimal("0.000000000000000001"), source))
                    .isEqualByComparingTo("0.000000000000000000003");
        }

        @Test
        @DisplayName("Should never charge more than the amount")
        void shouldCapAtAmount() {
            assertThat(calculator().feeForTransfer(new BigDecimal("0.5"), source)).isEqualByComparingTo("0.5");
        }

        @Test
        @DisplayName("Should quote without consulting the oracle")
        void shouldQuoteWithoutOracle() {
            FeeQuote quote = calculator().quote(new BigDecimal("1000"), source);

            assertThat(quote.getTotalFee()).isEqualByComparingTo("4");
            assertThat(quote.getNetAmount()).isEqualByComparingTo("996");
            assertThat(quote.isFiatBoundsApplied()).isFalse();
            assertThat(quote.getPriceRound()).isEqualTo(-1);
        }

        @Test
        @DisplayName("Should reject amounts outside the chain's range")
        void shouldRejectOutOfRange() {
            FeeCalculator calculator = calculator();

            assertThrows(AmountOutOfRangeException.class, () -> calculator.quote(new BigDecimal("2000000"), source));
            assertThrows(ValidationException.class, () -> calculator.feeForTransfer(BigDecimal.ZERO, source));
        }
    }

    @Nested
    @DisplayName("With fiat bounds")
    class WithBounds {

        @BeforeEach
        void configureBounds() {
            properties.getFee().setFiatMinimum(new BigDecimal("5"));
            properties.getFee().setFiatMaximum(new BigDecimal("100"));
        }

        @Test
        @DisplayName("Should raise the fee to the fiat minimum")
        void shouldApplyFiatMinimum() {
            when(oracle.getPrice(PAIR)).thenReturn(price("1", NOW));

            FeeQuote quote = calculator().quote(new BigDecimal("500"), source);

            assertThat(quote.getTotalFee()).isEqualByComparingTo("5");
            assertThat(quote.isFiatBoundsApplied()).isTrue();
            assertThat(quote.getPriceRound()).isEqualTo(42);
        }

        @Test
        @DisplayName("Should cap the fee at the fiat maximum")
        void shouldApplyFiatMaximum() {
            when(oracle.getPrice(PAIR)).thenReturn(price("10", NOW));

            assertThat(calculator().feeForTransfer(new BigDecimal("100000"), source)).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Should refuse to quote on a stale price but keep charging the core fee")
        void shouldHandleStalePrice() {
            when(oracle.getPrice(PAIR)).thenReturn(price("1", NOW.minus(Duration.ofHours(2))));
            FeeCalculator calculator = calculator();

            assertThrows(OracleStaleException.class, () -> calculator.quote(new BigDecimal("500"), source));
            assertThat(calculator.feeForTransfer(new BigDecimal("500"), source)).isEqualByComparingTo("2.5");
            assertThat(calculator.isOracleStale(PAIR)).isTrue();
        }

        @Test
        @DisplayName("Should treat an oracle failure like stale data")
        void shouldHandleOracleFailure() {
            when(oracle.getPrice(PAIR)).thenThrow(new IllegalStateException("feed down"));
            FeeCalculator calculator = calculator();

            assertThrows(OracleStaleException.class, () -> calculator.quote(new BigDecimal("500"), source));
            assertThat(calculator.feeForTransfer(new BigDecimal("500"), source)).isEqualByComparingTo("2.5");
        }

        @Test
        @DisplayName("Should accept a price exactly at the staleness cutoff")
        void shouldAcceptPriceAtCutoff() {
            when(oracle.getPrice(PAIR)).thenReturn(price("1", NOW.minus(Duration.ofHours(1))));

            assertThat(calculator().freshPrice(PAIR)).isPresent();
        }

        @Test
        @DisplayName("Should treat a zero or negative price as unusable")
        void shouldRejectNonPositivePrice() {
            when(oracle.getPrice(PAIR)).thenReturn(price("0", NOW), price("-1", NOW));
            FeeCalculator calculator = calculator();

            assertThat(calculator.freshPrice(PAIR)).isEmpty();
            assertThat(calculator.isOracleStale(PAIR)).isTrue();
        }
    }
}
