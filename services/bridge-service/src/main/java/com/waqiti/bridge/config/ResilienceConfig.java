package com.waqiti.bridge.config;

import com.waqiti.bridge.exception.LedgerRpcException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j Configuration
 *
 * <p>Retry Strategy for ledger submissions:</p>
 * <ul>
 *   <li>Exponential backoff for transient RPC failures</li>
 *   <li>Bounded attempts, after which the transfer is escalated to an operator</li>
 *   <li>Only {@link LedgerRpcException} is retried</li>
 * </ul>
 *
 * <p>Circuit Breaker Strategy for the price oracle:</p>
 * <ul>
 *   <li>Fails fast while the oracle is unhealthy, so fee quoting falls back to stale handling</li>
 *   <li>Recovers automatically through the half-open state</li>
 * </ul>
 *
 * @author Waqiti Platform Team
 * @since 1.0.0
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String CHAIN_SUBMISSION = "chain-submission";

    public static final String PRICE_ORACLE = "price-oracle";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(5)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .ignoreExceptions(IllegalArgumentException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(defaultConfig);
        registry.circuitBreaker(PRICE_ORACLE, defaultConfig);

        log.info("Circuit Breaker Registry initialized with {} configurations",
                registry.getAllCircuitBreakers().size());
        return registry;
    }

    @Bean
    public RetryRegistry retryRegistry(BridgeProperties properties) {
        BridgeProperties.ChainSettings chain = properties.getChain();

        RetryConfig submissionConfig = chainSubmissionRetryConfig(chain);

        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.retry(CHAIN_SUBMISSION, submissionConfig);

        log.info("Retry registry initialized: {} maxAttempts={}, initialBackoff={}, multiplier={}",
                CHAIN_SUBMISSION, chain.getSubmissionMaxAttempts(),
                chain.getSubmissionInitialBackoff(), chain.getSubmissionBackoffMultiplier());

        return registry;
    }

    static RetryConfig chainSubmissionRetryConfig(BridgeProperties.ChainSettings chain) {
        return RetryConfig.custom()
                .maxAttempts(chain.getSubmissionMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        chain.getSubmissionInitialBackoff(),
                        chain.getSubmissionBackoffMultiplier()))
                .retryExceptions(LedgerRpcException.class)
                .build();
    }
}
