package com.waqiti.bridge.config;

import com.waqiti.bridge.chain.ChainAdapter;
import com.waqiti.bridge.chain.ChainAdapterRouter;
import com.waqiti.bridge.chain.ChainConfigRegistry;
import com.waqiti.bridge.chain.LedgerChainAdapter;
import com.waqiti.bridge.chain.LedgerClient;
import com.waqiti.bridge.fee.FeeCalculator;
import com.waqiti.bridge.fee.PriceOracle;
import com.waqiti.bridge.metrics.BridgeMetricsService;
import com.waqiti.bridge.slashing.BasisPointSlashPolicy;
import com.waqiti.bridge.slashing.SlashPolicy;
import com.waqiti.bridge.validator.DefaultReputationPolicy;
import com.waqiti.bridge.validator.ReputationPolicy;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bridge engine wiring: policies, fee calculation, chain adapters and the executors used for
 * ledger submission and local attestation signing.
 */
@Configuration
@Slf4j
public class BridgeEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ReputationPolicy reputationPolicy(BridgeProperties properties) {
        return new DefaultReputationPolicy(properties.getValidator());
    }

    @Bean
    @ConditionalOnMissingBean
    public SlashPolicy slashPolicy(BridgeProperties properties) {
        return new BasisPointSlashPolicy(properties.getSlashing());
    }

    @Bean
    public FeeCalculator feeCalculator(BridgeProperties properties,
                                       ObjectProvider<PriceOracle> priceOracle,
                                       CircuitBreakerRegistry circuitBreakerRegistry,
                                       Clock clock) {
        PriceOracle oracle = priceOracle.getIfAvailable();
        if (oracle == null) {
            log.warn("No PriceOracle configured, fiat fee bounds are disabled");
        }
        return new FeeCalculator(properties, oracle,
                circuitBreakerRegistry.circuitBreaker(ResilienceConfig.PRICE_ORACLE), clock);
    }

    /**
     * Adapter beans are used as-is; every {@link LedgerClient} bean is wrapped in a
     * {@link LedgerChainAdapter} sharing the {@code chain-submission} retry.
     */
    @Bean
    public ChainAdapterRouter chainAdapterRouter(ObjectProvider<ChainAdapter> adapters,
                                                 ObjectProvider<LedgerClient> ledgerClients,
                                                 ChainConfigRegistry configRegistry,
                                                 RetryRegistry retryRegistry,
                                                 BridgeMetricsService metricsService,
                                                 BridgeProperties properties,
                                                 Clock clock) {
        List<ChainAdapter> all = new ArrayList<>(adapters.orderedStream().toList());
        ledgerClients.orderedStream().forEach(client -> all.add(new LedgerChainAdapter(client, configRegistry,
                retryRegistry.retry(ResilienceConfig.CHAIN_SUBMISSION), metricsService, clock,
                properties.getChain().getLockConfirmationTimeout())));

        log.info("Chain adapters configured: {}", all.stream().map(ChainAdapter::chainId).toList());
        return new ChainAdapterRouter(all);
    }

    @Bean(name = "bridgeSubmissionExecutor")
    public Executor bridgeSubmissionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("bridge-submit-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("Initialized bridge submission executor - Core: {}, Max: {}, Queue: {}", 4, 16, 500);
        return executor;
    }

    @Bean(name = "attestationSigningExecutor")
    public Executor attestationSigningExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("attestation-sign-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
