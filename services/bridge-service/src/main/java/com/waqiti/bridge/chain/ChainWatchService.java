package com.waqiti.bridge.chain;

import com.waqiti.bridge.config.BridgeProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs one long-lived watch loop per ledger. Ledgers progress independently: a slow or failing
 * ledger never delays another one's loop.
 */
@Slf4j
@Service
public class ChainWatchService {

    private final ChainAdapterRouter router;
    private final List<LockEventListener> lockListeners;
    private final Duration pollInterval;
    private final Clock clock;

    private final Map<String, ChainStatus> status = new ConcurrentHashMap<>();
    private final List<ExecutorService> loops = new ArrayList<>();

    private volatile boolean running;

    public ChainWatchService(ChainAdapterRouter router,
                             List<LockEventListener> lockListeners,
                             BridgeProperties properties,
                             Clock clock) {
        this.router = router;
        this.lockListeners = List.copyOf(lockListeners);
        this.pollInterval = properties.getChain().getPollInterval();
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        running = true;
        for (ChainAdapter adapter : router.all()) {
            lockListeners.forEach(adapter::subscribeLocks);
            status.put(adapter.chainId(), new ChainStatus(true, null, null));

            ExecutorService loop = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "chain-watch-" + adapter.chainId());
                t.setDaemon(true);
                return t;
            });
            loop.submit(() -> watch(adapter));
            loops.add(loop);
        }
        log.info("Chain watch loops started: chains={}, pollInterval={}", status.keySet(), pollInterval);
    }

    private void watch(ChainAdapter adapter) {
        MDC.put("chainId", adapter.chainId());
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                pollOnce(adapter);
                try {
                    Thread.sleep(pollInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        } finally {
            log.info("Chain watch loop stopped");
            MDC.remove("chainId");
        }
    }

    /**
     * Runs a single poll and records whether the ledger answered.
     */
    public void pollOnce(ChainAdapter adapter) {
        try {
            adapter.pollOnce();
            status.put(adapter.chainId(), new ChainStatus(true, clock.instant(), null));
        } catch (RuntimeException e) {
            ChainStatus previous = status.get(adapter.chainId());
            status.put(adapter.chainId(), new ChainStatus(false,
                    previous != null ? previous.lastSuccessfulPoll() : null, e.getMessage()));
            log.warn("Chain poll failed: chainId={}, error={}", adapter.chainId(), e.getMessage());
        }
    }

    public Map<String, ChainStatus> chainStatus() {
        return Map.copyOf(status);
    }

    @PreDestroy
    public void stop() {
        running = false;
        for (ExecutorService loop : loops) {
            loop.shutdownNow();
            try {
                if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Chain watch loop did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        loops.clear();
    }

    public record ChainStatus(boolean responsive, Instant lastSuccessfulPoll, String lastError) {
    }
}
