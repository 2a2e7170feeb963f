package com.waqiti.bridge.transfer;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One timer per transfer awaiting consensus. Firing hands the transfer id to the expiry
 * handler; finalization cancels the timer.
 */
@Slf4j
@Component
public class TransferDeadlineScheduler {

    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private final ScheduledExecutorService executor;
    private final Clock clock;

    public TransferDeadlineScheduler(Clock clock) {
        this.clock = clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "transfer-deadline");
            t.setDaemon(true);
            return t;
        });
    }

    public void schedule(String transferId, Instant deadline, Consumer<String> onDeadline) {
        long delayMillis = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
        ScheduledFuture<?> future = executor.schedule(() -> {
            timers.remove(transferId);
            try {
                onDeadline.accept(transferId);
            } catch (RuntimeException e) {
                log.error("Deadline handler failed: transferId={}", transferId, e);
            }
        }, delayMillis, TimeUnit.MILLISECONDS);

        ScheduledFuture<?> previous = timers.put(transferId, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("Deadline scheduled: transferId={}, deadline={}", transferId, deadline);
    }

    public void cancel(String transferId) {
        ScheduledFuture<?> future = timers.remove(transferId);
        if (future != null) {
            future.cancel(false);
            log.debug("Deadline cancelled: transferId={}", transferId);
        }
    }

    public int pendingCount() {
        return timers.size();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
