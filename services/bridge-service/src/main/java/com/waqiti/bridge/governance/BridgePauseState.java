package com.waqiti.bridge.governance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Emergency pause flag. While paused, mint and refund submissions are held; attestation
 * collection and expiry continue.
 */
@Slf4j
@Component
public class BridgePauseState {

    private final AtomicReference<Instant> pausedAt = new AtomicReference<>();

    public boolean isPaused() {
        return pausedAt.get() != null;
    }

    /**
     * @return false if the bridge was already paused
     */
    public boolean pause(Instant at) {
        boolean changed = pausedAt.compareAndSet(null, at);
        if (changed) {
            log.warn("Bridge paused at {}", at);
        }
        return changed;
    }

    /**
     * @return false if the bridge was not paused
     */
    public boolean unpause() {
        Instant previous = pausedAt.getAndSet(null);
        if (previous != null) {
            log.warn("Bridge unpaused, was paused since {}", previous);
        }
        return previous != null;
    }

    public Instant pausedAt() {
        return pausedAt.get();
    }
}
