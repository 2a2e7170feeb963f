package com.waqiti.bridge.chain;

import com.waqiti.bridge.domain.LockEvent;

public interface LockEventListener {

    /**
     * First sighting of a lock, before it has enough confirmations.
     */
    void onLockObserved(LockEvent event);

    /**
     * The lock reached the source ledger's required confirmations.
     */
    void onLockConfirmed(LockEvent event);

    /**
     * The lock was reorganised out of the source ledger, or did not reach confirmation depth
     * in time. It will not be confirmed.
     */
    void onLockDropped(LockEvent event, String reason);
}
