package com.waqiti.bridge.domain;

/**
 * Which side of a transfer a ledger may play.
 */
public enum ChainRole {
    SOURCE,
    DESTINATION,
    BIDIRECTIONAL;

    public boolean canSend() {
        return this == SOURCE || this == BIDIRECTIONAL;
    }

    public boolean canReceive() {
        return this == DESTINATION || this == BIDIRECTIONAL;
    }
}
