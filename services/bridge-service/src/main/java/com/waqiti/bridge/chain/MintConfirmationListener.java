package com.waqiti.bridge.chain;

@FunctionalInterface
public interface MintConfirmationListener {

    void onMintConfirmed(String transferId, String txHash);
}
