package com.waqiti.bridge.chain;

import com.waqiti.bridge.domain.ChainConfig;
import com.waqiti.bridge.domain.ProofBundle;
import com.waqiti.bridge.exception.ChainSubmissionException;

/**
 * Per-ledger integration point: watches for locks, submits mints and refunds, tracks
 * confirmations.
 */
public interface ChainAdapter {

    String chainId();

    ChainConfig config();

    /**
     * Adds a receiver of this ledger's lock events. Confirmed events are forwarded only
     * once {@code confirmations >= confirmationsRequired}.
     */
    void subscribeLocks(LockEventListener listener);

    /**
     * Idempotent: a transfer whose mint is already mined returns the existing hash.
     *
     * @throws ChainSubmissionException once retries are exhausted or the ledger rejects the mint
     */
    String submitMint(String transferId, ProofBundle proofBundle);

    /**
     * Idempotent in the same way as {@link #submitMint}.
     */
    String submitRefund(String transferId);

    long confirmations(String txHash);

    /**
     * Watches a submitted mint until it reaches the required confirmations.
     */
    void trackMint(String transferId, String txHash, int requiredConfirmations, MintConfirmationListener listener);

    /**
     * One iteration of the watch loop: scans new blocks and re-checks pending confirmations.
     */
    void pollOnce();

    long latestBlock();
}
