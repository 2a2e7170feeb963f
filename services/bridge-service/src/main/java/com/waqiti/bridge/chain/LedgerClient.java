package com.waqiti.bridge.chain;

import com.waqiti.bridge.domain.LockEvent;
import com.waqiti.bridge.domain.ProofBundle;
import com.waqiti.bridge.exception.LedgerRpcException;

import java.util.List;
import java.util.Optional;

/**
 * RPC access to one ledger's bridge contract.
 *
 * <p>Implementations throw {@link LedgerRpcException} for transient transport failures; those
 * are retried by the adapter. Any other exception is treated as a permanent rejection.</p>
 */
public interface LedgerClient {

    String chainId();

    long latestBlockNumber();

    /**
     * Lock events emitted by the bridge contract in the inclusive block range.
     */
    List<LockEvent> lockEvents(long fromBlock, long toBlock);

    /**
     * @return the transaction hash of an already mined mint for the transfer
     */
    Optional<String> findMint(String transferId);

    /**
     * Submits a mint. The contract re-validates the proof against its validator set.
     *
     * @return the transaction hash
     */
    String mint(String transferId, ProofBundle proofBundle);

    Optional<String> findRefund(String transferId);

    String refund(String transferId);

    /**
     * @return confirmations of the transaction, 0 if it is unknown or was reorganised out
     */
    long confirmations(String txHash);
}
