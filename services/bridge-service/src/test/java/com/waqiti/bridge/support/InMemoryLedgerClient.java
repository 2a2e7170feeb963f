package com.waqiti.bridge.support;

import com.waqiti.bridge.chain.LedgerClient;
import com.waqiti.bridge.domain.LockEvent;
import com.waqiti.bridge.domain.ProofBundle;
import com.waqiti.bridge.exception.LedgerRpcException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ledger simulated in memory. Every lock, mint and refund is mined into its own block;
 * confirmations grow as blocks are mined.
 */
public class InMemoryLedgerClient implements LedgerClient {

    private final String chainId;
    private final AtomicLong latestBlock = new AtomicLong(0);
    private final List<LockEvent> locks = new CopyOnWriteArrayList<>();
    private final Map<String, Long> minedAt = new ConcurrentHashMap<>();
    private final Map<String, String> mints = new ConcurrentHashMap<>();
    private final Map<String, ProofBundle> mintProofs = new ConcurrentHashMap<>();
    private final Map<String, String> refunds = new ConcurrentHashMap<>();

    private final AtomicInteger mintCalls = new AtomicInteger();
    private final AtomicInteger refundCalls = new AtomicInteger();
    private final AtomicInteger transientFailures = new AtomicInteger();
    private volatile boolean rejectSubmissions;
    private volatile boolean unreachable;

    public InMemoryLedgerClient(String chainId) {
        this.chainId = chainId;
    }

    public LockEvent lock(String destChain, long nonce, String sender, String recipient, BigDecimal amount) {
        long block = latestBlock.incrementAndGet();
        LockEvent event = LockEvent.builder()
                .sourceChain(chainId)
                .destChain(destChain)
                .nonce(nonce)
                .sender(sender)
                .recipient(recipient)
                .amount(amount)
                .txHash(chainId + "-lock-" + nonce)
                .blockNumber(block)
                .observedAt(Instant.EPOCH)
                .build();
        locks.add(event);
        minedAt.put(event.getTxHash(), block);
        return event;
    }

    /**
     * Records a foreign event on this ledger, as a misbehaving RPC node might.
     */
    public void injectLockEvent(LockEvent event) {
        locks.add(event.toBuilder().blockNumber(latestBlock.incrementAndGet()).build());
    }

    /**
     * Removes a lock transaction from the chain, as a reorganisation would.
     */
    public void reorgOut(LockEvent event) {
        locks.removeIf(lock -> lock.getTxHash().equals(event.getTxHash()));
        minedAt.remove(event.getTxHash());
    }

    public void mineBlocks(int count) {
        latestBlock.addAndGet(count);
    }

    public void failNextSubmissions(int count) {
        transientFailures.set(count);
    }

    public void rejectSubmissions(boolean reject) {
        this.rejectSubmissions = reject;
    }

    public void setUnreachable(boolean unreachable) {
        this.unreachable = unreachable;
    }

    @Override
    public String chainId() {
        return chainId;
    }

    @Override
    public long latestBlockNumber() {
        requireReachable();
        return latestBlock.get();
    }

    @Override
    public List<LockEvent> lockEvents(long fromBlock, long toBlock) {
        requireReachable();
        return locks.stream()
                .filter(e -> e.getBlockNumber() >= fromBlock && e.getBlockNumber() <= toBlock)
                .toList();
    }

    @Override
    public Optional<String> findMint(String transferId) {
        return Optional.ofNullable(mints.get(transferId));
    }

    @Override
    public String mint(String transferId, ProofBundle proofBundle) {
        mintCalls.incrementAndGet();
        checkSubmission();
        String txHash = chainId + "-mint-" + transferId.substring(0, 8);
        mints.put(transferId, txHash);
        mintProofs.put(transferId, proofBundle);
        minedAt.put(txHash, latestBlock.incrementAndGet());
        return txHash;
    }

    @Override
    public Optional<String> findRefund(String transferId) {
        return Optional.ofNullable(refunds.get(transferId));
    }

    @Override
    public String refund(String transferId) {
        refundCalls.incrementAndGet();
        checkSubmission();
        String txHash = chainId + "-refund-" + transferId.substring(0, 8);
        refunds.put(transferId, txHash);
        minedAt.put(txHash, latestBlock.incrementAndGet());
        return txHash;
    }

    @Override
    public long confirmations(String txHash) {
        Long block = minedAt.get(txHash);
        return block == null ? 0 : latestBlock.get() - block + 1;
    }

    public int mintCalls() {
        return mintCalls.get();
    }

    public int refundCalls() {
        return refundCalls.get();
    }

    public Optional<ProofBundle> mintedProof(String transferId) {
        return Optional.ofNullable(mintProofs.get(transferId));
    }

    public Map<String, String> refunds() {
        return Map.copyOf(refunds);
    }

    private void checkSubmission() {
        if (transientFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new LedgerRpcException(chainId + " RPC timeout");
        }
        if (rejectSubmissions) {
            throw new IllegalStateException(chainId + " contract reverted");
        }
    }

    private void requireReachable() {
        if (unreachable) {
            throw new LedgerRpcException(chainId + " unreachable");
        }
    }
}
