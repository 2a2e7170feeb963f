package com.waqiti.bridge.chain;

import com.waqiti.bridge.domain.ChainConfig;
import com.waqiti.bridge.domain.LockEvent;
import com.waqiti.bridge.domain.ProofBundle;
import com.waqiti.bridge.exception.ChainSubmissionException;
import com.waqiti.bridge.exception.LedgerRpcException;
import com.waqiti.bridge.metrics.BridgeMetricsService;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * {@link ChainAdapter} over a {@link LedgerClient}.
 *
 * <p>Locks are held back until they reach the source ledger's required confirmations, which
 * protects against reorganisations. A pending lock whose transaction disappears from the
 * ledger, or that stays below the required depth for longer than the confirmation timeout, is
 * reported to listeners as dropped. Mint and refund submissions check the ledger for an
 * existing transaction before sending and are retried with the {@code chain-submission}
 * Resilience4j retry.</p>
 *
 * @author Waqiti Platform Team
 * @since 1.0.0
 */
@Slf4j
public class LedgerChainAdapter implements ChainAdapter {

    private static final String MINT = "mint";
    private static final String REFUND = "refund";

    private final LedgerClient client;
    private final ChainConfigRegistry configRegistry;
    private final Retry submissionRetry;
    private final BridgeMetricsService metricsService;
    private final Clock clock;
    private final Duration confirmationTimeout;

    private final AtomicLong lastScannedBlock = new AtomicLong(-1);
    private final Map<String, PendingLock> awaitingConfirmation = new ConcurrentHashMap<>();
    private final Map<String, MintWatch> awaitingMint = new ConcurrentHashMap<>();

    private final List<LockEventListener> listeners = new CopyOnWriteArrayList<>();

    public LedgerChainAdapter(LedgerClient client,
                              ChainConfigRegistry configRegistry,
                              Retry submissionRetry,
                              BridgeMetricsService metricsService,
                              Clock clock,
                              Duration confirmationTimeout) {
        this.client = client;
        this.configRegistry = configRegistry;
        this.submissionRetry = submissionRetry;
        this.metricsService = metricsService;
        this.clock = clock;
        this.confirmationTimeout = confirmationTimeout;
    }

    @Override
    public String chainId() {
        return client.chainId();
    }

    @Override
    public ChainConfig config() {
        return configRegistry.get(client.chainId());
    }

    @Override
    public void subscribeLocks(LockEventListener listener) {
        listeners.add(listener);
        log.info("Lock subscription registered: chainId={}, listener={}", chainId(), listener.getClass().getSimpleName());
    }

    @Override
    public String submitMint(String transferId, ProofBundle proofBundle) {
        String txHash = submit(MINT, transferId, () -> client.findMint(transferId)
                .map(existing -> {
                    log.info("Mint already on ledger, skipping resubmission: chainId={}, transferId={}, txHash={}",
                            chainId(), transferId, existing);
                    return existing;
                })
                .orElseGet(() -> client.mint(transferId, proofBundle)));
        log.info("Mint submitted: chainId={}, transferId={}, txHash={}", chainId(), transferId, txHash);
        return txHash;
    }

    @Override
    public String submitRefund(String transferId) {
        String txHash = submit(REFUND, transferId, () -> client.findRefund(transferId)
                .orElseGet(() -> client.refund(transferId)));
        log.info("Refund submitted: chainId={}, transferId={}, txHash={}", chainId(), transferId, txHash);
        return txHash;
    }

    private String submit(String operation, String transferId, Supplier<String> call) {
        try {
            return submissionRetry.executeSupplier(call);
        } catch (LedgerRpcException e) {
            metricsService.recordSubmissionFailure(chainId(), operation);
            log.error("{} submission exhausted retries: chainId={}, transferId={}, attempts={}",
                    operation, chainId(), transferId, submissionRetry.getRetryConfig().getMaxAttempts(), e);
            throw new ChainSubmissionException(chainId(), transferId,
                    operation + " failed after " + submissionRetry.getRetryConfig().getMaxAttempts() + " attempts", e);
        } catch (RuntimeException e) {
            metricsService.recordSubmissionFailure(chainId(), operation);
            log.error("{} rejected by ledger: chainId={}, transferId={}", operation, chainId(), transferId, e);
            throw new ChainSubmissionException(chainId(), transferId, operation + " rejected: " + e.getMessage(), e);
        }
    }

    @Override
    public long confirmations(String txHash) {
        return client.confirmations(txHash);
    }

    @Override
    public void trackMint(String transferId, String txHash, int requiredConfirmations, MintConfirmationListener mintListener) {
        awaitingMint.put(transferId, new MintWatch(txHash, requiredConfirmations, mintListener));
    }

    @Override
    public long latestBlock() {
        return client.latestBlockNumber();
    }

    @Override
    public void pollOnce() {
        if (!listeners.isEmpty()) {
            scanNewBlocks();
            forwardConfirmedLocks();
        }
        checkPendingMints();
    }

    private void scanNewBlocks() {
        long latest = client.latestBlockNumber();
        long from = lastScannedBlock.get() + 1;
        if (latest < from) {
            return;
        }
        for (LockEvent event : client.lockEvents(from, latest)) {
            if (!chainId().equals(event.getSourceChain())) {
                log.warn("Lock event from foreign chain ignored: chainId={}, eventChain={}, txHash={}",
                        chainId(), event.getSourceChain(), event.getTxHash());
                continue;
            }
            PendingLock pending = new PendingLock(event, clock.instant());
            if (awaitingConfirmation.putIfAbsent(event.transferId(), pending) == null) {
                log.debug("Lock observed: chainId={}, nonce={}, txHash={}, block={}",
                        chainId(), event.getNonce(), event.getTxHash(), event.getBlockNumber());
                deliver(event, LockEventListener::onLockObserved);
            }
        }
        lastScannedBlock.set(latest);
    }

    private void forwardConfirmedLocks() {
        int required = config().getConfirmationsRequired();
        Instant now = clock.instant();
        awaitingConfirmation.forEach((transferId, pending) -> {
            LockEvent event = pending.event();
            long confirmations = client.confirmations(event.getTxHash());
            if (confirmations >= required) {
                if (deliver(event, LockEventListener::onLockConfirmed)) {
                    awaitingConfirmation.remove(transferId);
                    log.info("Lock confirmed: chainId={}, transferId={}, confirmations={}", chainId(), transferId, confirmations);
                }
            } else if (confirmations == 0) {
                drop(transferId, event, "lock transaction " + event.getTxHash() + " is no longer on " + chainId());
            } else if (!now.isBefore(pending.observedAt().plus(confirmationTimeout))) {
                drop(transferId, event, "lock stayed at " + confirmations + " of " + required
                        + " confirmations for " + confirmationTimeout);
            }
        });
    }

    private void drop(String transferId, LockEvent event, String reason) {
        if (deliver(event, (listener, e) -> listener.onLockDropped(e, reason))) {
            awaitingConfirmation.remove(transferId);
            log.warn("Lock dropped: chainId={}, transferId={}, reason={}", chainId(), transferId, reason);
        }
    }

    private void checkPendingMints() {
        awaitingMint.forEach((transferId, watch) -> {
            long confirmations = client.confirmations(watch.txHash());
            if (confirmations >= watch.requiredConfirmations()) {
                try {
                    watch.listener().onMintConfirmed(transferId, watch.txHash());
                    awaitingMint.remove(transferId);
                } catch (RuntimeException e) {
                    log.error("Mint confirmation handler failed, will retry: chainId={}, transferId={}",
                            chainId(), transferId, e);
                }
            }
        });
    }

    /**
     * Delivers an event to every listener. Listeners are idempotent, so a failure leaves the
     * event in place and the whole delivery is repeated on the next poll.
     */
    private boolean deliver(LockEvent event, BiConsumer<LockEventListener, LockEvent> handler) {
        try {
            for (LockEventListener listener : listeners) {
                handler.accept(listener, event);
            }
            return true;
        } catch (RuntimeException e) {
            log.error("Lock handler failed, will retry: chainId={}, transferId={}", chainId(), event.transferId(), e);
            return false;
        }
    }

    int pendingLockCount() {
        return awaitingConfirmation.size();
    }

    private record PendingLock(LockEvent event, Instant observedAt) {
    }

    private record MintWatch(String txHash, int requiredConfirmations, MintConfirmationListener listener) {
    }
}
