package com.waqiti.bridge.replay;

import com.waqiti.bridge.domain.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At-most-once gate for transfer processing.
 *
 * <p>Remembers every transfer that reached a status closed for attestation (FINALIZED,
 * COMPLETED, EXPIRED, REFUNDED) and every mint or refund that was claimed. Attempts that
 * reference an already-closed transfer are rejected as silent no-ops: logged, never thrown.</p>
 *
 * <p>All checks are single atomic map operations, so concurrent duplicate submissions race on
 * the map, not on the ledger.</p>
 */
@Slf4j
@Component
public class ReplayGuard {

    public enum Operation {
        ATTESTATION,
        MINT,
        REFUND,
        TRANSITION
    }

    private final Map<String, TransferStatus> closed = new ConcurrentHashMap<>();
    private final Set<String> mintClaims = ConcurrentHashMap.newKeySet();
    private final Set<String> refundClaims = ConcurrentHashMap.newKeySet();

    /**
     * @return false if the transfer is closed for attestations
     */
    public boolean admitAttestation(String transferId) {
        TransferStatus status = closed.get(transferId);
        if (status != null) {
            logRejection(Operation.ATTESTATION, transferId, status);
            return false;
        }
        return true;
    }

    /**
     * Checks a status transition against what was already recorded and records it when it
     * closes the transfer. Non-closing transitions of open transfers always pass.
     *
     * @return false if the transfer already moved past {@code target}
     */
    public boolean admitTransition(String transferId, TransferStatus target) {
        if (!target.isClosedForAttestation()) {
            TransferStatus status = closed.get(transferId);
            if (status != null) {
                logRejection(Operation.TRANSITION, transferId, status);
                return false;
            }
            return true;
        }

        boolean[] admitted = {false};
        closed.compute(transferId, (id, current) -> {
            if (current == null || current.canTransitionTo(target)) {
                admitted[0] = true;
                return target;
            }
            return current;
        });
        if (!admitted[0]) {
            logRejection(Operation.TRANSITION, transferId, closed.get(transferId));
        }
        return admitted[0];
    }

    /**
     * Claims the single mint submission for a transfer.
     *
     * @return true for exactly one caller per transfer id
     */
    public boolean claimMint(String transferId) {
        if (mintClaims.add(transferId)) {
            return true;
        }
        logRejection(Operation.MINT, transferId, closed.get(transferId));
        return false;
    }

    /**
     * Releases a mint claim after a submission that definitely did not reach the ledger, so
     * an operator retry can claim it again.
     */
    public void releaseMintClaim(String transferId) {
        mintClaims.remove(transferId);
    }

    public boolean claimRefund(String transferId) {
        if (refundClaims.add(transferId)) {
            return true;
        }
        logRejection(Operation.REFUND, transferId, closed.get(transferId));
        return false;
    }

    public void releaseRefundClaim(String transferId) {
        refundClaims.remove(transferId);
    }

    public boolean isClosed(String transferId) {
        return closed.containsKey(transferId);
    }

    public Optional<TransferStatus> closedStatus(String transferId) {
        return Optional.ofNullable(closed.get(transferId));
    }

    public boolean isMintClaimed(String transferId) {
        return mintClaims.contains(transferId);
    }

    private void logRejection(Operation operation, String transferId, TransferStatus status) {
        log.info("Replay ignored: operation={}, transferId={}, recordedStatus={}", operation, transferId, status);
    }
}
