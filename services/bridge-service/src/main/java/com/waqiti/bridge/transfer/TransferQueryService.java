package com.waqiti.bridge.transfer;

import com.waqiti.bridge.domain.Transfer;
import com.waqiti.bridge.domain.TransferIds;
import com.waqiti.bridge.domain.TransferStatus;
import com.waqiti.bridge.exception.TransferNotFoundException;
import com.waqiti.bridge.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Read side for transfers. Returns snapshots taken under the transfer lock.
 */
@Service
@RequiredArgsConstructor
public class TransferQueryService {

    private final TransferRepository repository;
    private final TransferLockManager lockManager;

    public Optional<Transfer> findTransfer(String transferId) {
        if (repository.findById(transferId).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(lockManager.executeWithLock(transferId, () -> repository.findById(transferId)
                .map(Transfer::snapshot)
                .orElseThrow(() -> new TransferNotFoundException("Transfer not found: " + transferId))));
    }

    public Transfer getTransfer(String transferId) {
        return findTransfer(transferId)
                .orElseThrow(() -> new TransferNotFoundException("Transfer not found: " + transferId));
    }

    public Optional<Transfer> findBySourceNonce(String sourceChain, long nonce) {
        return findTransfer(TransferIds.derive(sourceChain, nonce));
    }

    /**
     * Transfers in the given statuses, newest first.
     *
     * @param statuses empty for all statuses
     */
    public List<Transfer> listTransfers(EnumSet<TransferStatus> statuses, int page, int size) {
        if (page < 0 || size <= 0) {
            throw new ValidationException("Invalid page request: page=" + page + ", size=" + size);
        }
        List<Transfer> matching = statuses.isEmpty() ? repository.findAll() : repository.findByStatusIn(statuses);
        return matching.stream()
                .sorted(Comparator.comparing(Transfer::getCreatedAt).reversed()
                        .thenComparing(Transfer::getTransferId))
                .skip((long) page * size)
                .limit(size)
                .map(t -> lockManager.executeWithLock(t.getTransferId(), t::snapshot))
                .toList();
    }

    public List<Transfer> transfersRequiringIntervention() {
        return repository.findAll().stream()
                .filter(Transfer::isRequiresOperatorIntervention)
                .map(t -> lockManager.executeWithLock(t.getTransferId(), t::snapshot))
                .toList();
    }
}
