package com.waqiti.bridge.transfer;

import com.waqiti.bridge.domain.Transfer;
import com.waqiti.bridge.domain.TransferStatus;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local transfer store. Entities returned here are the live instances the state
 * machine mutates under the per-transfer lock; read paths outside it take snapshots.
 */
@Repository
public class InMemoryTransferRepository implements TransferRepository {

    private final Map<String, Transfer> transfers = new ConcurrentHashMap<>();

    @Override
    public Transfer save(Transfer transfer) {
        transfers.put(transfer.getTransferId(), transfer);
        return transfer;
    }

    @Override
    public Optional<Transfer> findById(String transferId) {
        return Optional.ofNullable(transferId).map(transfers::get);
    }

    @Override
    public List<Transfer> findByStatusIn(Collection<TransferStatus> statuses) {
        EnumSet<TransferStatus> wanted = EnumSet.copyOf(statuses);
        return transfers.values().stream()
                .filter(t -> wanted.contains(t.getStatus()))
                .toList();
    }

    @Override
    public List<Transfer> findAll() {
        return List.copyOf(transfers.values());
    }

    @Override
    public long count() {
        return transfers.size();
    }
}
