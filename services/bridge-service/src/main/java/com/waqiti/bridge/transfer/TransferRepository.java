package com.waqiti.bridge.transfer;

import com.waqiti.bridge.domain.Transfer;
import com.waqiti.bridge.domain.TransferStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TransferRepository {

    Transfer save(Transfer transfer);

    Optional<Transfer> findById(String transferId);

    List<Transfer> findByStatusIn(Collection<TransferStatus> statuses);

    List<Transfer> findAll();

    long count();
}
