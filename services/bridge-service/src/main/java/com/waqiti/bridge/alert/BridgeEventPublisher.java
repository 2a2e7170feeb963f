package com.waqiti.bridge.alert;

import com.waqiti.bridge.domain.AlertTriggered;
import com.waqiti.bridge.domain.AlertType;
import com.waqiti.bridge.domain.Transfer;
import com.waqiti.bridge.domain.TransferLifecycleEvent;
import com.waqiti.bridge.domain.TransferStatus;
import com.waqiti.bridge.metrics.BridgeMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;

/**
 * Builds alert and lifecycle payloads and hands them to the configured sink.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BridgeEventPublisher {

    private final BridgeEventSink sink;
    private final BridgeMetricsService metricsService;
    private final Clock clock;

    public void alert(AlertType type, String transferId, BigDecimal amount, String description) {
        raise(type, transferId, null, null, amount, description);
    }

    public void validatorAlert(AlertType type, String validatorId, String transferId, String description) {
        raise(type, transferId, validatorId, null, null, description);
    }

    public void chainAlert(AlertType type, String chainId, String description) {
        raise(type, null, null, chainId, null, description);
    }

    public void transferAlert(AlertType type, Transfer transfer, String description) {
        raise(type, transfer.getTransferId(), null, null, transfer.getAmount(), description);
    }

    private void raise(AlertType type, String transferId, String validatorId, String chainId,
                       BigDecimal amount, String description) {
        AlertTriggered alert = AlertTriggered.builder()
                .alertId(UUID.randomUUID().toString())
                .type(type)
                .severity(type.getSeverity())
                .transferId(transferId)
                .validatorId(validatorId)
                .chainId(chainId)
                .amount(amount)
                .description(description != null ? description : type.getSummary())
                .timestamp(clock.instant())
                .build();

        log.warn("ALERT {} [{}]: transferId={}, validatorId={}, chainId={}, {}",
                type, type.getSeverity(), transferId, validatorId, chainId, alert.getDescription());

        metricsService.recordAlert(type);
        sink.publishAlert(alert);
    }

    public void statusChanged(Transfer transfer, TransferStatus previousStatus, String txHash) {
        sink.publishTransferEvent(TransferLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(TransferLifecycleEvent.EventType.STATUS_CHANGED)
                .transferId(transfer.getTransferId())
                .sourceChain(transfer.getSourceChain())
                .destChain(transfer.getDestChain())
                .amount(transfer.getAmount())
                .fee(transfer.getFee())
                .status(transfer.getStatus())
                .previousStatus(previousStatus)
                .attestationCount(transfer.getAttestations().size())
                .requiredAttestations(transfer.requiredAttestations())
                .txHash(txHash)
                .timestamp(clock.instant())
                .build());
    }

    public void validatorSigned(Transfer transfer, String validatorId) {
        sink.publishTransferEvent(TransferLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(TransferLifecycleEvent.EventType.VALIDATOR_SIGNED)
                .transferId(transfer.getTransferId())
                .sourceChain(transfer.getSourceChain())
                .destChain(transfer.getDestChain())
                .amount(transfer.getAmount())
                .fee(transfer.getFee())
                .status(transfer.getStatus())
                .validatorId(validatorId)
                .attestationCount(transfer.getAttestations().size())
                .requiredAttestations(transfer.requiredAttestations())
                .timestamp(clock.instant())
                .build());
    }
}
