package com.waqiti.bridge.alert;

import com.waqiti.bridge.domain.AlertTriggered;
import com.waqiti.bridge.domain.TransferLifecycleEvent;

/**
 * Outbound channel for alerts and transfer lifecycle events.
 */
public interface BridgeEventSink {

    void publishAlert(AlertTriggered alert);

    void publishTransferEvent(TransferLifecycleEvent event);
}
