package com.waqiti.bridge.alert;

import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.AlertTriggered;
import com.waqiti.bridge.domain.TransferLifecycleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes alerts and lifecycle events to Kafka. Alerts are keyed by transfer id when
 * present so all alerts for one transfer land on one partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaBridgeEventSink implements BridgeEventSink {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final BridgeProperties properties;

    @Override
    public void publishAlert(AlertTriggered alert) {
        String key = alert.getTransferId() != null ? alert.getTransferId() : alert.getType().name();
        send(properties.getTopics().getAlerts(), key, alert);
    }

    @Override
    public void publishTransferEvent(TransferLifecycleEvent event) {
        send(properties.getTopics().getTransferEvents(), event.getTransferId(), event);
    }

    private void send(String topic, String key, Object payload) {
        try {
            kafkaTemplate.send(topic, key, payload).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish to {}: key={}", topic, key, ex);
                } else {
                    log.debug("Published to {}: key={}", topic, key);
                }
            });
        } catch (RuntimeException e) {
            // engine state is already committed
            log.error("Kafka send rejected for {}: key={}", topic, key, e);
        }
    }
}
