package com.waqiti.bridge.chain;

import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.ChainConfig;
import com.waqiti.bridge.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current configuration per ledger.
 *
 * <p>Updates install a new {@link ChainConfig} version; transfers hold on to the version they
 * were created with.</p>
 */
@Slf4j
@Component
public class ChainConfigRegistry {

    private final Map<String, ChainConfig> configs = new ConcurrentHashMap<>();

    public ChainConfigRegistry(BridgeProperties properties) {
        int defaultThreshold = properties.getAttestation().getDefaultThreshold();
        for (BridgeProperties.ChainDefinition definition : properties.getChains()) {
            register(definition.toChainConfig(defaultThreshold));
        }
    }

    public ChainConfig register(ChainConfig config) {
        validate(config);
        ChainConfig existing = configs.putIfAbsent(config.getChainId(), config);
        if (existing != null) {
            throw new ValidationException("Chain already registered: " + config.getChainId());
        }
        log.info("Chain registered: chainId={}, role={}, threshold={}, confirmations={}",
                config.getChainId(), config.getRole(), config.getAttestationThreshold(), config.getConfirmationsRequired());
        return config;
    }

    public Optional<ChainConfig> find(String chainId) {
        return Optional.ofNullable(chainId).map(configs::get);
    }

    public ChainConfig get(String chainId) {
        return find(chainId).orElseThrow(() -> new ValidationException("Unknown chain: " + chainId));
    }

    public List<ChainConfig> all() {
        return configs.values().stream()
                .sorted(Comparator.comparing(ChainConfig::getChainId))
                .toList();
    }

    public ChainConfig updateThresholds(String chainId, ThresholdUpdate update) {
        ChainConfig updated = configs.compute(chainId, (id, current) -> {
            if (current == null) {
                throw new ValidationException("Unknown chain: " + chainId);
            }
            ChainConfig.ChainConfigBuilder builder = current.toBuilder().version(current.getVersion() + 1);
            if (update.getAttestationThreshold() != null) {
                builder.attestationThreshold(update.getAttestationThreshold());
            }
            if (update.getConfirmationsRequired() != null) {
                builder.confirmationsRequired(update.getConfirmationsRequired());
            }
            if (update.getMinAmount() != null) {
                builder.minAmount(update.getMinAmount());
            }
            if (update.getMaxAmount() != null) {
                builder.maxAmount(update.getMaxAmount());
            }
            if (update.getFeeBasisPoints() != null) {
                builder.feeBasisPoints(update.getFeeBasisPoints());
            }
            ChainConfig next = builder.build();
            validate(next);
            return next;
        });
        log.info("Chain config updated: chainId={}, version={}, threshold={}, confirmations={}, range=[{}, {}], feeBps={}",
                chainId, updated.getVersion(), updated.getAttestationThreshold(), updated.getConfirmationsRequired(),
                updated.getMinAmount(), updated.getMaxAmount(), updated.getFeeBasisPoints());
        return updated;
    }

    private static void validate(ChainConfig config) {
        if (config.getAttestationThreshold() < 1) {
            throw new ValidationException("Attestation threshold must be at least 1 for chain " + config.getChainId());
        }
        if (config.getConfirmationsRequired() < 0) {
            throw new ValidationException("Confirmations required cannot be negative for chain " + config.getChainId());
        }
        if (config.getMinAmount().signum() <= 0 || config.getMinAmount().compareTo(config.getMaxAmount()) > 0) {
            throw new ValidationException("Invalid amount range for chain " + config.getChainId());
        }
        if (config.getFeeBasisPoints() < 0 || config.getFeeBasisPoints() > 10_000) {
            throw new ValidationException("Fee basis points out of range for chain " + config.getChainId());
        }
    }
}
