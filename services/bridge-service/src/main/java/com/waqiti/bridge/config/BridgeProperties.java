package com.waqiti.bridge.config;

import com.waqiti.bridge.domain.ChainConfig;
import com.waqiti.bridge.domain.ChainRole;
import com.waqiti.bridge.domain.SlashReason;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bridge engine configuration properties
 */
@Data
@ConfigurationProperties(prefix = "waqiti.bridge")
public class BridgeProperties {

    private ValidatorSettings validator = new ValidatorSettings();

    private AttestationSettings attestation = new AttestationSettings();

    private SlashingSettings slashing = new SlashingSettings();

    private FeeSettings fee = new FeeSettings();

    private ChainSettings chain = new ChainSettings();

    private GovernanceSettings governance = new GovernanceSettings();

    private TopicSettings topics = new TopicSettings();

    /**
     * Ledgers bridged by this node
     */
    private List<ChainDefinition> chains = new ArrayList<>();

    @Data
    public static class ValidatorSettings {
        private BigDecimal minStake = new BigDecimal("10000");

        /**
         * Minimum reputation (0-100) for an attestation to count
         */
        private int minReputation = 50;

        private int initialReputation = 80;

        private Duration exitCooldown = Duration.ofDays(7);

        /**
         * Eligible validator count below which the network is considered insecure
         */
        private int minActiveValidators = 3;

        /**
         * Inactivity period after which one point of reputation decays
         */
        private Duration reputationDecayInterval = Duration.ofDays(1);

        /**
         * Validator identities whose keys this node holds
         */
        private List<String> localIds = new ArrayList<>();
    }

    @Data
    public static class AttestationSettings {
        private int defaultThreshold = 3;

        private Duration validationTimeout = Duration.ofHours(24);

        /**
         * Wait after expiry before a refund may be executed
         */
        private Duration refundGracePeriod = Duration.ofHours(1);

        /**
         * Attestations within this window of the round opening earn reputation
         */
        private Duration timelyWindow = Duration.ofHours(1);

        private int maxEarlyAttestationsPerTransfer = 64;
    }

    @Data
    public static class SlashingSettings {
        private Duration disputeWindow = Duration.ofHours(48);

        /**
         * Fraction of current stake slashed, in basis points
         */
        private int defaultBasisPoints = 1000;

        /**
         * Per-reason overrides of {@code defaultBasisPoints}
         */
        private Map<SlashReason, Integer> basisPointsByReason = new EnumMap<>(SlashReason.class);

        private int maxConsecutiveMisses = 3;
    }

    @Data
    public static class FeeSettings {
        private BigDecimal baseFee = BigDecimal.ONE;

        /**
         * Oracle data older than this pauses fee quoting
         */
        private Duration stalenessCutoff = Duration.ofHours(1);

        /**
         * Fiat (USD) minimum fee, null to disable
         */
        private BigDecimal fiatMinimum;

        /**
         * Fiat (USD) fee cap, null to disable
         */
        private BigDecimal fiatMaximum;
    }

    @Data
    public static class ChainSettings {
        private Duration pollInterval = Duration.ofSeconds(10);

        private int submissionMaxAttempts = 5;

        private Duration submissionInitialBackoff = Duration.ofSeconds(2);

        private double submissionBackoffMultiplier = 2.0;

        /**
         * Non-terminal transfers older than this are reported as stuck
         */
        private Duration stuckTransferThreshold = Duration.ofHours(24);

        /**
         * Locks still short of their required confirmations after this long are dropped
         */
        private Duration lockConfirmationTimeout = Duration.ofHours(6);
    }

    @Data
    public static class GovernanceSettings {
        private List<String> council = new ArrayList<>();

        private int requiredApprovals = 2;

        private Duration proposalTtl = Duration.ofHours(72);
    }

    @Data
    public static class TopicSettings {
        private String alerts = "bridge-alerts";

        private String transferEvents = "bridge-transfer-events";
    }

    @Data
    public static class ChainDefinition {
        private String chainId;
        private String name;
        private ChainRole role = ChainRole.BIDIRECTIONAL;
        private String tokenAddress;
        private BigDecimal minAmount = BigDecimal.ONE;
        private BigDecimal maxAmount = new BigDecimal("1000000");
        private int feeBasisPoints = 30;
        private int confirmationsRequired = 12;

        /**
         * Falls back to {@code attestation.default-threshold} when unset
         */
        private Integer attestationThreshold;

        private String priceFeedPair;

        public ChainConfig toChainConfig(int defaultThreshold) {
            return ChainConfig.builder()
                    .chainId(chainId)
                    .name(name != null ? name : chainId)
                    .role(role)
                    .tokenAddress(tokenAddress)
                    .minAmount(minAmount)
                    .maxAmount(maxAmount)
                    .feeBasisPoints(feeBasisPoints)
                    .confirmationsRequired(confirmationsRequired)
                    .attestationThreshold(attestationThreshold != null ? attestationThreshold : defaultThreshold)
                    .priceFeedPair(priceFeedPair)
                    .build();
        }
    }
}
