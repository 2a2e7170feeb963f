package com.waqiti.bridge.validator;

import com.waqiti.bridge.domain.AlertType;
import com.waqiti.bridge.domain.SlashEvent;
import com.waqiti.bridge.domain.SlashReason;
import com.waqiti.bridge.domain.SlashStatus;
import com.waqiti.bridge.domain.Validator;
import com.waqiti.bridge.exception.InsufficientStakeException;
import com.waqiti.bridge.exception.ValidationException;
import com.waqiti.bridge.exception.ValidatorNotFoundException;
import com.waqiti.bridge.support.BridgeTestFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ValidatorRegistry Tests")
class ValidatorRegistryTest {

    private BridgeTestFixture fixture;
    private ValidatorRegistry registry;

    @BeforeEach
    void setUp() {
        fixture = new BridgeTestFixture();
        registry = fixture.validators;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Should register with initial reputation and count as eligible")
        void shouldRegisterEligibleValidator() {
            Validator validator = registry.register("v1", new BigDecimal("10000"), fixture.signer.newKey("v1"));

            assertThat(validator.getReputationScore()).isEqualTo(80);
            assertThat(validator.isActive()).isTrue();
            assertThat(registry.isEligible("v1")).isTrue();
            assertThat(registry.publicKey("v1")).contains(validator.getPublicKey());
        }

        @Test
        @DisplayName("Should reject stake below the minimum")
        void shouldRejectInsufficientStake() {
            assertThatThrownBy(() -> registry.register("v1", new BigDecimal("9999.99"), fixture.signer.newKey("v1")))
                    .isInstanceOf(InsufficientStakeException.class)
                    .hasMessageContaining("below minimum");
            assertThat(registry.find("v1")).isEmpty();
        }

        @Test
        @DisplayName("Should reject duplicate ids and missing keys")
        void shouldRejectDuplicatesAndMissingKeys() {
            registry.register("v1", BridgeTestFixture.STAKE, fixture.signer.newKey("v1"));

            assertThatThrownBy(() -> registry.register("v1", BridgeTestFixture.STAKE, fixture.signer.newKey("v1")))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> registry.register("v2", BridgeTestFixture.STAKE, " "))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Should hand out copies that do not affect registry state")
        void shouldReturnIndependentCopies() {
            registry.register("v1", BridgeTestFixture.STAKE, fixture.signer.newKey("v1"));

            registry.get("v1").setStakeAmount(BigDecimal.ZERO);

            assertThat(registry.get("v1").getStakeAmount()).isEqualByComparingTo("10000");
        }
    }

    @Nested
    @DisplayName("Slashing and reputation")
    class SlashingAndReputation {

        @BeforeEach
        void register() {
            fixture.registerValidators(4);
        }

        @Test
        @DisplayName("Should slash by basis points and drop eligibility below minimum stake")
        void shouldSlashByBasisPoints() {
            SlashEvent event = registry.slash("validator-1", 1000);

            assertThat(event.getAmountSlashed()).isEqualByComparingTo("1000");
            assertThat(event.getStatus()).isEqualTo(SlashStatus.APPLIED);
            assertThat(event.getReason()).isEqualTo(SlashReason.ADMINISTRATIVE);

            Validator validator = registry.get("validator-1");
            assertThat(validator.getStakeAmount()).isEqualByComparingTo("9000");
            assertThat(validator.getTotalSlashed()).isEqualByComparingTo("1000");
            assertThat(registry.isEligible("validator-1")).isFalse();
        }

        @Test
        @DisplayName("Should never slash more than the remaining stake")
        void shouldFloorStakeAtZero() {
            SlashEvent event = registry.slash("validator-1", 25_000);

            assertThat(event.getAmountSlashed()).isEqualByComparingTo("10000");
            assertThat(registry.get("validator-1").getStakeAmount()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Should reject negative basis points and unknown validators")
        void shouldRejectInvalidSlashRequests() {
            assertThatThrownBy(() -> registry.slash("validator-1", -1)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> registry.slash("nobody", 100)).isInstanceOf(ValidatorNotFoundException.class);
        }

        @Test
        @DisplayName("Should clamp reputation to [0, 100]")
        void shouldClampReputation() {
            assertThat(registry.updateReputation("validator-1", 500)).isEqualTo(100);
            assertThat(registry.updateReputation("validator-1", -500)).isZero();
            assertThat(registry.isEligible("validator-1")).isFalse();
        }

        @Test
        @DisplayName("Should clamp extreme reputation deltas without overflow")
        void shouldClampExtremeDeltas() {
            // When / Then
            assertThat(registry.updateReputation("validator-1", Integer.MAX_VALUE)).isEqualTo(100);
            assertThat(registry.updateReputation("validator-1", Integer.MIN_VALUE)).isZero();
            assertThat(registry.updateReputation("validator-1", Integer.MAX_VALUE)).isEqualTo(100);
            assertThat(registry.get("validator-1").getReputationScore()).isEqualTo(100);
        }

        @Test
        @DisplayName("Should reward attestations and reset the missed-window streak")
        void shouldRewardAttestation() {
            registry.recordMissedWindow("validator-1");
            registry.recordMissedWindow("validator-1");

            registry.recordAttestation("validator-1", true);

            Validator validator = registry.get("validator-1");
            assertThat(validator.getReputationScore()).isEqualTo(82);
            assertThat(validator.getMissedWindows()).isZero();
            assertThat(validator.getValidatedTransfers()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should decay idle validators once per interval")
        void shouldDecayInactiveValidators() {
            fixture.clock.advance(Duration.ofDays(3));

            assertThat(registry.decayInactive()).isEqualTo(4);
            assertThat(registry.get("validator-1").getReputationScore()).isEqualTo(77);

            assertThat(registry.decayInactive()).isZero();
        }

        @Test
        @DisplayName("Should alert once when the eligible set drops below the minimum")
        void shouldAlertOnceBelowMinimum() {
            registry.slash("validator-1", 1000);
            registry.slash("validator-2", 1000);
            registry.slash("validator-3", 1000);

            assertThat(registry.eligibleCount()).isEqualTo(1);
            assertThat(registry.hasMinimumActiveSet()).isFalse();
            assertThat(fixture.sink.alerts(AlertType.VALIDATOR_SET_BELOW_MINIMUM)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Exit")
    class Exit {

        @Test
        @DisplayName("Should refuse an exit that would shrink the set below the minimum")
        void shouldRefuseExitBelowMinimum() {
            fixture.registerValidators(3);

            assertThatThrownBy(() -> registry.requestExit("validator-1"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("below minimum");
        }

        @Test
        @DisplayName("Should release stake only after the cooldown")
        void shouldCompleteExitAfterCooldown() {
            fixture.registerValidators(4);

            Validator exiting = registry.requestExit("validator-4");
            assertThat(exiting.isExiting()).isTrue();
            assertThat(registry.isEligible("validator-4")).isFalse();

            assertThatThrownBy(() -> registry.completeExit("validator-4")).isInstanceOf(ValidationException.class);

            fixture.clock.advance(Duration.ofDays(7));
            Validator released = registry.completeExit("validator-4");

            assertThat(released.getStakeAmount()).isEqualByComparingTo("10000");
            assertThat(registry.find("validator-4")).isEmpty();
        }
    }
}
