package com.waqiti.bridge.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TransferStatus enum
 *
 * @author Waqiti Platform Team
 */
class TransferStatusTest {

    @ParameterizedTest
    @EnumSource(value = TransferStatus.class, names = {"COMPLETED", "REFUNDED", "DROPPED"})
    void shouldIdentifyTerminalStatuses(TransferStatus status) {
        assertTrue(status.isTerminal(), status + " should be terminal");
    }

    @ParameterizedTest
    @EnumSource(value = TransferStatus.class, names = {"INITIATED", "CONFIRMED", "ATTESTING", "DISPUTED", "FINALIZED", "EXPIRED"})
    void shouldIdentifyNonTerminalStatuses(TransferStatus status) {
        assertFalse(status.isTerminal(), status + " should not be terminal");
    }

    @ParameterizedTest
    @EnumSource(value = TransferStatus.class, names = {"FINALIZED", "COMPLETED", "EXPIRED", "REFUNDED", "DROPPED"})
    void shouldCloseAttestationsOnceDecided(TransferStatus status) {
        assertTrue(status.isClosedForAttestation(), status + " should be closed for attestation");
    }

    @ParameterizedTest
    @MethodSource("provideValidTransitions")
    void shouldAllowValidStatusTransitions(TransferStatus from, TransferStatus to) {
        assertTrue(from.canTransitionTo(to),
            String.format("Should allow transition from %s to %s", from, to));
    }

    @ParameterizedTest
    @MethodSource("provideInvalidTransitions")
    void shouldRejectInvalidStatusTransitions(TransferStatus from, TransferStatus to) {
        assertFalse(from.canTransitionTo(to),
            String.format("Should reject transition from %s to %s", from, to));
    }

    @Test
    void shouldNotAllowTransitionFromTerminalStatus() {
        for (TransferStatus terminal : new TransferStatus[]{TransferStatus.COMPLETED, TransferStatus.REFUNDED, TransferStatus.DROPPED}) {
            for (TransferStatus target : TransferStatus.values()) {
                assertFalse(terminal.canTransitionTo(target),
                    terminal + " should not transition to " + target);
            }
        }
    }

    @Test
    void shouldNotAllowSelfTransition() {
        for (TransferStatus status : TransferStatus.values()) {
            assertThat(status.canTransitionTo(status)).isFalse();
        }
    }

    @Test
    void shouldRejectNullTarget() {
        assertThrows(IllegalArgumentException.class, () -> TransferStatus.ATTESTING.canTransitionTo(null));
    }

    @Test
    void shouldOnlyTreatAttestingAndDisputedAsPendingConsensus() {
        assertThat(Stream.of(TransferStatus.values()).filter(TransferStatus::isPendingConsensus))
            .containsExactlyInAnyOrder(TransferStatus.ATTESTING, TransferStatus.DISPUTED);
    }

    private static Stream<Arguments> provideValidTransitions() {
        return Stream.of(
            Arguments.of(TransferStatus.INITIATED, TransferStatus.CONFIRMED),
            Arguments.of(TransferStatus.INITIATED, TransferStatus.DROPPED),
            Arguments.of(TransferStatus.CONFIRMED, TransferStatus.ATTESTING),
            Arguments.of(TransferStatus.ATTESTING, TransferStatus.FINALIZED),
            Arguments.of(TransferStatus.ATTESTING, TransferStatus.EXPIRED),
            Arguments.of(TransferStatus.ATTESTING, TransferStatus.DISPUTED),
            Arguments.of(TransferStatus.DISPUTED, TransferStatus.ATTESTING),
            Arguments.of(TransferStatus.DISPUTED, TransferStatus.FINALIZED),
            Arguments.of(TransferStatus.DISPUTED, TransferStatus.EXPIRED),
            Arguments.of(TransferStatus.FINALIZED, TransferStatus.COMPLETED),
            Arguments.of(TransferStatus.EXPIRED, TransferStatus.REFUNDED)
        );
    }

    private static Stream<Arguments> provideInvalidTransitions() {
        return Stream.of(
            Arguments.of(TransferStatus.INITIATED, TransferStatus.ATTESTING),
            Arguments.of(TransferStatus.CONFIRMED, TransferStatus.FINALIZED),
            Arguments.of(TransferStatus.CONFIRMED, TransferStatus.DROPPED),
            Arguments.of(TransferStatus.ATTESTING, TransferStatus.DROPPED),
            Arguments.of(TransferStatus.ATTESTING, TransferStatus.COMPLETED),
            Arguments.of(TransferStatus.ATTESTING, TransferStatus.REFUNDED),
            Arguments.of(TransferStatus.FINALIZED, TransferStatus.EXPIRED),
            Arguments.of(TransferStatus.FINALIZED, TransferStatus.REFUNDED),
            Arguments.of(TransferStatus.EXPIRED, TransferStatus.COMPLETED),
            Arguments.of(TransferStatus.EXPIRED, TransferStatus.ATTESTING)
        );
    }
}
