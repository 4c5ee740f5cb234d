package com.questrail.fathom.protocol.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageTypeTest
 * -----------------------------------------------------------------------------
 * Direction and id scope of the message catalogue, and the envelope checks
 * that rely on them.
 */
class MessageTypeTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void directionDecidesWhoMayReceive() {
        assertTrue(MessageType.EXECUTE.receivableBy(Role.RESPONDER));
        assertFalse(MessageType.EXECUTE.receivableBy(Role.INITIATOR));
        assertTrue(MessageType.PONG.receivableBy(Role.INITIATOR));
        assertFalse(MessageType.RESULT.receivableBy(Role.RESPONDER));
    }

    @Test
    void errorMayOrMayNotCarryAnId() {
        assertFalse(MessageType.ERROR.requiresExecutionId());
        assertFalse(MessageType.ERROR.forbidsExecutionId());
        assertTrue(MessageType.PING.forbidsExecutionId());
        assertTrue(MessageType.STDOUT.requiresExecutionId());
    }

    @Test
    void lookupByWireName() {
        assertEquals(Optional.of(MessageType.STDERR), MessageType.fromWireName("stderr"));
        assertTrue(MessageType.fromWireName("STDERR").isEmpty());
    }

    @Test
    void outputChannelsMapToMessageTypes() {
        assertEquals(OutputChannel.STDOUT, OutputChannel.of(MessageType.STDOUT));
        assertEquals(MessageType.STDERR, OutputChannel.STDERR.messageType());
    }

    @Test
    void envelopeRejectsIdScopeViolations() {
        assertThrows(IllegalArgumentException.class,
                () -> new Envelope(1, MessageType.PING, ExecutionId.of("x"), NOW, new Payload.Ping()));
        assertThrows(IllegalArgumentException.class,
                () -> new Envelope(1, MessageType.ACK, null, NOW, new Payload.Ack()));
    }

    @Test
    void envelopeRejectsMismatchedExecuteId() {
        ExecutionRequest request = ExecutionRequest.builder(ExecutionId.of("a"))
                .language(Language.PYTHON)
                .code("pass")
                .limits(ResourceLimits.of(Duration.ofSeconds(1), 64))
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> new Envelope(1, MessageType.EXECUTE, ExecutionId.of("b"), NOW, new Payload.Execute(request)));
    }

    @Test
    void pendingHasNoWireName() {
        assertThrows(IllegalStateException.class, ExecStatus.PENDING::wireName);
        assertFalse(ExecStatus.RUNNING.isTerminal());
        assertTrue(ExecStatus.OOM.isTerminal());
    }

    @Test
    void languageNamesAreCaseInsensitive() {
        assertEquals(Language.PYTHON, Language.of(" Python "));
        assertThrows(IllegalArgumentException.class, () -> Language.of("  "));
    }
}
