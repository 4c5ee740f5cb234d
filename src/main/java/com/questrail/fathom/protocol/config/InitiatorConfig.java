package com.questrail.fathom.protocol.config;

import com.questrail.fathom.protocol.FathomProtocol;
import com.questrail.fathom.protocol.internal.exec.ReconnectionPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Initiator behavior: version spoken, local deadline slack and reconnects.
 *
 * @param deadlineGrace        added to each request timeout before the initiator
 *                             gives up waiting for the responder
 * @param maxReconnectAttempts consecutive failed attempts before giving up; 0 means never
 */
public record InitiatorConfig(
        int protocolVersion,
        Duration deadlineGrace,
        Duration handshakeTimeout,
        ReconnectionPolicy reconnectionPolicy,
        int maxReconnectAttempts,
        int maxFrameBytes
) {
    public InitiatorConfig {
        Objects.requireNonNull(deadlineGrace, "deadlineGrace");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(reconnectionPolicy, "reconnectionPolicy");
        if (protocolVersion <= 0) {
            throw new IllegalArgumentException("protocolVersion must be positive");
        }
        if (deadlineGrace.isNegative()) {
            throw new IllegalArgumentException("deadlineGrace must be >= 0");
        }
        if (handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
            throw new IllegalArgumentException("handshakeTimeout must be positive");
        }
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 0");
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
    }

    public static InitiatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int protocolVersion = FathomProtocol.CURRENT_VERSION;
        private Duration deadlineGrace = Duration.ofSeconds(1);
        private Duration handshakeTimeout = Duration.ofSeconds(10);
        private ReconnectionPolicy reconnectionPolicy = ReconnectionPolicy.defaults();
        private int maxReconnectAttempts = 0;
        private int maxFrameBytes = FathomProtocol.DEFAULT_MAX_FRAME_BYTES;

        public Builder withProtocolVersion(int version) {
            this.protocolVersion = version;
            return this;
        }

        public Builder withDeadlineGrace(Duration grace) {
            this.deadlineGrace = grace;
            return this;
        }

        public Builder withHandshakeTimeout(Duration timeout) {
            this.handshakeTimeout = timeout;
            return this;
        }

        public Builder withReconnectionPolicy(ReconnectionPolicy policy) {
            this.reconnectionPolicy = policy;
            return this;
        }

        public Builder withMaxReconnectAttempts(int attempts) {
            this.maxReconnectAttempts = attempts;
            return this;
        }

        public Builder withMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public InitiatorConfig build() {
            return new InitiatorConfig(protocolVersion, deadlineGrace, handshakeTimeout,
                    reconnectionPolicy, maxReconnectAttempts, maxFrameBytes);
        }
    }
}
