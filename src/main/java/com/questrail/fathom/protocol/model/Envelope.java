package com.questrail.fathom.protocol.model;

import com.questrail.fathom.protocol.FathomProtocol;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Envelope
 * =============================================================================
 * Versioned wrapper common to every protocol message.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code executionId} is present for every execution-scoped type and absent
 *       for {@code ping}/{@code pong}; {@code error} may carry it or not</li>
 *   <li>the payload matches the message type</li>
 *   <li>an {@code execute} payload's request id equals the envelope id</li>
 * </ul>
 *
 * Envelopes are immutable. The factory methods stamp {@link FathomProtocol#CURRENT_VERSION}.
 */
public final class Envelope
{
    private final int version;
    private final MessageType type;
    private final ExecutionId executionId;
    private final Instant timestamp;
    private final Payload payload;

    public Envelope(int version,
                    MessageType type,
                    ExecutionId executionId,
                    Instant timestamp,
                    Payload payload) {
        this.version = version;
        this.type = Objects.requireNonNull(type, "type");
        this.executionId = executionId;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.payload = Objects.requireNonNull(payload, "payload");

        if (version <= 0) {
            throw new IllegalArgumentException("version must be positive");
        }
        if (type.requiresExecutionId() && executionId == null) {
            throw new IllegalArgumentException(type.wireName() + " requires an execution id");
        }
        if (type.forbidsExecutionId() && executionId != null) {
            throw new IllegalArgumentException(type.wireName() + " must not carry an execution id");
        }
        if (!payload.matches(type)) {
            throw new IllegalArgumentException(
                    "payload " + payload.getClass().getSimpleName() + " does not match type " + type.wireName());
        }
        if (payload instanceof Payload.Execute execute && !execute.request().id().equals(executionId)) {
            throw new IllegalArgumentException("execute request id does not match envelope id");
        }
    }

    public int version() {
        return version;
    }

    public MessageType type() {
        return type;
    }

    public Optional<ExecutionId> executionId() {
        return Optional.ofNullable(executionId);
    }

    /**
     * Returns the execution id of an execution-scoped envelope.
     *
     * @throws IllegalStateException if this envelope carries none
     */
    public ExecutionId requireExecutionId() {
        if (executionId == null) {
            throw new IllegalStateException(type.wireName() + " envelope carries no execution id");
        }
        return executionId;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public Payload payload() {
        return payload;
    }

    /**
     * Returns the payload cast to the expected record type.
     */
    public <P extends Payload> P payload(Class<P> expected) {
        return expected.cast(payload);
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    public static Envelope execute(ExecutionRequest request, Instant now) {
        return new Envelope(FathomProtocol.CURRENT_VERSION, MessageType.EXECUTE, request.id(), now,
                new Payload.Execute(request));
    }

    public static Envelope cancel(ExecutionId id, Instant now) {
        return new Envelope(FathomProtocol.CURRENT_VERSION, MessageType.CANCEL, id, now, new Payload.Cancel());
    }

    public static Envelope ping(Instant now) {
        return new Envelope(FathomProtocol.CURRENT_VERSION, MessageType.PING, null, now, new Payload.Ping());
    }

    public static Envelope ack(ExecutionId id, Instant now) {
        return new Envelope(FathomProtocol.CURRENT_VERSION, MessageType.ACK, id, now, new Payload.Ack());
    }

    public static Envelope status(ExecutionId id, ExecStatus status, Instant now) {
        return new Envelope(FathomProtocol.CURRENT_VERSION, MessageType.STATUS, id, now, new Payload.Status(status));
    }

    public static Envelope output(ExecutionId id, OutputChannel channel, String data, Instant now) {
        return new Envelope(FathomProtocol.CURRENT_VERSION, channel.messageType(), id, now, new Payload.Output(data));
    }

    public static Envelope result(ExecutionId id, ExecutionResult result, Instant now) {
        return new Envelope(FathomProtocol.CURRENT_VERSION, MessageType.RESULT, id, now, new Payload.Result(result));
    }

    /**
     * Error attributed to an execution (rejection or execution failure).
     */
    public static Envelope error(ExecutionId id, ProtocolError error, Instant now) {
        Objects.requireNonNull(id, "id");
        return new Envelope(FathomProtocol.CURRENT_VERSION, MessageType.ERROR, id, now, new Payload.Error(error));
    }

    /**
     * Connection-level error not attributed to any execution.
     */
    public static Envelope connectionError(ProtocolError error, Instant now) {
        return new Envelope(FathomProtocol.CURRENT_VERSION, MessageType.ERROR, null, now, new Payload.Error(error));
    }

    public static Envelope pong(Optional<ServerLoad> load, Instant now) {
        return new Envelope(FathomProtocol.CURRENT_VERSION, MessageType.PONG, null, now, new Payload.Pong(load));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Envelope other)) {
            return false;
        }
        return version == other.version
                && type == other.type
                && Objects.equals(executionId, other.executionId)
                && timestamp.equals(other.timestamp)
                && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, type, executionId, timestamp, payload);
    }

    @Override
    public String toString() {
        return "Envelope[v=" + version + ", type=" + type.wireName()
                + (executionId != null ? ", id=" + executionId : "")
                + ", ts=" + timestamp + ", payload=" + payload + "]";
    }
}
