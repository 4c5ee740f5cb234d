package com.questrail.fathom.protocol.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * MessageType
 * -----------------------------------------------------------------------------
 * Closed catalogue of protocol message types.
 *
 * <p>Dispatch on message types is exhaustive. A type name that is not listed
 * here is a decode failure at the codec boundary; it is never silently
 * ignored.</p>
 *
 * <h2>Execution scoping</h2>
 * <ul>
 *   <li>{@link Scope#EXECUTION}: the envelope MUST carry an execution id</li>
 *   <li>{@link Scope#CONNECTION}: the envelope MUST NOT carry an execution id</li>
 *   <li>{@link Scope#EITHER}: {@code error} carries the id when it answers a
 *       specific request and omits it for connection-level failures</li>
 * </ul>
 */
public enum MessageType {

    // Initiator -> responder
    EXECUTE("execute", Direction.TO_RESPONDER, Scope.EXECUTION),
    CANCEL("cancel", Direction.TO_RESPONDER, Scope.EXECUTION),
    PING("ping", Direction.TO_RESPONDER, Scope.CONNECTION),

    // Responder -> initiator
    ACK("ack", Direction.TO_INITIATOR, Scope.EXECUTION),
    STATUS("status", Direction.TO_INITIATOR, Scope.EXECUTION),
    STDOUT("stdout", Direction.TO_INITIATOR, Scope.EXECUTION),
    STDERR("stderr", Direction.TO_INITIATOR, Scope.EXECUTION),
    RESULT("result", Direction.TO_INITIATOR, Scope.EXECUTION),
    ERROR("error", Direction.TO_INITIATOR, Scope.EITHER),
    PONG("pong", Direction.TO_INITIATOR, Scope.CONNECTION);

    /** Which role receives a message of this type. */
    public enum Direction {
        TO_RESPONDER,
        TO_INITIATOR
    }

    /** Whether an execution id accompanies the message. */
    public enum Scope {
        EXECUTION,
        CONNECTION,
        EITHER
    }

    private static final Map<String, MessageType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::wireName, Function.identity()));

    private final String wireName;
    private final Direction direction;
    private final Scope scope;

    MessageType(String wireName, Direction direction, Scope scope) {
        this.wireName = wireName;
        this.direction = direction;
        this.scope = scope;
    }

    public String wireName() {
        return wireName;
    }

    public Direction direction() {
        return direction;
    }

    public Scope scope() {
        return scope;
    }

    public boolean requiresExecutionId() {
        return scope == Scope.EXECUTION;
    }

    public boolean forbidsExecutionId() {
        return scope == Scope.CONNECTION;
    }

    /**
     * Returns true if a peer playing {@code role} may legitimately receive this type.
     */
    public boolean receivableBy(Role role) {
        return switch (role) {
            case RESPONDER -> direction == Direction.TO_RESPONDER;
            case INITIATOR -> direction == Direction.TO_INITIATOR;
        };
    }

    public static Optional<MessageType> fromWireName(String wireName) {
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }
}
