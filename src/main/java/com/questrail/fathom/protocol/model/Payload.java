package com.questrail.fathom.protocol.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Type-specific body of an {@link Envelope}.
 *
 * <p>Every {@link MessageType} maps to exactly one payload record. The mapping is
 * checked when an envelope is constructed, so an envelope whose type and payload
 * disagree cannot exist.</p>
 */
public sealed interface Payload
        permits Payload.Execute, Payload.Cancel, Payload.Ping,
                Payload.Ack, Payload.Status, Payload.Output,
                Payload.Result, Payload.Error, Payload.Pong
{
    /**
     * Returns true if this payload may be carried by a message of the given type.
     */
    boolean matches(MessageType type);

    /** {@code execute}: the full request. Its id equals the envelope id. */
    record Execute(ExecutionRequest request) implements Payload {
        public Execute {
            Objects.requireNonNull(request, "request");
        }

        @Override
        public boolean matches(MessageType type) {
            return type == MessageType.EXECUTE;
        }
    }

    /** {@code cancel}: no body. */
    record Cancel() implements Payload {
        @Override
        public boolean matches(MessageType type) {
            return type == MessageType.CANCEL;
        }
    }

    /** {@code ping}: no body. */
    record Ping() implements Payload {
        @Override
        public boolean matches(MessageType type) {
            return type == MessageType.PING;
        }
    }

    /** {@code ack}: request received and queued. */
    record Ack() implements Payload {
        @Override
        public boolean matches(MessageType type) {
            return type == MessageType.ACK;
        }
    }

    /** {@code status}: any status except {@code PENDING}. */
    record Status(ExecStatus status) implements Payload {
        public Status {
            Objects.requireNonNull(status, "status");
            if (status == ExecStatus.PENDING) {
                throw new IllegalArgumentException("PENDING is never sent as a status");
            }
        }

        @Override
        public boolean matches(MessageType type) {
            return type == MessageType.STATUS;
        }
    }

    /** {@code stdout} / {@code stderr}: one chunk of output. */
    record Output(String data) implements Payload {
        public Output {
            Objects.requireNonNull(data, "data");
        }

        @Override
        public boolean matches(MessageType type) {
            return type == MessageType.STDOUT || type == MessageType.STDERR;
        }
    }

    /** {@code result}: final figures after a terminal status. */
    record Result(ExecutionResult result) implements Payload {
        public Result {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public boolean matches(MessageType type) {
            return type == MessageType.RESULT;
        }
    }

    /** {@code error}: rejection, execution failure or connection-level failure. */
    record Error(ProtocolError error) implements Payload {
        public Error {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean matches(MessageType type) {
            return type == MessageType.ERROR;
        }
    }

    /** {@code pong}: optional load snapshot. */
    record Pong(Optional<ServerLoad> load) implements Payload {
        public Pong {
            Objects.requireNonNull(load, "load");
        }

        @Override
        public boolean matches(MessageType type) {
            return type == MessageType.PONG;
        }
    }
}
