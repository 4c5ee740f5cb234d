package com.questrail.fathom.protocol.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.fathom.protocol.codec.EnvelopeEncoder;
import com.questrail.fathom.protocol.model.Envelope;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import com.questrail.fathom.protocol.model.ExecutionResult;
import com.questrail.fathom.protocol.model.Payload;
import com.questrail.fathom.protocol.model.ProtocolError;
import com.questrail.fathom.protocol.model.ResourceLimits;

import java.util.Objects;

/**
 * Jackson-backed {@link EnvelopeEncoder}.
 *
 * <p>Produces a single-line JSON object per envelope. Jackson escapes embedded
 * newlines inside strings, so the output never contains a raw {@code '\n'} and
 * is safe for newline-delimited framing.</p>
 */
public final class JsonEnvelopeEncoder implements EnvelopeEncoder
{
    private final ObjectMapper mapper;

    public JsonEnvelopeEncoder() {
        this(new ObjectMapper());
    }

    public JsonEnvelopeEncoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");

        ObjectNode root = mapper.createObjectNode();
        root.put(JsonFields.VERSION, envelope.version());
        root.put(JsonFields.TYPE, envelope.type().wireName());
        envelope.executionId().ifPresent(id -> root.put(JsonFields.ID, id.value()));
        root.put(JsonFields.TIMESTAMP, JsonFields.formatTimestamp(envelope.timestamp()));

        ObjectNode payload = root.putObject(JsonFields.PAYLOAD);
        writePayload(payload, envelope.payload());

        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + envelope.type().wireName() + " envelope", e);
        }
    }

    private static void writePayload(ObjectNode node, Payload payload) {
        if (payload instanceof Payload.Execute execute) {
            writeRequest(node, execute.request());
        } else if (payload instanceof Payload.Status status) {
            node.put(JsonFields.STATUS, status.status().wireName());
        } else if (payload instanceof Payload.Output output) {
            node.put(JsonFields.DATA, output.data());
        } else if (payload instanceof Payload.Result result) {
            writeResult(node, result.result());
        } else if (payload instanceof Payload.Error error) {
            writeError(node, error.error());
        } else if (payload instanceof Payload.Pong pong) {
            pong.load().ifPresent(load -> {
                ObjectNode loadNode = node.putObject(JsonFields.LOAD);
                loadNode.put(JsonFields.ACTIVE_EXECUTIONS, load.activeExecutions());
                loadNode.put(JsonFields.QUEUE_DEPTH, load.queueDepth());
            });
        }
        // cancel, ping and ack carry an empty payload
    }

    private static void writeRequest(ObjectNode node, ExecutionRequest request) {
        node.put(JsonFields.LANGUAGE, request.language().name());
        node.put(JsonFields.CODE, request.code());
        request.stdin().ifPresent(stdin -> node.put(JsonFields.STDIN, stdin));

        if (!request.env().isEmpty()) {
            ObjectNode env = node.putObject(JsonFields.ENV);
            request.env().forEach(env::put);
        }

        ResourceLimits limits = request.limits();
        ObjectNode limitsNode = node.putObject(JsonFields.LIMITS);
        limitsNode.put(JsonFields.TIMEOUT_MS, limits.timeout().toMillis());
        limitsNode.put(JsonFields.MEMORY_MB, limits.memoryMb());
        limits.cpuShares().ifPresent(shares -> limitsNode.put(JsonFields.CPU_SHARES, shares));
        limitsNode.put(JsonFields.MAX_OUTPUT_BYTES, limits.maxOutputBytes());
    }

    private static void writeResult(ObjectNode node, ExecutionResult result) {
        if (result.exitCode().isPresent()) {
            node.put(JsonFields.EXIT_CODE, result.exitCode().getAsInt());
        } else {
            node.putNull(JsonFields.EXIT_CODE);
        }
        node.put(JsonFields.DURATION_MS, result.duration().toMillis());
        result.resourceUsage().ifPresent(usage -> {
            ObjectNode usageNode = node.putObject(JsonFields.RESOURCE_USAGE);
            usageNode.put(JsonFields.PEAK_MEMORY_BYTES, usage.peakMemoryBytes());
            usageNode.put(JsonFields.CPU_TIME_MS, usage.cpuTime().toMillis());
        });
    }

    private static void writeError(ObjectNode node, ProtocolError error) {
        node.put(JsonFields.ERROR_CODE, error.code().wireName());
        node.put(JsonFields.MESSAGE, error.message());
        node.put(JsonFields.RETRYABLE, error.retryable());
    }
}
