package com.questrail.fathom.protocol.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.fathom.protocol.FathomProtocol;
import com.questrail.fathom.protocol.codec.EnvelopeDecodeException;
import com.questrail.fathom.protocol.codec.EnvelopeDecodeException.Reason;
import com.questrail.fathom.protocol.codec.EnvelopeDecoder;
import com.questrail.fathom.protocol.model.Envelope;
import com.questrail.fathom.protocol.model.ErrorCode;
import com.questrail.fathom.protocol.model.ExecStatus;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import com.questrail.fathom.protocol.model.ExecutionResult;
import com.questrail.fathom.protocol.model.Language;
import com.questrail.fathom.protocol.model.MessageType;
import com.questrail.fathom.protocol.model.Payload;
import com.questrail.fathom.protocol.model.ProtocolError;
import com.questrail.fathom.protocol.model.ResourceLimits;
import com.questrail.fathom.protocol.model.ResourceUsage;
import com.questrail.fathom.protocol.model.ServerLoad;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * JsonEnvelopeDecoder
 * ============================================================================
 * Jackson-backed {@link EnvelopeDecoder} for the JSON wire format.
 *
 * <h2>Validation order</h2>
 * <ol>
 *   <li>The frame parses as a JSON object</li>
 *   <li>{@code v} is present, integral and supported</li>
 *   <li>{@code type} is present and in the catalogue</li>
 *   <li>{@code ts} is present and ISO-8601</li>
 *   <li>{@code id} is present or absent as the type's scope demands</li>
 *   <li>{@code payload} has the shape required by the type</li>
 * </ol>
 *
 * The version is checked before the type so that a peer speaking a future
 * protocol is told so, even if it uses message types this decoder has never
 * seen.
 */
public final class JsonEnvelopeDecoder implements EnvelopeDecoder
{
    private final ObjectMapper mapper;
    private final Set<Integer> supportedVersions;

    public JsonEnvelopeDecoder() {
        this(new ObjectMapper(), FathomProtocol.SUPPORTED_VERSIONS);
    }

    public JsonEnvelopeDecoder(Set<Integer> supportedVersions) {
        this(new ObjectMapper(), supportedVersions);
    }

    public JsonEnvelopeDecoder(ObjectMapper mapper, Set<Integer> supportedVersions) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.supportedVersions = Set.copyOf(Objects.requireNonNull(supportedVersions, "supportedVersions"));
        if (this.supportedVersions.isEmpty()) {
            throw new IllegalArgumentException("at least one supported version is required");
        }
    }

    @Override
    public Envelope decode(byte[] frame) {
        Objects.requireNonNull(frame, "frame");

        final JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (IOException e) {
            throw new EnvelopeDecodeException(Reason.MALFORMED, "Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new EnvelopeDecodeException(Reason.MALFORMED, "Frame is not a JSON object");
        }

        int version = requireInt(root, JsonFields.VERSION);
        if (!supportedVersions.contains(version)) {
            throw EnvelopeDecodeException.unsupportedVersion(version);
        }

        String typeName = requireText(root, JsonFields.TYPE);
        MessageType type = MessageType.fromWireName(typeName)
                .orElseThrow(() -> new EnvelopeDecodeException(Reason.UNKNOWN_TYPE,
                        "Unknown message type: " + typeName));

        Instant timestamp = parseTimestamp(requireText(root, JsonFields.TIMESTAMP));
        ExecutionId id = decodeExecutionId(root, type);
        JsonNode payloadNode = payloadNode(root);

        Payload payload = switch (type) {
            case EXECUTE -> new Payload.Execute(decodeRequest(id, payloadNode));
            case CANCEL -> new Payload.Cancel();
            case PING -> new Payload.Ping();
            case ACK -> new Payload.Ack();
            case STATUS -> decodeStatus(payloadNode);
            case STDOUT, STDERR -> new Payload.Output(requireText(payloadNode, JsonFields.DATA));
            case RESULT -> new Payload.Result(decodeResult(payloadNode));
            case ERROR -> new Payload.Error(decodeError(payloadNode));
            case PONG -> new Payload.Pong(decodeLoad(payloadNode));
        };

        try {
            return new Envelope(version, type, id, timestamp, payload);
        } catch (IllegalArgumentException e) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, e.getMessage(), e);
        }
    }

    // ========================================================================
    // Envelope fields
    // ========================================================================

    private static ExecutionId decodeExecutionId(JsonNode root, MessageType type) {
        JsonNode node = root.get(JsonFields.ID);
        boolean present = node != null && !node.isNull();

        if (type.requiresExecutionId() && !present) {
            throw new EnvelopeDecodeException(Reason.MISSING_FIELD,
                    type.wireName() + " requires field '" + JsonFields.ID + "'");
        }
        if (type.forbidsExecutionId() && present) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD,
                    type.wireName() + " must not carry field '" + JsonFields.ID + "'");
        }
        if (!present) {
            return null;
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field 'id' must be a non-blank string");
        }
        return ExecutionId.of(node.asText());
    }

    private static JsonNode payloadNode(JsonNode root) {
        JsonNode node = root.get(JsonFields.PAYLOAD);
        if (node == null || node.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!node.isObject()) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field 'payload' must be an object");
        }
        return node;
    }

    private static Instant parseTimestamp(String text) {
        try {
            return JsonFields.parseTimestamp(text);
        } catch (DateTimeException e) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field 'ts' is not ISO-8601: " + text, e);
        }
    }

    // ========================================================================
    // Initiator -> responder payloads
    // ========================================================================

    private static ExecutionRequest decodeRequest(ExecutionId id, JsonNode payload) {
        Language language;
        try {
            language = Language.of(requireText(payload, JsonFields.LANGUAGE));
        } catch (IllegalArgumentException e) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field 'language' must not be blank", e);
        }
        String code = requireText(payload, JsonFields.CODE);
        String stdin = optionalText(payload, JsonFields.STDIN).orElse(null);

        ExecutionRequest.Builder builder = ExecutionRequest.builder(id)
                .language(language)
                .code(code)
                .stdin(stdin)
                .limits(decodeLimits(requireObject(payload, JsonFields.LIMITS)));

        JsonNode env = payload.get(JsonFields.ENV);
        if (env != null && !env.isNull()) {
            if (!env.isObject()) {
                throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field 'env' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = env.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (!entry.getValue().isTextual()) {
                    throw new EnvelopeDecodeException(Reason.INVALID_FIELD,
                            "Environment variable '" + entry.getKey() + "' must be a string");
                }
                builder.env(entry.getKey(), entry.getValue().asText());
            }
        }

        return builder.build();
    }

    private static ResourceLimits decodeLimits(JsonNode limits) {
        long timeoutMs = requireLong(limits, JsonFields.TIMEOUT_MS);
        long memoryMb = requireLong(limits, JsonFields.MEMORY_MB);
        OptionalInt cpuShares = optionalInt(limits, JsonFields.CPU_SHARES);
        long maxOutputBytes = optionalLong(limits, JsonFields.MAX_OUTPUT_BYTES)
                .orElse(FathomProtocol.DEFAULT_MAX_OUTPUT_BYTES);

        try {
            return new ResourceLimits(Duration.ofMillis(timeoutMs), memoryMb, cpuShares, maxOutputBytes);
        } catch (IllegalArgumentException e) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Invalid limits: " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // Responder -> initiator payloads
    // ========================================================================

    private static Payload.Status decodeStatus(JsonNode payload) {
        String name = requireText(payload, JsonFields.STATUS);
        ExecStatus status = ExecStatus.fromWireName(name)
                .orElseThrow(() -> new EnvelopeDecodeException(Reason.INVALID_FIELD, "Unknown status: " + name));
        return new Payload.Status(status);
    }

    private static ExecutionResult decodeResult(JsonNode payload) {
        OptionalInt exitCode = optionalInt(payload, JsonFields.EXIT_CODE);

        long durationMs = requireLong(payload, JsonFields.DURATION_MS);
        if (durationMs < 0) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field 'duration_ms' must be >= 0");
        }

        Optional<ResourceUsage> usage = Optional.empty();
        JsonNode usageNode = payload.get(JsonFields.RESOURCE_USAGE);
        if (usageNode != null && !usageNode.isNull()) {
            if (!usageNode.isObject()) {
                throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field 'resource_usage' must be an object");
            }
            try {
                usage = Optional.of(new ResourceUsage(
                        requireLong(usageNode, JsonFields.PEAK_MEMORY_BYTES),
                        Duration.ofMillis(requireLong(usageNode, JsonFields.CPU_TIME_MS))));
            } catch (IllegalArgumentException e) {
                throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Invalid resource usage: " + e.getMessage(), e);
            }
        }

        return new ExecutionResult(exitCode, Duration.ofMillis(durationMs), usage);
    }

    private static ProtocolError decodeError(JsonNode payload) {
        String codeName = requireText(payload, JsonFields.ERROR_CODE);
        ErrorCode code = ErrorCode.fromWireName(codeName)
                .orElseThrow(() -> new EnvelopeDecodeException(Reason.INVALID_FIELD, "Unknown error code: " + codeName));

        String message = optionalText(payload, JsonFields.MESSAGE).orElse("");

        boolean retryable = code.retryable();
        JsonNode retryableNode = payload.get(JsonFields.RETRYABLE);
        if (retryableNode != null && !retryableNode.isNull()) {
            if (!retryableNode.isBoolean()) {
                throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field 'retryable' must be a boolean");
            }
            retryable = retryableNode.booleanValue();
        }

        return new ProtocolError(code, message, retryable);
    }

    private static Optional<ServerLoad> decodeLoad(JsonNode payload) {
        JsonNode load = payload.get(JsonFields.LOAD);
        if (load == null || load.isNull()) {
            return Optional.empty();
        }
        if (!load.isObject()) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field 'load' must be an object");
        }
        try {
            return Optional.of(new ServerLoad(
                    requireInt(load, JsonFields.ACTIVE_EXECUTIONS),
                    requireInt(load, JsonFields.QUEUE_DEPTH)));
        } catch (IllegalArgumentException e) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Invalid load: " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // Field helpers
    // ========================================================================

    private static JsonNode requirePresent(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new EnvelopeDecodeException(Reason.MISSING_FIELD, "Missing required field '" + field + "'");
        }
        return node;
    }

    private static String requireText(JsonNode parent, String field) {
        JsonNode node = requirePresent(parent, field);
        if (!node.isTextual()) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field '" + field + "' must be a string");
        }
        return node.asText();
    }

    private static Optional<String> optionalText(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isTextual()) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field '" + field + "' must be a string");
        }
        return Optional.of(node.asText());
    }

    private static JsonNode requireObject(JsonNode parent, String field) {
        JsonNode node = requirePresent(parent, field);
        if (!node.isObject()) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field '" + field + "' must be an object");
        }
        return node;
    }

    private static int requireInt(JsonNode parent, String field) {
        JsonNode node = requirePresent(parent, field);
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field '" + field + "' must be an integer");
        }
        return node.intValue();
    }

    private static long requireLong(JsonNode parent, String field) {
        JsonNode node = requirePresent(parent, field);
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field '" + field + "' must be an integer");
        }
        return node.longValue();
    }

    private static Optional<Long> optionalLong(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field '" + field + "' must be an integer");
        }
        return Optional.of(node.longValue());
    }

    private static OptionalInt optionalInt(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return OptionalInt.empty();
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new EnvelopeDecodeException(Reason.INVALID_FIELD, "Field '" + field + "' must be an integer");
        }
        return OptionalInt.of(node.intValue());
    }
}
