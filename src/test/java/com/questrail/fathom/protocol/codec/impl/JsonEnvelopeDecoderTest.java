package com.questrail.fathom.protocol.codec.impl;

import com.questrail.fathom.protocol.codec.EnvelopeDecodeException;
import com.questrail.fathom.protocol.codec.EnvelopeDecodeException.Reason;
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
import com.questrail.fathom.protocol.model.ServerLoad;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JsonEnvelopeDecoderTest
 * -----------------------------------------------------------------------------
 * Decoding of well-formed frames into envelopes, and classification of every
 * way a frame can be rejected.
 */
class JsonEnvelopeDecoderTest {

    private final JsonEnvelopeDecoder decoder = new JsonEnvelopeDecoder();

    private Envelope decode(String json) {
        return decoder.decode(json.getBytes(StandardCharsets.UTF_8));
    }

    private EnvelopeDecodeException reject(String json) {
        return assertThrows(EnvelopeDecodeException.class, () -> decode(json));
    }

    // ---------------------------------------------------------------------
    // Well-formed frames
    // ---------------------------------------------------------------------

    @Test
    void decodesExecuteWithAllFields() {
        Envelope envelope = decode("""
                {"v":1,"type":"execute","id":"run-1","ts":"2024-05-01T12:00:00.250Z",
                 "payload":{"language":"Python","code":"print(1)","stdin":"in",
                            "env":{"A":"1","B":"two"},
                            "limits":{"timeout_ms":5000,"memory_mb":256,"cpu_shares":512,"max_output_bytes":2048}}}
                """);

        assertEquals(1, envelope.version());
        assertEquals(MessageType.EXECUTE, envelope.type());
        assertEquals(Optional.of(ExecutionId.of("run-1")), envelope.executionId());
        assertEquals(Instant.parse("2024-05-01T12:00:00.250Z"), envelope.timestamp());

        ExecutionRequest request = envelope.payload(Payload.Execute.class).request();
        assertEquals(Language.PYTHON, request.language());
        assertEquals("print(1)", request.code());
        assertEquals(Optional.of("in"), request.stdin());
        assertEquals("two", request.env().get("B"));
        assertEquals(Duration.ofSeconds(5), request.limits().timeout());
        assertEquals(256, request.limits().memoryMb());
        assertEquals(512, request.limits().cpuShares().getAsInt());
        assertEquals(2048, request.limits().maxOutputBytes());
    }

    @Test
    void executeWithoutOptionalLimitsUsesDefaults() {
        Envelope envelope = decode("""
                {"v":1,"type":"execute","id":"r","ts":"2024-05-01T12:00:00Z",
                 "payload":{"language":"bash","code":"true","limits":{"timeout_ms":100,"memory_mb":64}}}
                """);

        ExecutionRequest request = envelope.payload(Payload.Execute.class).request();
        assertTrue(request.limits().cpuShares().isEmpty());
        assertEquals(1024 * 1024, request.limits().maxOutputBytes());
        assertTrue(request.env().isEmpty());
        assertTrue(request.stdin().isEmpty());
    }

    @Test
    void acceptsTimestampWithOffset() {
        Envelope envelope = decode("{\"v\":1,\"type\":\"ping\",\"ts\":\"2024-05-01T14:00:00+02:00\"}");

        assertEquals(Instant.parse("2024-05-01T12:00:00Z"), envelope.timestamp());
    }

    @Test
    void missingPayloadIsTreatedAsEmpty() {
        Envelope envelope = decode("{\"v\":1,\"type\":\"cancel\",\"id\":\"r\",\"ts\":\"2024-05-01T12:00:00Z\"}");

        assertEquals(MessageType.CANCEL, envelope.type());
        assertInstanceOf(Payload.Cancel.class, envelope.payload());
    }

    @Test
    void decodesStatusAndOutput() {
        Envelope status = decode("""
                {"v":1,"type":"status","id":"r","ts":"2024-05-01T12:00:00Z","payload":{"status":"timeout"}}
                """);
        Envelope stderr = decode("""
                {"v":1,"type":"stderr","id":"r","ts":"2024-05-01T12:00:00Z","payload":{"data":"oops\\n"}}
                """);

        assertEquals(ExecStatus.TIMEOUT, status.payload(Payload.Status.class).status());
        assertEquals(MessageType.STDERR, stderr.type());
        assertEquals("oops\n", stderr.payload(Payload.Output.class).data());
    }

    @Test
    void decodesResultWithNullExitCode() {
        Envelope envelope = decode("""
                {"v":1,"type":"result","id":"r","ts":"2024-05-01T12:00:00Z",
                 "payload":{"exit_code":null,"duration_ms":1500,
                            "resource_usage":{"peak_memory_bytes":4096,"cpu_time_ms":20}}}
                """);

        ExecutionResult result = envelope.payload(Payload.Result.class).result();
        assertTrue(result.exitCode().isEmpty());
        assertEquals(Duration.ofMillis(1500), result.duration());
        assertEquals(4096, result.resourceUsage().orElseThrow().peakMemoryBytes());
        assertEquals(Duration.ofMillis(20), result.resourceUsage().orElseThrow().cpuTime());
    }

    @Test
    void errorRetryableDefaultsFromCode() {
        Envelope envelope = decode("""
                {"v":1,"type":"error","id":"r","ts":"2024-05-01T12:00:00Z",
                 "payload":{"code":"SANDBOX_OVERLOADED","message":"busy"}}
                """);

        ProtocolError error = envelope.payload(Payload.Error.class).error();
        assertEquals(ErrorCode.SANDBOX_OVERLOADED, error.code());
        assertEquals("busy", error.message());
        assertTrue(error.retryable());
    }

    @Test
    void connectionLevelErrorHasNoId() {
        Envelope envelope = decode("""
                {"v":1,"type":"error","ts":"2024-05-01T12:00:00Z",
                 "payload":{"code":"INVALID_REQUEST","message":"bad frame","retryable":false}}
                """);

        assertTrue(envelope.executionId().isEmpty());
        assertEquals(ErrorCode.INVALID_REQUEST, envelope.payload(Payload.Error.class).error().code());
    }

    @Test
    void decodesPongWithAndWithoutLoad() {
        Envelope loaded = decode("""
                {"v":1,"type":"pong","ts":"2024-05-01T12:00:00Z",
                 "payload":{"load":{"active_executions":3,"queue_depth":0}}}
                """);
        Envelope bare = decode("{\"v\":1,\"type\":\"pong\",\"ts\":\"2024-05-01T12:00:00Z\",\"payload\":{}}");

        assertEquals(Optional.of(new ServerLoad(3, 0)), loaded.payload(Payload.Pong.class).load());
        assertTrue(bare.payload(Payload.Pong.class).load().isEmpty());
    }

    @Test
    void onlyConfiguredVersionsAreAccepted() {
        JsonEnvelopeDecoder v2 = new JsonEnvelopeDecoder(Set.of(2));
        byte[] frame = "{\"v\":2,\"type\":\"ping\",\"ts\":\"2024-05-01T12:00:00Z\"}".getBytes(StandardCharsets.UTF_8);

        assertEquals(2, v2.decode(frame).version());
        EnvelopeDecodeException e = assertThrows(EnvelopeDecodeException.class, () -> decoder.decode(frame));
        assertEquals(Reason.UNSUPPORTED_VERSION, e.reason());
        assertEquals(2, e.version().getAsInt());
    }

    // ---------------------------------------------------------------------
    // Rejections
    // ---------------------------------------------------------------------

    @Test
    void rejectsNonJson() {
        EnvelopeDecodeException e = reject("not json {");

        assertEquals(Reason.MALFORMED, e.reason());
        assertEquals(ErrorCode.INVALID_REQUEST, e.code());
    }

    @Test
    void rejectsJsonThatIsNotAnObject() {
        assertEquals(Reason.MALFORMED, reject("[1,2,3]").reason());
    }

    @Test
    void rejectsMissingOrNonIntegralVersion() {
        assertEquals(Reason.MISSING_FIELD,
                reject("{\"type\":\"ping\",\"ts\":\"2024-05-01T12:00:00Z\"}").reason());
        assertEquals(Reason.INVALID_FIELD,
                reject("{\"v\":\"1\",\"type\":\"ping\",\"ts\":\"2024-05-01T12:00:00Z\"}").reason());
    }

    @Test
    void versionIsCheckedBeforeType() {
        EnvelopeDecodeException e = reject("{\"v\":9,\"type\":\"teleport\",\"ts\":\"2024-05-01T12:00:00Z\"}");

        assertEquals(Reason.UNSUPPORTED_VERSION, e.reason());
    }

    @Test
    void rejectsUnknownType() {
        assertEquals(Reason.UNKNOWN_TYPE,
                reject("{\"v\":1,\"type\":\"teleport\",\"ts\":\"2024-05-01T12:00:00Z\"}").reason());
    }

    @Test
    void rejectsBadTimestamp() {
        assertEquals(Reason.INVALID_FIELD,
                reject("{\"v\":1,\"type\":\"ping\",\"ts\":\"yesterday\"}").reason());
        assertEquals(Reason.MISSING_FIELD,
                reject("{\"v\":1,\"type\":\"ping\"}").reason());
    }

    @Test
    void executionScopedTypesRequireId() {
        assertEquals(Reason.MISSING_FIELD,
                reject("{\"v\":1,\"type\":\"ack\",\"ts\":\"2024-05-01T12:00:00Z\"}").reason());
    }

    @Test
    void connectionScopedTypesForbidId() {
        assertEquals(Reason.INVALID_FIELD,
                reject("{\"v\":1,\"type\":\"ping\",\"id\":\"r\",\"ts\":\"2024-05-01T12:00:00Z\"}").reason());
    }

    @Test
    void rejectsBlankLanguage() {
        EnvelopeDecodeException e = reject("""
                {"v":1,"type":"execute","id":"r","ts":"2024-05-01T12:00:00Z",
                 "payload":{"language":" ","code":"x","limits":{"timeout_ms":100,"memory_mb":64}}}
                """);

        assertEquals(Reason.INVALID_FIELD, e.reason());
    }

    @Test
    void executeRequiresLimitsWithTimeoutAndMemory() {
        assertEquals(Reason.MISSING_FIELD, reject("""
                {"v":1,"type":"execute","id":"r","ts":"2024-05-01T12:00:00Z",
                 "payload":{"language":"python","code":"x"}}
                """).reason());
        assertEquals(Reason.MISSING_FIELD, reject("""
                {"v":1,"type":"execute","id":"r","ts":"2024-05-01T12:00:00Z",
                 "payload":{"language":"python","code":"x","limits":{"timeout_ms":100}}}
                """).reason());
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertEquals(Reason.INVALID_FIELD, reject("""
                {"v":1,"type":"execute","id":"r","ts":"2024-05-01T12:00:00Z",
                 "payload":{"language":"python","code":"x","limits":{"timeout_ms":0,"memory_mb":64}}}
                """).reason());
    }

    @Test
    void rejectsNonStringEnvironmentValue() {
        assertEquals(Reason.INVALID_FIELD, reject("""
                {"v":1,"type":"execute","id":"r","ts":"2024-05-01T12:00:00Z",
                 "payload":{"language":"python","code":"x","env":{"N":5},
                            "limits":{"timeout_ms":100,"memory_mb":64}}}
                """).reason());
    }

    @Test
    void rejectsNegativeDuration() {
        assertEquals(Reason.INVALID_FIELD, reject("""
                {"v":1,"type":"result","id":"r","ts":"2024-05-01T12:00:00Z",
                 "payload":{"exit_code":0,"duration_ms":-1}}
                """).reason());
    }

    @Test
    void rejectsUnknownStatusAndErrorCode() {
        assertEquals(Reason.INVALID_FIELD, reject("""
                {"v":1,"type":"status","id":"r","ts":"2024-05-01T12:00:00Z","payload":{"status":"pending"}}
                """).reason());
        assertEquals(Reason.INVALID_FIELD, reject("""
                {"v":1,"type":"error","id":"r","ts":"2024-05-01T12:00:00Z","payload":{"code":"NOPE"}}
                """).reason());
    }

    @Test
    void rejectsPayloadThatIsNotAnObject() {
        assertEquals(Reason.INVALID_FIELD,
                reject("{\"v\":1,\"type\":\"ping\",\"ts\":\"2024-05-01T12:00:00Z\",\"payload\":[]}").reason());
    }
}
