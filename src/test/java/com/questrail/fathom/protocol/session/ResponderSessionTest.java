package com.questrail.fathom.protocol.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.fathom.protocol.backend.BackendExit;
import com.questrail.fathom.protocol.backend.OutputChunk;
import com.questrail.fathom.protocol.backend.ScriptedExecutionBackend;
import com.questrail.fathom.protocol.codec.impl.JsonEnvelopeDecoder;
import com.questrail.fathom.protocol.codec.impl.JsonEnvelopeEncoder;
import com.questrail.fathom.protocol.config.ResponderConfig;
import com.questrail.fathom.protocol.internal.exec.ExecutionSlots;
import com.questrail.fathom.protocol.internal.state.ExecutionStateReducer;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.Language;
import com.questrail.fathom.protocol.observability.ConnectionObservabilityEvent;
import com.questrail.fathom.protocol.observability.ProtocolObservabilityEvent;
import com.questrail.fathom.protocol.observability.RecordingObservabilitySink;
import com.questrail.fathom.protocol.time.DeterministicScheduler;
import com.questrail.fathom.protocol.time.ManualExecutor;
import com.questrail.fathom.protocol.time.ManualMonotonicClock;
import com.questrail.fathom.protocol.transport.FakeDuplexEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResponderSessionTest
 * -----------------------------------------------------------------------------
 * Drives a responder session through a fake endpoint with raw JSON frames and
 * a scripted backend, then checks the frames it wrote back.
 *
 * Machines drain inline. The backend pump runs inline too, except where a
 * test needs the program to still be running; those tests queue the pump on
 * a {@link ManualExecutor}.
 */
class ResponderSessionTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private FakeDuplexEndpoint endpoint;
    private ExecutionSlots slots;
    private ResponderSession session;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        endpoint = new FakeDuplexEndpoint();
    }

    private void open(ResponderConfig config, ScriptedExecutionBackend backend, Executor pumpExecutor) {
        SessionContext context = new SessionContext(new JsonEnvelopeDecoder(config.supportedVersions()),
                new JsonEnvelopeEncoder(), clock, () -> NOW, scheduler, Runnable::run, sink);
        slots = new ExecutionSlots(config.maxConcurrentExecutions());
        session = new ResponderSession(endpoint, context, config, backend, pumpExecutor, slots,
                new ExecutionStateReducer());
        endpoint.setListener(session);
        endpoint.connect();
    }

    private void open(ScriptedExecutionBackend backend, Executor pumpExecutor) {
        open(ResponderConfig.defaults(), backend, pumpExecutor);
    }

    // ---------------------------------------------------------------------
    // Frame helpers
    // ---------------------------------------------------------------------

    private static String execute(String id, String language, long timeoutMs, long maxOutputBytes) {
        return "{\"v\":1,\"type\":\"execute\",\"id\":\"" + id + "\",\"ts\":\"2024-05-01T12:00:00Z\","
                + "\"payload\":{\"language\":\"" + language + "\",\"code\":\"print(1)\","
                + "\"limits\":{\"timeout_ms\":" + timeoutMs + ",\"memory_mb\":128,"
                + "\"max_output_bytes\":" + maxOutputBytes + "}}}";
    }

    private static String execute(String id) {
        return execute(id, "python", 5000, 1024);
    }

    private static String cancel(String id) {
        return "{\"v\":1,\"type\":\"cancel\",\"id\":\"" + id + "\",\"ts\":\"2024-05-01T12:00:00Z\"}";
    }

    private static final String PING = "{\"v\":1,\"type\":\"ping\",\"ts\":\"2024-05-01T12:00:00Z\"}";

    private List<JsonNode> sent() {
        List<JsonNode> nodes = new ArrayList<>();
        for (String frame : endpoint.sentFrames()) {
            try {
                nodes.add(MAPPER.readTree(frame));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return nodes;
    }

    /** Sent frames as "type" or "type:detail" where the payload has a status or code. */
    private List<String> summary() {
        return sent().stream().map(node -> {
            String type = node.get("type").textValue();
            JsonNode payload = node.get("payload");
            if (payload.has("status")) {
                return type + ":" + payload.get("status").textValue();
            }
            if (payload.has("code")) {
                return type + ":" + payload.get("code").textValue();
            }
            return type;
        }).collect(Collectors.toList());
    }

    private JsonNode last(String type) {
        List<JsonNode> matching = sent().stream()
                .filter(n -> n.get("type").textValue().equals(type))
                .collect(Collectors.toList());
        assertFalse(matching.isEmpty(), "no " + type + " frame sent");
        return matching.get(matching.size() - 1);
    }

    // ---------------------------------------------------------------------
    // Happy path
    // ---------------------------------------------------------------------

    @Test
    void runsProgramToCompletion() {
        ScriptedExecutionBackend backend = ScriptedExecutionBackend.producing(BackendExit.exited(0),
                OutputChunk.stdout("1\n"));
        open(backend, Runnable::run);

        endpoint.inject(execute("run-1"));

        assertEquals(List.of("ack", "status:running", "stdout", "status:completed", "result"), summary());
        assertEquals("1\n", last("stdout").get("payload").get("data").textValue());
        assertEquals(0, last("result").get("payload").get("exit_code").intValue());
        assertTrue(sent().stream().allMatch(n -> "run-1".equals(n.get("id").textValue())));
        assertEquals(0, session.registry().size());
        assertEquals(0, slots.inUse());
        assertEquals(1, backend.started().size());
    }

    @Test
    void nonZeroExitIsStillCompleted() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(3), OutputChunk.stderr("bad\n")), Runnable::run);

        endpoint.inject(execute("run-1"));

        assertEquals(List.of("ack", "status:running", "stderr", "status:completed", "result"), summary());
        assertEquals(3, last("result").get("payload").get("exit_code").intValue());
    }

    @Test
    void oomKillEndsWithOomStatus() {
        open(ScriptedExecutionBackend.producing(BackendExit.oomKilled(null)), Runnable::run);

        endpoint.inject(execute("run-1"));

        assertEquals(List.of("ack", "status:running", "status:oom", "result"), summary());
        assertTrue(last("result").get("payload").get("exit_code").isNull());
    }

    @Test
    void firstFrameEstablishesTheConnection() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);
        assertFalse(session.isEstablished());

        endpoint.inject(PING);

        assertTrue(session.isEstablished());
        assertEquals(1, session.negotiatedVersion().getAsInt());
        assertTrue(sink.protocolKinds().contains(ProtocolObservabilityEvent.Kind.HANDSHAKE_COMPLETE));
        assertEquals(List.of(ConnectionObservabilityEvent.Kind.CONNECTED, ConnectionObservabilityEvent.Kind.ESTABLISHED),
                sink.connectionKinds());
    }

    @Test
    void pongReportsLoad() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), new ManualExecutor());

        endpoint.inject(execute("a"));
        endpoint.inject(PING);

        JsonNode pong = last("pong");
        assertFalse(pong.has("id"));
        assertEquals(0, pong.get("payload").get("load").get("active_executions").intValue());
        assertEquals(1, pong.get("payload").get("load").get("queue_depth").intValue());
    }

    // ---------------------------------------------------------------------
    // Admission
    // ---------------------------------------------------------------------

    @Test
    void unsupportedLanguageIsRejectedWithoutAck() {
        ScriptedExecutionBackend backend = ScriptedExecutionBackend.producing(BackendExit.exited(0));
        open(backend, Runnable::run);

        endpoint.inject(execute("r", "rust", 5000, 1024));

        assertEquals(List.of("error:LANGUAGE_NOT_SUPPORTED"), summary());
        JsonNode error = last("error");
        assertEquals("r", error.get("id").textValue());
        assertFalse(error.get("payload").get("retryable").booleanValue());
        assertTrue(backend.started().isEmpty());
        assertTrue(sink.protocolKinds().contains(ProtocolObservabilityEvent.Kind.REJECTED));
    }

    @Test
    void limitsOutsideBoundsAreRejected() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);

        endpoint.inject(execute("r", "python", 10 * 60 * 1000, 1024));

        assertEquals(List.of("error:INVALID_REQUEST"), summary());
        assertEquals(0, slots.inUse());
    }

    @Test
    void fullResponderAnswersOverloaded() {
        ResponderConfig config = ResponderConfig.builder().withMaxConcurrentExecutions(1).build();
        open(config, ScriptedExecutionBackend.producing(BackendExit.exited(0)), new ManualExecutor());

        endpoint.inject(execute("a"));
        endpoint.inject(execute("b"));

        assertEquals(List.of("ack", "error:SANDBOX_OVERLOADED"), summary());
        JsonNode error = last("error");
        assertEquals("b", error.get("id").textValue());
        assertTrue(error.get("payload").get("retryable").booleanValue());
    }

    @Test
    void duplicateIdIsRejectedAndReleasesItsSlot() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), new ManualExecutor());

        endpoint.inject(execute("a"));
        endpoint.inject(execute("a"));

        assertEquals(List.of("ack", "error:INVALID_REQUEST"), summary());
        assertEquals(1, slots.inUse());
        assertEquals(1, session.registry().size());
    }

    @Test
    void supportedLanguagesAreConfigurable() {
        ResponderConfig config = ResponderConfig.builder().withSupportedLanguages(Language.RUST).build();
        open(config, ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);

        endpoint.inject(execute("r", "rust", 5000, 1024));
        endpoint.inject(execute("p", "python", 5000, 1024));

        assertEquals("ack", summary().get(0));
        assertEquals("error:LANGUAGE_NOT_SUPPORTED", summary().get(summary().size() - 1));
    }

    // ---------------------------------------------------------------------
    // Ending early
    // ---------------------------------------------------------------------

    @Test
    void backendStartFailureReportsInternalError() {
        open(ScriptedExecutionBackend.failingToStart("no interpreter"), Runnable::run);

        endpoint.inject(execute("a"));

        assertEquals(List.of("ack", "error:INTERNAL_ERROR", "status:failed", "result"), summary());
        assertTrue(last("error").get("payload").get("retryable").booleanValue());
        assertEquals(0, slots.inUse());
    }

    @Test
    void outputOverLimitFailsAndCancels() {
        ScriptedExecutionBackend backend = ScriptedExecutionBackend.producing(BackendExit.exited(0),
                OutputChunk.stdout("12345"), OutputChunk.stdout("67890"), OutputChunk.stdout("X"));
        open(backend, Runnable::run);

        endpoint.inject(execute("a", "python", 5000, 10));

        assertEquals(List.of("ack", "status:running", "stdout", "stdout",
                "error:OUTPUT_LIMIT", "status:failed", "result"), summary());
        assertEquals(List.of(ExecutionId.of("a")), backend.cancelled());
    }

    @Test
    void cancelIsAckedAndStopsTheProgram() {
        ManualExecutor pumps = new ManualExecutor();
        ScriptedExecutionBackend backend = ScriptedExecutionBackend.producing(BackendExit.exited(0),
                OutputChunk.stdout("never\n"));
        open(backend, pumps);

        endpoint.inject(execute("a"));
        endpoint.inject(cancel("a"));

        assertEquals(List.of("ack", "ack", "status:cancelled", "result"), summary());
        assertTrue(last("result").get("payload").get("exit_code").isNull());

        // The program starts late; it must be cancelled and report nothing.
        pumps.runAll();

        assertTrue(backend.cancelled().contains(ExecutionId.of("a")));
        assertEquals(4, endpoint.sentFrames().size());
    }

    @Test
    void cancelForUnknownExecutionIsAnError() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);

        endpoint.inject(cancel("ghost"));

        assertEquals(List.of("error:UNKNOWN_EXECUTION"), summary());
        assertEquals("ghost", last("error").get("id").textValue());
        assertTrue(sink.protocolKinds().contains(ProtocolObservabilityEvent.Kind.UNKNOWN_EXECUTION));
    }

    @Test
    void cancelAfterCompletionIsUnknown() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);

        endpoint.inject(execute("a"));
        endpoint.inject(cancel("a"));

        assertEquals("error:UNKNOWN_EXECUTION", summary().get(summary().size() - 1));
    }

    @Test
    void deadlineTimesOutTheProgram() {
        ManualExecutor pumps = new ManualExecutor();
        ScriptedExecutionBackend backend = ScriptedExecutionBackend.producing(BackendExit.exited(0));
        open(backend, pumps);

        endpoint.inject(execute("a", "python", 2000, 1024));
        clock.advanceMillis(1999);
        scheduler.runDueTasks();
        assertEquals(List.of("ack"), summary());

        clock.advanceMillis(1);
        scheduler.runDueTasks();

        assertEquals(List.of("ack", "status:timeout", "result"), summary());
        assertEquals(2000, last("result").get("payload").get("duration_ms").longValue());
        assertEquals(0, slots.inUse());

        pumps.runAll();
        assertTrue(backend.cancelled().contains(ExecutionId.of("a")));
        assertEquals(3, endpoint.sentFrames().size());
    }

    @Test
    void disconnectAbandonsAndCancelsEverything() {
        ManualExecutor pumps = new ManualExecutor();
        ScriptedExecutionBackend backend = ScriptedExecutionBackend.producing(BackendExit.exited(0));
        open(backend, pumps);
        endpoint.inject(execute("a"));
        endpoint.inject(execute("b"));
        pumps.runAll();
        endpoint.clearSent();

        // Both already finished; start two more that are still pending.
        endpoint.inject(execute("c"));
        endpoint.inject(execute("d"));
        endpoint.clearSent();

        endpoint.drop(new IOException("reset by peer"));

        assertTrue(session.isClosed());
        assertTrue(endpoint.sentFrames().isEmpty());
        assertEquals(0, session.registry().size());
        assertEquals(0, slots.inUse());
        assertTrue(sink.connectionKinds().contains(ConnectionObservabilityEvent.Kind.DISCONNECTED));

        pumps.runAll();
        assertTrue(backend.cancelled().containsAll(List.of(ExecutionId.of("c"), ExecutionId.of("d"))));
        assertTrue(scheduler.pendingDeadlines().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Connection-level errors
    // ---------------------------------------------------------------------

    @Test
    void malformedFrameGetsConnectionErrorAndSessionStaysOpen() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);

        endpoint.inject("{ nope");

        assertEquals(List.of("error:INVALID_REQUEST"), summary());
        assertFalse(last("error").has("id"));
        assertFalse(session.isClosed());
        assertTrue(sink.protocolKinds().contains(ProtocolObservabilityEvent.Kind.DECODE_FAILURE));
    }

    @Test
    void malformedExecuteIsNeverAttributedToItsId() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);

        endpoint.inject("{\"v\":1,\"type\":\"execute\",\"id\":\"a\",\"ts\":\"2024-05-01T12:00:00Z\","
                + "\"payload\":{\"language\":\"python\",\"code\":\"x\"}}");

        assertFalse(last("error").has("id"));
        assertEquals(0, session.registry().size());
    }

    @Test
    void unsupportedVersionBeforeHandshakeClosesTheConnection() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);

        endpoint.inject("{\"v\":7,\"type\":\"ping\",\"ts\":\"2024-05-01T12:00:00Z\"}");

        assertEquals(List.of("error:INVALID_REQUEST"), summary());
        assertEquals(1, last("error").get("v").intValue());
        assertTrue(session.isClosed());
        assertFalse(endpoint.isOpen());
        assertTrue(sink.connectionKinds().contains(ConnectionObservabilityEvent.Kind.CLOSED));
    }

    @Test
    void unsupportedVersionAfterHandshakeOnlyErrors() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);
        endpoint.inject(PING);

        endpoint.inject("{\"v\":7,\"type\":\"ping\",\"ts\":\"2024-05-01T12:00:00Z\"}");

        assertFalse(session.isClosed());
        assertEquals(List.of("pong", "error:INVALID_REQUEST"), summary());
    }

    @Test
    void supportedVersionDifferentFromNegotiatedIsAViolation() {
        ResponderConfig config = ResponderConfig.builder().withSupportedVersions(Set.of(1, 2)).build();
        open(config, ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);
        endpoint.inject(PING);

        endpoint.inject("{\"v\":2,\"type\":\"ping\",\"ts\":\"2024-05-01T12:00:00Z\"}");

        assertFalse(session.isClosed());
        assertEquals(List.of("pong", "error:INVALID_REQUEST"), summary());
        assertEquals(1, last("error").get("v").intValue());
        assertEquals(1, session.negotiatedVersion().getAsInt());
        assertTrue(sink.protocolKinds().contains(ProtocolObservabilityEvent.Kind.PROTOCOL_VIOLATION));
    }

    @Test
    void responderBoundOnlyMessagesAreAccepted() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);

        endpoint.inject("{\"v\":1,\"type\":\"result\",\"id\":\"a\",\"ts\":\"2024-05-01T12:00:00Z\","
                + "\"payload\":{\"exit_code\":0,\"duration_ms\":1}}");

        assertEquals(List.of("error:INVALID_REQUEST"), summary());
        assertFalse(last("error").has("id"));
        assertTrue(sink.protocolKinds().contains(ProtocolObservabilityEvent.Kind.PROTOCOL_VIOLATION));
    }

    @Test
    void oversizedFrameIsReportedAsMalformed() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);

        endpoint.rejectFrame("frame exceeds 4194304 bytes");

        assertEquals(List.of("error:INVALID_REQUEST"), summary());
        assertTrue(last("error").get("payload").get("message").textValue().contains("4194304"));
    }

    @Test
    void framesAfterCloseAreIgnored() {
        open(ScriptedExecutionBackend.producing(BackendExit.exited(0)), Runnable::run);
        session.close();

        endpoint.inject(PING);

        assertTrue(endpoint.sentFrames().isEmpty());
    }
}
