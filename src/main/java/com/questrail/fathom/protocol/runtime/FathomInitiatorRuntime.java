package com.questrail.fathom.protocol.runtime;

import com.questrail.fathom.protocol.FathomProtocolException;
import com.questrail.fathom.protocol.codec.impl.JsonEnvelopeDecoder;
import com.questrail.fathom.protocol.codec.impl.JsonEnvelopeEncoder;
import com.questrail.fathom.protocol.config.InitiatorConfig;
import com.questrail.fathom.protocol.internal.exec.ReconnectBackoff;
import com.questrail.fathom.protocol.internal.state.ExecutionStateReducer;
import com.questrail.fathom.protocol.internal.time.MonotonicClock;
import com.questrail.fathom.protocol.internal.time.ScheduledExecutorScheduler;
import com.questrail.fathom.protocol.internal.time.SystemMonotonicClock;
import com.questrail.fathom.protocol.internal.time.SystemWallClock;
import com.questrail.fathom.protocol.model.ErrorCode;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import com.questrail.fathom.protocol.model.Role;
import com.questrail.fathom.protocol.model.ServerLoad;
import com.questrail.fathom.protocol.observability.FathomErrorEvent;
import com.questrail.fathom.protocol.observability.FathomObservabilitySink;
import com.questrail.fathom.protocol.observability.NullObservabilitySink;
import com.questrail.fathom.protocol.observability.Slf4jFathomObservabilitySink;
import com.questrail.fathom.protocol.observability.ProtocolObservabilityEvent;
import com.questrail.fathom.protocol.session.ExecutionListener;
import com.questrail.fathom.protocol.session.InitiatorSession;
import com.questrail.fathom.protocol.session.PendingExecution;
import com.questrail.fathom.protocol.session.SessionContext;
import com.questrail.fathom.protocol.transport.tcp.netty.NettyTcpConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * FathomInitiatorRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a client of one responder.
 *
 * <h2>Connection management</h2>
 * <ul>
 *   <li>{@link #start()} connects and handshakes; the returned future completes
 *       once the first session is usable</li>
 *   <li>When a session ends, its executions settle as abandoned and a new
 *       connection is attempted after the backoff delay</li>
 *   <li>The backoff resets once a handshake completes</li>
 *   <li>With {@code maxReconnectAttempts > 0}, the runtime gives up after that
 *       many consecutive failed attempts</li>
 * </ul>
 *
 * Work is never carried over to a new connection. Callers resubmit whatever
 * came back with a retryable {@code NETWORK_ERROR}.
 */
public final class FathomInitiatorRuntime
{
    private static final Logger log = LoggerFactory.getLogger(FathomInitiatorRuntime.class);

    private final InetSocketAddress remoteAddress;
    private final InitiatorConfig config;
    private final FathomObservabilitySink sink;
    private final SessionContext context;
    private final ExecutionStateReducer reducer;
    private final NettyTcpConnector connector;
    private final ReconnectBackoff backoff;
    private final ScheduledExecutorService schedulerExecutor;
    private final ExecutorService machineExecutor;

    private final AtomicReference<InitiatorSession> current = new AtomicReference<>();
    private final CompletableFuture<Void> firstConnection = new CompletableFuture<>();
    private volatile boolean stopped;

    private FathomInitiatorRuntime(InetSocketAddress remoteAddress,
                                   InitiatorConfig config,
                                   FathomObservabilitySink sink,
                                   SessionContext context,
                                   NettyTcpConnector connector,
                                   ScheduledExecutorService schedulerExecutor,
                                   ExecutorService machineExecutor) {
        this.remoteAddress = remoteAddress;
        this.config = config;
        this.sink = sink;
        this.context = context;
        this.reducer = new ExecutionStateReducer(config.deadlineGrace());
        this.connector = connector;
        this.backoff = new ReconnectBackoff(config.reconnectionPolicy());
        this.schedulerExecutor = schedulerExecutor;
        this.machineExecutor = machineExecutor;
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /**
     * Starts connecting.
     *
     * @return completes when the first handshake succeeds; fails if the
     *         runtime gives up or is stopped first
     */
    public CompletableFuture<Void> start() {
        attemptConnection();
        return firstConnection;
    }

    public void stop() {
        stopped = true;
        InitiatorSession session = current.getAndSet(null);
        if (session != null) {
            session.close();
        }
        firstConnection.completeExceptionally(
                new FathomProtocolException(ErrorCode.NETWORK_ERROR, "Initiator stopped"));

        connector.close();
        for (ExecutorService executor : List.of(machineExecutor, schedulerExecutor)) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    // =====================================================================
    // Caller API
    // =====================================================================

    /**
     * Submits on the current connection.
     *
     * @throws FathomProtocolException {@code NETWORK_ERROR} while disconnected
     */
    public PendingExecution submit(ExecutionRequest request, ExecutionListener listener) {
        return requireSession().submit(request, listener);
    }

    public PendingExecution submit(ExecutionRequest request) {
        return submit(request, ExecutionListener.NONE);
    }

    public CompletableFuture<Optional<ServerLoad>> ping() {
        InitiatorSession session = current.get();
        if (session == null) {
            return CompletableFuture.failedFuture(notConnected());
        }
        return session.ping();
    }

    /**
     * The session in use, if connected and past the handshake.
     */
    public Optional<InitiatorSession> currentSession() {
        return Optional.ofNullable(current.get());
    }

    public boolean isConnected() {
        InitiatorSession session = current.get();
        return session != null && !session.isClosed();
    }

    /**
     * Failed attempts since the last completed handshake.
     */
    public int reconnectAttempts() {
        return backoff.attempt();
    }

    private InitiatorSession requireSession() {
        InitiatorSession session = current.get();
        if (session == null || session.isClosed()) {
            throw notConnected();
        }
        return session;
    }

    private static FathomProtocolException notConnected() {
        return new FathomProtocolException(ErrorCode.NETWORK_ERROR, "Not connected");
    }

    // =====================================================================
    // Connecting
    // =====================================================================

    private void attemptConnection() {
        if (stopped) {
            return;
        }

        AtomicBoolean retried = new AtomicBoolean(false);
        AtomicReference<InitiatorSession> attempt = new AtomicReference<>();

        connector.connect(remoteAddress, endpoint -> {
            InitiatorSession session = new InitiatorSession(endpoint, context, config, reducer,
                    cause -> onSessionClosed(attempt.get(), retried));
            attempt.set(session);
            return session;
        }).thenCompose(endpoint -> attempt.get().handshake())
          .whenComplete((ignored, failure) -> {
              InitiatorSession session = attempt.get();
              if (failure == null) {
                  onEstablished(session);
                  return;
              }
              log.warn("Connection to {} failed: {}", remoteAddress, failure.getMessage());
              if (session != null && !session.isClosed()) {
                  // Closing fires onSessionClosed, which schedules the retry.
                  session.close();
              } else {
                  scheduleReconnect(retried);
              }
          });
    }

    private void onEstablished(InitiatorSession session) {
        if (stopped) {
            session.close();
            return;
        }
        backoff.reset();
        current.set(session);
        firstConnection.complete(null);
        log.info("Connected to {}", remoteAddress);
    }

    private void onSessionClosed(InitiatorSession session, AtomicBoolean retried) {
        if (session != null) {
            current.compareAndSet(session, null);
        }
        scheduleReconnect(retried);
    }

    /**
     * Schedules the next attempt. {@code retried} guards against the handshake
     * failure and the session close both reporting the same attempt.
     */
    private void scheduleReconnect(AtomicBoolean retried) {
        if (stopped || !retried.compareAndSet(false, true)) {
            return;
        }

        int maxAttempts = config.maxReconnectAttempts();
        if (maxAttempts > 0 && backoff.attempt() >= maxAttempts) {
            FathomProtocolException gaveUp = new FathomProtocolException(ErrorCode.NETWORK_ERROR,
                    "Gave up on " + remoteAddress + " after " + maxAttempts + " attempts");
            sink.onError(new FathomErrorEvent(context.wallClock().now(), gaveUp.getMessage(), gaveUp));
            firstConnection.completeExceptionally(gaveUp);
            return;
        }

        Duration delay = backoff.next();
        sink.onProtocolEvent(ProtocolObservabilityEvent.of(context.wallClock().now(), Role.INITIATOR,
                ProtocolObservabilityEvent.Kind.RECONNECT_SCHEDULED,
                "attempt " + backoff.attempt() + " in " + delay.toMillis() + " ms"));
        context.scheduler().scheduleAfter(delay, context.clock(), this::attemptConnection);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress remoteAddress;
        private InitiatorConfig config = InitiatorConfig.defaults();
        private FathomObservabilitySink observabilitySink = new Slf4jFathomObservabilitySink();
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int machineThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

        public Builder withRemoteAddress(InetSocketAddress address) {
            this.remoteAddress = address;
            return this;
        }

        public Builder withConfig(InitiatorConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(FathomObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withConnectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder withMachineThreads(int threads) {
            this.machineThreads = threads;
            return this;
        }

        public FathomInitiatorRuntime build() {
            Objects.requireNonNull(remoteAddress, "remoteAddress");
            Objects.requireNonNull(config, "config");
            FathomObservabilitySink sink = observabilitySink == null
                    ? NullObservabilitySink.INSTANCE
                    : observabilitySink;

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1);
            ExecutorService machineExec = Executors.newFixedThreadPool(machineThreads);

            SessionContext context = new SessionContext(
                    new JsonEnvelopeDecoder(Set.of(config.protocolVersion())),
                    new JsonEnvelopeEncoder(),
                    clock,
                    SystemWallClock.INSTANCE,
                    new ScheduledExecutorScheduler(schedulerExec, clock),
                    machineExec,
                    sink);

            return new FathomInitiatorRuntime(remoteAddress, config, sink, context,
                    new NettyTcpConnector(config.maxFrameBytes(), connectTimeout),
                    schedulerExec, machineExec);
        }
    }
}
