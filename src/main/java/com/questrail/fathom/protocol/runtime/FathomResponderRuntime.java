package com.questrail.fathom.protocol.runtime;

import com.questrail.fathom.protocol.backend.ExecutionBackend;
import com.questrail.fathom.protocol.codec.impl.JsonEnvelopeDecoder;
import com.questrail.fathom.protocol.codec.impl.JsonEnvelopeEncoder;
import com.questrail.fathom.protocol.config.ResponderConfig;
import com.questrail.fathom.protocol.internal.exec.ExecutionSlots;
import com.questrail.fathom.protocol.internal.state.ExecutionStateReducer;
import com.questrail.fathom.protocol.internal.time.MonotonicClock;
import com.questrail.fathom.protocol.internal.time.ScheduledExecutorScheduler;
import com.questrail.fathom.protocol.internal.time.SystemMonotonicClock;
import com.questrail.fathom.protocol.internal.time.SystemWallClock;
import com.questrail.fathom.protocol.observability.FathomObservabilitySink;
import com.questrail.fathom.protocol.observability.Slf4jFathomObservabilitySink;
import com.questrail.fathom.protocol.session.ResponderSession;
import com.questrail.fathom.protocol.session.SessionContext;
import com.questrail.fathom.protocol.transport.tcp.netty.NettyTcpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * FathomResponderRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a sandbox responder.
 *
 * <p>Owns the listening socket, the timer thread, the machine pool that
 * drains execution mailboxes and the pump pool that blocks on the backend.
 * Every accepted connection gets its own {@link ResponderSession}; the
 * execution slots are shared by all of them.</p>
 */
public final class FathomResponderRuntime
{
    private static final Logger log = LoggerFactory.getLogger(FathomResponderRuntime.class);

    private final NettyTcpServer server;
    private final ExecutionSlots slots;
    private final ScheduledExecutorService schedulerExecutor;
    private final ExecutorService machineExecutor;
    private final ExecutorService pumpExecutor;

    private FathomResponderRuntime(NettyTcpServer server,
                                   ExecutionSlots slots,
                                   ScheduledExecutorService schedulerExecutor,
                                   ExecutorService machineExecutor,
                                   ExecutorService pumpExecutor) {
        this.server = server;
        this.slots = slots;
        this.schedulerExecutor = schedulerExecutor;
        this.machineExecutor = machineExecutor;
        this.pumpExecutor = pumpExecutor;
    }

    public void start() {
        server.start();
    }

    /**
     * Closes every connection, which abandons and cancels every live
     * execution, then stops the worker threads.
     */
    public void stop() {
        server.stop();
        for (ExecutorService executor : List.of(pumpExecutor, machineExecutor, schedulerExecutor)) {
            shutdown(executor);
        }
        log.info("Fathom responder stopped");
    }

    private static void shutdown(ExecutorService executor) {
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

    public InetSocketAddress boundAddress() {
        return server.boundAddress();
    }

    /**
     * Executions admitted and not yet evicted, across all connections.
     */
    public int activeExecutions() {
        return slots.inUse();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ResponderConfig config = ResponderConfig.defaults();
        private ExecutionBackend backend;
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private FathomObservabilitySink observabilitySink = new Slf4jFathomObservabilitySink();
        private int machineThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

        public Builder withConfig(ResponderConfig config) {
            this.config = config;
            return this;
        }

        public Builder withBackend(ExecutionBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress address) {
            this.bindAddress = address;
            return this;
        }

        public Builder withObservabilitySink(FathomObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMachineThreads(int threads) {
            this.machineThreads = threads;
            return this;
        }

        public FathomResponderRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(backend, "backend");
            Objects.requireNonNull(bindAddress, "bindAddress");

            // 1. Time and threads
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1);
            ExecutorService machineExec = Executors.newFixedThreadPool(machineThreads);
            ExecutorService pumpExec = Executors.newCachedThreadPool();

            // 2. Shared per-runtime collaborators
            SessionContext context = new SessionContext(
                    new JsonEnvelopeDecoder(config.supportedVersions()),
                    new JsonEnvelopeEncoder(),
                    clock,
                    SystemWallClock.INSTANCE,
                    new ScheduledExecutorScheduler(schedulerExec, clock),
                    machineExec,
                    observabilitySink);
            ExecutionStateReducer reducer = new ExecutionStateReducer();
            ExecutionSlots slots = new ExecutionSlots(config.maxConcurrentExecutions());

            // 3. One session per accepted connection
            NettyTcpServer server = new NettyTcpServer(bindAddress, config.maxFrameBytes(), endpoint ->
                    new ResponderSession(endpoint, context, config, backend, pumpExec, slots, reducer));

            return new FathomResponderRuntime(server, slots, schedulerExec, machineExec, pumpExec);
        }
    }
}
