package com.questrail.fathom.protocol.backend.process;

import com.questrail.fathom.protocol.backend.BackendExit;
import com.questrail.fathom.protocol.backend.BackendHandle;
import com.questrail.fathom.protocol.backend.ExecutionBackend;
import com.questrail.fathom.protocol.backend.ExecutionBackendException;
import com.questrail.fathom.protocol.backend.OutputChunk;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import com.questrail.fathom.protocol.model.Language;
import com.questrail.fathom.protocol.model.OutputChannel;
import com.questrail.fathom.protocol.model.ResourceUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * LocalProcessExecutionBackend
 * =============================================================================
 * Runs each request as a plain child process of the responder.
 *
 * <p>There is no isolation of any kind: no memory cap, no CPU share, no
 * filesystem or network jail. Use it for development and tests against
 * trusted code only.</p>
 *
 * <h2>Command line</h2>
 * Each language maps to an interpreter prefix; the request code is appended
 * as the last argument, for example {@code python3 -c <code>}. The request
 * {@code env} is added to the responder's own environment and {@code stdin}
 * is written to the process, then closed.
 *
 * <h2>Threads</h2>
 * {@link #start} returns as soon as the process exists. A writer thread feeds
 * {@code stdin}, so a program that never reads its input cannot hold up the
 * start and stays cancellable. One reader thread per output stream pushes
 * chunks into a shared queue; the end of stream is reported once both readers
 * are done.
 */
public final class LocalProcessExecutionBackend implements ExecutionBackend
{
    private static final Logger log = LoggerFactory.getLogger(LocalProcessExecutionBackend.class);

    private static final int READ_BUFFER_CHARS = 8192;

    private final Map<Language, List<String>> interpreters;

    public LocalProcessExecutionBackend() {
        this(defaultInterpreters());
    }

    public LocalProcessExecutionBackend(Map<Language, List<String>> interpreters) {
        Objects.requireNonNull(interpreters, "interpreters");
        Map<Language, List<String>> copy = new LinkedHashMap<>();
        interpreters.forEach((language, prefix) -> copy.put(language, List.copyOf(prefix)));
        this.interpreters = Map.copyOf(copy);
    }

    public static Map<Language, List<String>> defaultInterpreters() {
        Map<Language, List<String>> defaults = new LinkedHashMap<>();
        defaults.put(Language.PYTHON, List.of("python3", "-c"));
        defaults.put(Language.JAVASCRIPT, List.of("node", "-e"));
        defaults.put(Language.BASH, List.of("bash", "-c"));
        return defaults;
    }

    @Override
    public BackendHandle start(ExecutionRequest request) throws ExecutionBackendException {
        List<String> prefix = interpreters.get(request.language());
        if (prefix == null) {
            throw new ExecutionBackendException("No interpreter configured for " + request.language());
        }

        List<String> command = new ArrayList<>(prefix);
        command.add(request.code());

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(request.env());
        builder.redirectErrorStream(false);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ExecutionBackendException("Failed to start " + command.get(0), e);
        }

        ProcessHandleImpl handle = new ProcessHandleImpl(request.id(), process);
        handle.startReaders();
        handle.startStdinWriter(request.stdin());
        log.debug("Started {} for execution {} (pid {})", command.get(0), request.id(), process.pid());
        return handle;
    }

    @Override
    public void signalCancel(BackendHandle handle) {
        ProcessHandleImpl process = cast(handle);
        if (process.cancelled.compareAndSet(false, true)) {
            process.process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.process.destroyForcibly();
        }
    }

    @Override
    public OutputChunk pollOutput(BackendHandle handle) throws InterruptedException {
        ProcessHandleImpl process = cast(handle);
        if (process.exhausted) {
            return OutputChunk.endOfStream();
        }
        OutputChunk chunk = process.chunks.take();
        if (chunk.isEndOfStream()) {
            process.exhausted = true;
        }
        return chunk;
    }

    @Override
    public BackendExit awaitExit(BackendHandle handle) throws InterruptedException {
        ProcessHandleImpl process = cast(handle);
        int exitCode = process.process.waitFor();

        Optional<ResourceUsage> usage = process.process.info().totalCpuDuration()
                .map(cpu -> new ResourceUsage(0L, cpu));
        if (process.cancelled.get()) {
            return new BackendExit(OptionalInt.empty(), usage, false);
        }
        return new BackendExit(OptionalInt.of(exitCode), usage, false);
    }

    private static ProcessHandleImpl cast(BackendHandle handle) {
        if (!(handle instanceof ProcessHandleImpl process)) {
            throw new IllegalArgumentException("Handle was not issued by this backend: " + handle);
        }
        return process;
    }

    private static final class ProcessHandleImpl implements BackendHandle
    {
        private final ExecutionId id;
        private final Process process;
        private final BlockingQueue<OutputChunk> chunks = new LinkedBlockingQueue<>();
        private final AtomicInteger openStreams = new AtomicInteger(2);
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        // only touched by the pump thread
        private boolean exhausted;

        ProcessHandleImpl(ExecutionId id, Process process) {
            this.id = id;
            this.process = process;
        }

        @Override
        public ExecutionId executionId() {
            return id;
        }

        void startReaders() {
            startDaemon(() -> pump(process.getInputStream(), OutputChannel.STDOUT), "stdout");
            startDaemon(() -> pump(process.getErrorStream(), OutputChannel.STDERR), "stderr");
        }

        void startStdinWriter(Optional<String> stdin) {
            if (stdin.isEmpty()) {
                closeStdin();
                return;
            }
            startDaemon(() -> writeStdin(stdin.get()), "stdin");
        }

        private void startDaemon(Runnable task, String stream) {
            Thread thread = new Thread(task, "fathom-" + stream + "-" + id.value());
            thread.setDaemon(true);
            thread.start();
        }

        private void pump(InputStream stream, OutputChannel channel) {
            char[] buffer = new char[READ_BUFFER_CHARS];
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                int carried = 0;
                int read;
                while ((read = reader.read(buffer, carried, buffer.length - carried)) != -1) {
                    int available = carried + read;
                    // Keep a trailing high surrogate until its low half arrives.
                    int complete = Character.isHighSurrogate(buffer[available - 1]) ? available - 1 : available;
                    if (complete > 0) {
                        chunks.add(OutputChunk.of(channel, new String(buffer, 0, complete)));
                    }
                    carried = available - complete;
                    if (carried > 0) {
                        buffer[0] = buffer[available - 1];
                    }
                }
                if (carried > 0) {
                    chunks.add(OutputChunk.of(channel, new String(buffer, 0, carried)));
                }
            } catch (IOException e) {
                // A destroyed process closes its pipes under the reader.
                log.debug("{} of execution {} closed: {}", channel, id, e.getMessage());
            } finally {
                if (openStreams.decrementAndGet() == 0) {
                    chunks.add(OutputChunk.endOfStream());
                }
            }
        }

        private void writeStdin(String stdin) {
            try (OutputStream out = process.getOutputStream()) {
                out.write(stdin.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // The program may exit or be killed without reading its input.
                log.debug("stdin of execution {} not fully written: {}", id, e.getMessage());
            }
        }

        private void closeStdin() {
            try {
                process.getOutputStream().close();
            } catch (IOException e) {
                log.debug("stdin of execution {} not closed: {}", id, e.getMessage());
            }
        }

        @Override
        public String toString() {
            return "LocalProcess[" + id + ", pid " + process.pid() + "]";
        }
    }
}
