package com.questrail.goldenbridge.process;

import com.questrail.goldenbridge.codec.BatchEncoder;
import com.questrail.goldenbridge.codec.OracleOutputDecoder;
import com.questrail.goldenbridge.codec.impl.DefaultBatchEncoder;
import com.questrail.goldenbridge.codec.impl.FramedOutputDecoder;
import com.questrail.goldenbridge.codec.impl.PlainCsvDecoder;
import com.questrail.goldenbridge.config.OracleBridgeConfig;
import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;
import com.questrail.goldenbridge.observability.BridgeObservabilitySink;
import com.questrail.goldenbridge.observability.NullObservabilitySink;
import com.questrail.goldenbridge.observability.OracleInvocationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * SubprocessOracleClient
 * -----------------------------------------------------------------------------
 * {@link OracleClient} that launches the oracle as a child process per call.
 *
 * <h2>Lifecycle of one invocation</h2>
 * <ol>
 *   <li>Spawn the configured command; a launch failure is
 *       {@link OracleUnavailableException}.</li>
 *   <li>Write stdin and drain stdout and stderr on three pump threads, so
 *       neither a large batch nor an oracle that never reads can stall the
 *       caller outside the timeout.</li>
 *   <li>Block until exit or until the configured timeout; on expiry the process
 *       is killed and the call fails with {@link OracleProcessException}.</li>
 *   <li>Non-zero exit is {@link OracleProcessException} carrying stderr. A
 *       zero exit with input left unwritten is one as well; otherwise stdout
 *       is decoded.</li>
 * </ol>
 * The process is destroyed and the pumps are stopped on every exit path.
 */
public final class SubprocessOracleClient implements OracleClient
{
    private static final Logger log = LoggerFactory.getLogger(SubprocessOracleClient.class);

    /** Upper bound for collecting the tail of the output after the process has exited. */
    private static final long DRAIN_GRACE_MILLIS = 10_000L;

    private final OracleBridgeConfig config;
    private final BatchEncoder encoder;
    private final OracleOutputDecoder decoder;
    private final PlainCsvDecoder singleDecoder;
    private final BridgeObservabilitySink sink;

    public SubprocessOracleClient(OracleBridgeConfig config,
                                  BatchEncoder encoder,
                                  OracleOutputDecoder decoder,
                                  PlainCsvDecoder singleDecoder,
                                  BridgeObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.singleDecoder = Objects.requireNonNull(singleDecoder, "singleDecoder");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public SubprocessOracleClient(OracleBridgeConfig config, BridgeObservabilitySink sink) {
        this(config, new DefaultBatchEncoder(), new FramedOutputDecoder(), new PlainCsvDecoder(), sink);
    }

    public SubprocessOracleClient(OracleBridgeConfig config) {
        this(config, NullObservabilitySink.INSTANCE);
    }

    @Override
    public Map<DumpRequest, RawTable> runBatch(Set<DumpRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        final OracleCommand command = config.requireCommand();
        final String input = encoder.encode(requests);

        Outcome outcome = execute(command, command.batchInvocation(config.lenientBatch()), input,
                OracleInvocationEvent.Mode.BATCH, requests.size());
        if (outcome.exitCode != 0) {
            publish(OracleInvocationEvent.Mode.BATCH, requests.size(), 0, outcome);
            throw new OracleProcessException(outcome.exitCode, outcome.stderr);
        }
        requireInputAccepted(OracleInvocationEvent.Mode.BATCH, requests.size(), outcome);
        if (!outcome.stderr.isBlank()) {
            log.warn("Oracle reported on stderr:\n{}", outcome.stderr.strip());
        }

        Map<DumpRequest, RawTable> tables = decoder.decode(outcome.stdout);
        publish(OracleInvocationEvent.Mode.BATCH, requests.size(), tables.size(), outcome);
        return tables;
    }

    @Override
    public RawTable runSingle(DumpRequest request) {
        Objects.requireNonNull(request, "request");
        final OracleCommand command = config.requireCommand();

        Outcome outcome = execute(command, command.singleInvocation(request), "",
                OracleInvocationEvent.Mode.SINGLE, 1);
        if (outcome.exitCode != 0) {
            publish(OracleInvocationEvent.Mode.SINGLE, 1, 0, outcome);
            throw new OracleProcessException(outcome.exitCode, outcome.stderr);
        }
        requireInputAccepted(OracleInvocationEvent.Mode.SINGLE, 1, outcome);

        RawTable table = singleDecoder.decode(outcome.stdout);
        publish(OracleInvocationEvent.Mode.SINGLE, 1, 1, outcome);
        return table;
    }

    // ---------------------------------------------------------------------
    // Process handling
    // ---------------------------------------------------------------------

    private Outcome execute(OracleCommand command,
                            List<String> argv,
                            String input,
                            OracleInvocationEvent.Mode mode,
                            int requestCount) {
        log.debug("Running oracle: {}", argv);
        final Instant started = Instant.now();

        ProcessBuilder builder = new ProcessBuilder(argv);
        if (command.workingDirectory() != null) {
            builder.directory(command.workingDirectory().toFile());
        }
        builder.environment().putAll(command.environment());

        final Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new OracleUnavailableException(
                    "Cannot launch oracle '" + argv.get(0) + "': " + e.getMessage(), e);
        }

        ExecutorService pumps = Executors.newFixedThreadPool(3, r -> {
            Thread t = new Thread(r, "oracle-pump");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<String> stdout = pumps.submit(() -> readFully(process.getInputStream()));
            Future<String> stderr = pumps.submit(() -> readFully(process.getErrorStream()));
            Future<Void> stdin = pumps.submit(() -> writeInput(process.getOutputStream(), input));

            if (!process.waitFor(config.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                String partialErr = collect(stderr, 1_000L).orElse("");
                sink.onOracleInvocation(new OracleInvocationEvent(Instant.now(), mode, requestCount, 0, -1,
                        Duration.between(started, Instant.now())));
                throw OracleProcessException.timedOut(config.timeout(), partialErr);
            }

            final int exitCode = process.exitValue();
            final String out = collect(stdout, DRAIN_GRACE_MILLIS)
                    .orElseThrow(() -> new OracleProcessException("Oracle stdout was not closed after exit"));
            final String err = collect(stderr, DRAIN_GRACE_MILLIS).orElse("");
            final Throwable inputFailure = inputFailure(stdin);
            return new Outcome(exitCode, out, err, inputFailure, Duration.between(started, Instant.now()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleProcessException("Interrupted while waiting for the oracle", e);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
            pumps.shutdownNow();
        }
    }

    private static Void writeInput(OutputStream stdin, String input) throws IOException {
        try (OutputStream out = stdin) {
            out.write(input.getBytes(StandardCharsets.UTF_8));
        }
        return null;
    }

    /**
     * @return why stdin could not be written in full, or {@code null} if it was
     */
    private static Throwable inputFailure(Future<Void> stdin) throws InterruptedException {
        try {
            stdin.get(DRAIN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (TimeoutException e) {
            return e;
        }
    }

    private void requireInputAccepted(OracleInvocationEvent.Mode mode, int requestCount, Outcome outcome) {
        if (outcome.inputFailure == null) {
            return;
        }
        // Exit code 0 would read as success; report no usable exit instead.
        sink.onOracleInvocation(new OracleInvocationEvent(
                Instant.now(), mode, requestCount, 0, -1, outcome.elapsed));
        String reason = outcome.inputFailure.getMessage() != null
                ? outcome.inputFailure.getMessage()
                : outcome.inputFailure.getClass().getSimpleName();
        throw new OracleProcessException("Oracle did not accept its input: " + reason, outcome.inputFailure);
    }

    private static String readFully(InputStream stream) throws IOException {
        try (InputStream in = stream) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    private static Optional<String> collect(Future<String> pump, long waitMillis)
            throws InterruptedException {
        try {
            return Optional.of(pump.get(waitMillis, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new OracleProcessException("Cannot read oracle output: " + e.getCause().getMessage(),
                    e.getCause());
        }
    }

    private void publish(OracleInvocationEvent.Mode mode, int requestCount, int frameCount, Outcome outcome) {
        sink.onOracleInvocation(new OracleInvocationEvent(
                Instant.now(), mode, requestCount, frameCount, outcome.exitCode, outcome.elapsed));
    }

    private static final class Outcome {
        final int exitCode;
        final String stdout;
        final String stderr;
        final Throwable inputFailure;
        final Duration elapsed;

        Outcome(int exitCode, String stdout, String stderr, Throwable inputFailure, Duration elapsed) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
            this.inputFailure = inputFailure;
            this.elapsed = elapsed;
        }
    }
}
