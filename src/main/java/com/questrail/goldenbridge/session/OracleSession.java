package com.questrail.goldenbridge.session;

import com.questrail.goldenbridge.cache.ResultCache;
import com.questrail.goldenbridge.model.DumpArgument;
import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;
import com.questrail.goldenbridge.observability.BridgeObservabilitySink;
import com.questrail.goldenbridge.observability.NullObservabilitySink;
import com.questrail.goldenbridge.process.OracleClient;
import com.questrail.goldenbridge.schema.SchemaRegistry;
import com.questrail.goldenbridge.schema.SchemaValidator;
import com.questrail.goldenbridge.schema.SchemaViolationException;
import com.questrail.goldenbridge.schema.TypedRecord;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * OracleSession
 * -----------------------------------------------------------------------------
 * Everything one test run shares: the oracle client, the write-once cache,
 * the schema registry and the collection outcome.
 *
 * <p>A session is an explicit object handed to whoever needs it; there is no
 * process-wide cache. Collection happens once through {@link #collect};
 * afterwards each test body calls {@link #retrieve} with its own arguments.</p>
 *
 * <p>If collection failed, the failure is kept and every later retrieval
 * rethrows that same exception, so every dependent test reports the root
 * cause rather than a cache miss.</p>
 */
public final class OracleSession
{
    private final OracleClient client;
    private final ResultCache cache;
    private final SchemaValidator validator;
    private final CollectionOrchestrator orchestrator;
    private final Map<DumpRequest, ResolvedDump> resolved = new ConcurrentHashMap<>();

    private volatile RuntimeException failure;

    private OracleSession(Builder builder) {
        this.client = Objects.requireNonNull(builder.client, "client");
        this.cache = builder.cache != null ? builder.cache : new ResultCache();
        this.validator = new SchemaValidator(Objects.requireNonNull(builder.schemas, "schemas"));
        this.orchestrator = new CollectionOrchestrator(client, cache, builder.sink);
    }

    /**
     * Runs collection over {@code dependencies}. A failure is stored for later
     * retrievals and rethrown.
     */
    public Set<DumpRequest> collect(Iterable<? extends OracleDependency> dependencies) {
        try {
            return orchestrator.collect(dependencies);
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        }
    }

    /**
     * Reconstructs the request for one test invocation and returns its
     * validated records. Repeated calls for equal requests return the same
     * {@link ResolvedDump}.
     *
     * @param module the test's declared module, or {@code null} if it declared none
     * @throws MissingDeclarationException if {@code module} is null
     * @throws com.questrail.goldenbridge.cache.CacheMissException if the request was never batched
     * @throws SchemaViolationException if the table does not fit the module's schema
     */
    public ResolvedDump retrieve(String module, Iterable<DumpArgument> arguments) {
        if (module == null) {
            throw new MissingDeclarationException(
                    "Oracle data requested without a declared dump module");
        }
        Objects.requireNonNull(arguments, "arguments");
        rethrowCollectionFailure();
        return retrieve(DumpRequest.build(module, arguments));
    }

    public ResolvedDump retrieve(DumpRequest request) {
        Objects.requireNonNull(request, "request");
        rethrowCollectionFailure();
        return resolved.computeIfAbsent(request, r -> resolve(r, cache.lookup(r)));
    }

    /**
     * Resolves {@code request} through the oracle's single mode, bypassing the
     * cache. Meant for ad-hoc debugging, not for collected tests.
     */
    public ResolvedDump resolveUncached(DumpRequest request) {
        Objects.requireNonNull(request, "request");
        return resolve(request, client.runSingle(request));
    }

    public OrchestratorPhase phase() {
        return orchestrator.phase();
    }

    public Optional<RuntimeException> failure() {
        return Optional.ofNullable(failure);
    }

    public ResultCache cache() {
        return cache;
    }

    private ResolvedDump resolve(DumpRequest request, RawTable table) {
        try {
            List<TypedRecord> records = validator.validate(request.module(), table);
            return new ResolvedDump(request, table, records);
        } catch (SchemaViolationException e) {
            throw e.forRequest(request);
        }
    }

    private void rethrowCollectionFailure() {
        RuntimeException e = failure;
        if (e != null) {
            throw e;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OracleClient client;
        private ResultCache cache;
        private SchemaRegistry schemas;
        private BridgeObservabilitySink sink = NullObservabilitySink.INSTANCE;

        public Builder withClient(OracleClient client) {
            this.client = client;
            return this;
        }

        public Builder withCache(ResultCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder withSchemas(SchemaRegistry schemas) {
            this.schemas = schemas;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public OracleSession build() {
            return new OracleSession(this);
        }
    }
}
