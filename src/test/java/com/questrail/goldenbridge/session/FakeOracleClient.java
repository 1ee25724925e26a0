package com.questrail.goldenbridge.session;

import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;
import com.questrail.goldenbridge.process.OracleClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * In-memory {@link OracleClient} that answers from a function and counts calls.
 * A function returning {@code null} omits the frame for that request.
 */
public final class FakeOracleClient implements OracleClient
{
    private final Function<DumpRequest, RawTable> answers;
    private final List<Set<DumpRequest>> batches = new ArrayList<>();
    private RuntimeException failure;

    public FakeOracleClient(Function<DumpRequest, RawTable> answers) {
        this.answers = answers;
    }

    public FakeOracleClient failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public Map<DumpRequest, RawTable> runBatch(Set<DumpRequest> requests) {
        batches.add(Set.copyOf(requests));
        if (failure != null) {
            throw failure;
        }
        Map<DumpRequest, RawTable> tables = new LinkedHashMap<>();
        for (DumpRequest request : requests) {
            RawTable table = answers.apply(request);
            if (table != null) {
                tables.put(request, table);
            }
        }
        return tables;
    }

    @Override
    public RawTable runSingle(DumpRequest request) {
        if (failure != null) {
            throw failure;
        }
        return answers.apply(request);
    }

    public int batchCount() {
        return batches.size();
    }

    public List<Set<DumpRequest>> batches() {
        return batches;
    }
}
