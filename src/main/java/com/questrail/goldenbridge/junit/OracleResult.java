package com.questrail.goldenbridge.junit;

import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;
import com.questrail.goldenbridge.schema.TypedRecord;
import com.questrail.goldenbridge.session.ResolvedDump;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The oracle's validated answer for one test invocation, injected as a test
 * method parameter.
 *
 * <p>An empty result means the reference data is the empty set; it is never
 * used to signal a missing answer.</p>
 */
public final class OracleResult
{
    private final ResolvedDump dump;

    OracleResult(ResolvedDump dump) {
        this.dump = Objects.requireNonNull(dump, "dump");
    }

    public DumpRequest request() {
        return dump.request();
    }

    public RawTable table() {
        return dump.table();
    }

    public List<TypedRecord> records() {
        return dump.records();
    }

    public int size() {
        return dump.records().size();
    }

    public boolean isEmpty() {
        return dump.records().isEmpty();
    }

    /**
     * @throws IllegalStateException unless there is exactly one record
     */
    public TypedRecord single() {
        if (size() != 1) {
            throw new IllegalStateException(
                    "Expected exactly one record for [" + request() + "] but got " + size());
        }
        return dump.records().get(0);
    }

    /**
     * @throws IllegalStateException if there are no records
     */
    public TypedRecord first() {
        if (isEmpty()) {
            throw new IllegalStateException("No records for [" + request() + "]");
        }
        return dump.records().get(0);
    }

    public <R extends Record> List<R> as(Class<R> type) {
        List<R> bound = new ArrayList<>(size());
        for (TypedRecord record : dump.records()) {
            bound.add(record.as(type));
        }
        return bound;
    }

    @Override
    public String toString() {
        return "OracleResult[" + request() + ", " + size() + " records]";
    }
}
