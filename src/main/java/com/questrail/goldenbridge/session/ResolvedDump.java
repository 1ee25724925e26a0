package com.questrail.goldenbridge.session;

import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;
import com.questrail.goldenbridge.schema.TypedRecord;

import java.util.List;
import java.util.Objects;

/**
 * A request together with its raw table and the validated records.
 */
public record ResolvedDump(DumpRequest request, RawTable table, List<TypedRecord> records)
{
    public ResolvedDump {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(table, "table");
        records = List.copyOf(records);
    }
}
