package com.questrail.goldenbridge.schema;

import com.questrail.goldenbridge.FailureKind;
import com.questrail.goldenbridge.OracleBridgeException;
import com.questrail.goldenbridge.model.DumpRequest;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Indicates that a raw oracle table does not fit the declared schema of its
 * module: a missing or extra column, an unparseable value, or an empty value
 * in a non-nullable column.
 *
 * <p>This usually means the oracle and the client-side schema have drifted
 * apart. The message names the column and, where applicable, the 0-based row
 * index; once the failing request is known it is prefixed with the request's
 * wire line via {@link #forRequest(DumpRequest)}.</p>
 */
public final class SchemaViolationException extends OracleBridgeException
{
    private final String module;
    private final String column;
    private final int rowIndex;
    private final DumpRequest request;

    public SchemaViolationException(String module, String column, int rowIndex, String detail) {
        this(module, column, rowIndex, null, describe(module, column, rowIndex, detail), null);
    }

    private SchemaViolationException(String module,
                                     String column,
                                     int rowIndex,
                                     DumpRequest request,
                                     String message,
                                     Throwable cause) {
        super(FailureKind.SCHEMA_DRIFT, message, cause);
        this.module = module;
        this.column = column;
        this.rowIndex = rowIndex;
        this.request = request;
    }

    static SchemaViolationException unknownModule(String module) {
        return new SchemaViolationException(module, null, -1, null,
                "No schema registered for dump module " + module, null);
    }

    /**
     * Returns a copy of this violation attributed to {@code request}.
     */
    public SchemaViolationException forRequest(DumpRequest request) {
        return new SchemaViolationException(module, column, rowIndex, request,
                "[" + request.toWireLine() + "] " + getMessage(), this);
    }

    public String module() {
        return module;
    }

    public Optional<String> column() {
        return Optional.ofNullable(column);
    }

    public OptionalInt rowIndex() {
        return rowIndex < 0 ? OptionalInt.empty() : OptionalInt.of(rowIndex);
    }

    public Optional<DumpRequest> request() {
        return Optional.ofNullable(request);
    }

    private static String describe(String module, String column, int rowIndex, String detail) {
        StringBuilder sb = new StringBuilder("Schema violation in ").append(module);
        if (column != null) {
            sb.append(", column '").append(column).append('\'');
        }
        if (rowIndex >= 0) {
            sb.append(", row ").append(rowIndex);
        }
        return sb.append(": ").append(detail).toString();
    }
}
