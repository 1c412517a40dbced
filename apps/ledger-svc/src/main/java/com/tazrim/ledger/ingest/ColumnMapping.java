package com.tazrim.ledger.ingest;

import java.util.Map;

/**
 * Result of header detection: which statement column feeds each canonical field.
 */
public record ColumnMapping(FeedKind feedKind, Map<CanonicalField, String> columns) {

    public ColumnMapping {
        columns = Map.copyOf(columns);
    }

    public boolean has(CanonicalField field) {
        return columns.containsKey(field);
    }

    public String cell(StatementReader.RawRow row, CanonicalField field) {
        String label = columns.get(field);
        if (label == null) {
            return "";
        }
        String value = row.cells().get(label);
        return value == null ? "" : value.strip();
    }
}
