package com.tablesmith.dialects.sqlserver;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a script into driver-level batches on separator lines, as {@code sqlcmd} does with
 * {@code GO}. A separator must stand alone on its line; surrounding whitespace and case are ignored.
 * Blank batches are dropped.
 */
public class SqlServerScriptSplitter {
    public static final String DEFAULT_SEPARATOR = "GO";

    private static final SqlServerScriptSplitter DEFAULT = new SqlServerScriptSplitter(DEFAULT_SEPARATOR);

    private final String separator;

    public SqlServerScriptSplitter(String separator) {
        if (separator == null || separator.isBlank()) {
            throw new IllegalArgumentException("Batch separator must not be blank");
        }
        this.separator = separator.strip();
    }

    public static List<String> split(String sql) {
        return DEFAULT.splitBatches(sql);
    }

    public List<String> splitBatches(String sql) {
        List<String> batches = new ArrayList<>();
        if (sql == null) {
            return batches;
        }

        String normalized = sql.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder current = new StringBuilder();

        for (String line : normalized.split("\n", -1)) {
            if (line.strip().equalsIgnoreCase(separator)) {
                flush(current, batches);
                continue;
            }
            current.append(line).append('\n');
        }
        flush(current, batches);

        return batches;
    }

    private static void flush(StringBuilder current, List<String> batches) {
        String batch = current.toString().strip();
        current.setLength(0);
        if (!batch.isEmpty()) {
            batches.add(batch);
        }
    }
}
