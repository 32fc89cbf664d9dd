package ai.rtlparser.analyzer.config;

import java.util.Locale;

/**
 * Query the command line runs once every input has been indexed.
 */
public enum QueryType {
    REGISTERS,
    MODULE,
    TRACE,
    STATS,
    MODULES;

    public static QueryType from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Query type must be provided");
        }
        try {
            return QueryType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported query type: " + raw, ex);
        }
    }
}
