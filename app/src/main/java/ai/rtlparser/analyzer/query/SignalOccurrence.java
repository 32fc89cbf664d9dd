package ai.rtlparser.analyzer.query;

import java.util.Objects;

/**
 * One place a signal name shows up.
 *
 * @param detail direction for ports, storage type for signals, kind for registers, the block
 *               keyword (or {@code assign}) for assignments, and {@code instance.port} for connections
 */
public record SignalOccurrence(String signal, OccurrenceKind kind, String module, String file, int line, String detail) {

    public SignalOccurrence {
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(file, "file");
        detail = detail == null ? "" : detail;
    }
}
