package ai.rtlparser.analyzer.query;

import java.util.List;
import java.util.Objects;

public record RegisterQueryResult(List<RegisterEntry> registers, RegisterStats stats) {

    public RegisterQueryResult {
        registers = registers == null ? List.of() : List.copyOf(registers);
        Objects.requireNonNull(stats, "stats");
    }
}
