package ai.rtlparser.analyzer.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batch parse. Failed files are listed; they never abort the batch.
 */
public record ParseReport(int filesParsed, int modulesIndexed, int cacheHits, List<FileFailure> failures) {

    public ParseReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public ParseReport withFailures(List<FileFailure> additional) {
        List<FileFailure> merged = new ArrayList<>(additional);
        merged.addAll(failures);
        return new ParseReport(filesParsed, modulesIndexed, cacheHits, merged);
    }
}
