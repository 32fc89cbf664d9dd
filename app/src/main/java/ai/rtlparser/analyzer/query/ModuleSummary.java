package ai.rtlparser.analyzer.query;

public record ModuleSummary(String name, String file, int line, int ports, int registers, int instances) {
}
