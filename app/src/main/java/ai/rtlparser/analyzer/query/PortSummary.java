package ai.rtlparser.analyzer.query;

public record PortSummary(int total, int inputs, int outputs, int inouts) {
}
