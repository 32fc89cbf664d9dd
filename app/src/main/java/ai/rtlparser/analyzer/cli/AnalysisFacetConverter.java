package ai.rtlparser.analyzer.cli;

import ai.rtlparser.analyzer.query.AnalysisFacet;
import picocli.CommandLine;

public class AnalysisFacetConverter implements CommandLine.ITypeConverter<AnalysisFacet> {
    @Override
    public AnalysisFacet convert(String value) {
        return AnalysisFacet.from(value);
    }
}
