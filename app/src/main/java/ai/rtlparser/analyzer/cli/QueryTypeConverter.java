package ai.rtlparser.analyzer.cli;

import ai.rtlparser.analyzer.config.QueryType;
import picocli.CommandLine;

/**
 * Parses query type CLI options.
 */
public class QueryTypeConverter implements CommandLine.ITypeConverter<QueryType> {
    @Override
    public QueryType convert(String value) {
        return QueryType.from(value);
    }
}
