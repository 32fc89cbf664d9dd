package ai.rtlparser.analyzer.cli;

import ai.rtlparser.analyzer.config.LogFormat;
import ai.rtlparser.analyzer.config.QueryType;
import ai.rtlparser.analyzer.cst.DecodeMode;
import ai.rtlparser.analyzer.query.AnalysisFacet;
import ai.rtlparser.analyzer.query.RegisterKindFilter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "rtl-structure-analyzer", mixinStandardHelpOptions = true,
        description = "Structural analysis of Verilog/SystemVerilog CST dumps")
public class CliArguments {

    @CommandLine.Parameters(arity = "0..*", paramLabel = "SOURCE", description = "Source files; each needs a CST dump next to it")
    private List<Path> sources = new ArrayList<>();

    @CommandLine.Option(names = "--root", description = "Project directory scanned for sources", paramLabel = "DIR")
    private Path projectRoot;

    @CommandLine.Option(names = "--include", split = ",", paramLabel = "GLOB",
            description = "File patterns collected under --root (default *.v,*.sv)")
    private List<String> includePatterns;

    @CommandLine.Option(names = "--exclude", split = ",", paramLabel = "GLOB",
            description = "File patterns skipped under --root")
    private List<String> excludePatterns;

    @CommandLine.Option(names = "--query", converter = QueryTypeConverter.class,
            description = "Query to run: registers, module, trace, stats or modules")
    private QueryType queryType;

    @CommandLine.Option(names = "--module", description = "Module analyzed by the module query", paramLabel = "NAME")
    private String module;

    @CommandLine.Option(names = "--facet", converter = AnalysisFacetConverter.class, defaultValue = "all",
            description = "Module facet: hierarchy, ports, parameters or all")
    private AnalysisFacet facet = AnalysisFacet.ALL;

    @CommandLine.Option(names = "--signal", description = "Signal traced by the trace query", paramLabel = "NAME")
    private String signal;

    @CommandLine.Option(names = "--scope", description = "Restrict registers and trace queries to one module", paramLabel = "MODULE")
    private String scope;

    @CommandLine.Option(names = "--kind", converter = RegisterKindFilterConverter.class, defaultValue = "all",
            description = "Register kind: flip_flop, latch or all")
    private RegisterKindFilter kind = RegisterKindFilter.ALL;

    @CommandLine.Option(names = "--tree-suffix", description = "Suffix appended to a source path to find its CST dump", paramLabel = "SUFFIX")
    private String treeSuffix;

    @CommandLine.Option(names = "--decode-mode", converter = DecodeModeConverter.class,
            description = "CST decode mode: lenient or strict")
    private DecodeMode decodeMode;

    @CommandLine.Option(names = "--indent-width", description = "Spaces per nesting level in the CST dump", paramLabel = "N")
    private Integer indentWidth;

    @CommandLine.Option(names = "--threads", description = "Parser threads", paramLabel = "N")
    private Integer threads;

    @CommandLine.Option(names = "--cache-dir", description = "Directory for the JSON parse cache", paramLabel = "DIR")
    private Path cacheDirectory;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public List<Path> sources() {
        return sources;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public List<String> includePatterns() {
        return includePatterns;
    }

    public List<String> excludePatterns() {
        return excludePatterns;
    }

    public QueryType queryType() {
        return queryType;
    }

    public String module() {
        return module;
    }

    public AnalysisFacet facet() {
        return facet;
    }

    public String signal() {
        return signal;
    }

    public String scope() {
        return scope;
    }

    public RegisterKindFilter kind() {
        return kind;
    }

    public String treeSuffix() {
        return treeSuffix;
    }

    public DecodeMode decodeMode() {
        return decodeMode;
    }

    public Integer indentWidth() {
        return indentWidth;
    }

    public Integer threads() {
        return threads;
    }

    public Path cacheDirectory() {
        return cacheDirectory;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
