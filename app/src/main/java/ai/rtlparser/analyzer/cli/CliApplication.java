package ai.rtlparser.analyzer.cli;

import ai.rtlparser.analyzer.cache.JsonFileParseCache;
import ai.rtlparser.analyzer.cache.ParseCache;
import ai.rtlparser.analyzer.config.Config;
import ai.rtlparser.analyzer.config.ConfigLoader;
import ai.rtlparser.analyzer.config.SystemEnvironmentReader;
import ai.rtlparser.analyzer.corpus.ModuleCorpus;
import ai.rtlparser.analyzer.cst.TreeTextDecoder;
import ai.rtlparser.analyzer.extract.StructuralExtractor;
import ai.rtlparser.analyzer.logging.LoggingConfigurator;
import ai.rtlparser.analyzer.model.ModelJson;
import ai.rtlparser.analyzer.parse.FileFailure;
import ai.rtlparser.analyzer.parse.ParseReport;
import ai.rtlparser.analyzer.parse.ParseService;
import ai.rtlparser.analyzer.parse.SourceFinder;
import ai.rtlparser.analyzer.parse.SourceUnit;
import ai.rtlparser.analyzer.parse.SourceUnitReader;
import ai.rtlparser.analyzer.query.QueryEngine;
import ai.rtlparser.analyzer.query.QueryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, the parse pipeline and the query engine. Query
 * results go to stdout as JSON; diagnostics go to stderr.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_QUERY_FAILURE = 2;

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;
    private final ObjectMapper mapper = ModelJson.newObjectMapper();

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new PrintWriter(System.out, true),
                new PrintWriter(System.err, true));
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Running {} query (decode={}, threads={})",
                config.queryType(), config.decodeMode(), config.parseThreads());

        List<Path> sources;
        try {
            sources = collectSources(config);
        } catch (UncheckedIOException ex) {
            LOGGER.debug("Project scan failed", ex);
            err.println(ex.getMessage());
            return EXIT_QUERY_FAILURE;
        }

        ModuleCorpus corpus = new ModuleCorpus();
        ParseReport report = index(config, sources, corpus);
        for (FileFailure failure : report.failures()) {
            err.println("Failed to parse " + failure.path() + ": " + failure.message());
        }
        if (report.filesParsed() == 0) {
            err.println("No input could be parsed");
            return EXIT_QUERY_FAILURE;
        }

        QueryEngine engine = new QueryEngine(corpus);
        try {
            Object result = runQuery(config, engine);
            out.println(render(result));
            out.flush();
            return 0;
        } catch (QueryException ex) {
            LOGGER.debug("Query failed", ex);
            err.println(ex.getMessage());
            return EXIT_QUERY_FAILURE;
        }
    }

    // Explicit sources first, then the project scan; a file named by both is parsed once.
    private List<Path> collectSources(Config config) {
        Set<Path> sources = new LinkedHashSet<>(config.sources());
        config.projectRoot().ifPresent(root -> sources.addAll(
                new SourceFinder(config.includePatterns(), config.excludePatterns()).find(root)));
        return new ArrayList<>(sources);
    }

    private ParseReport index(Config config, List<Path> sources, ModuleCorpus corpus) {
        SourceUnitReader reader = new SourceUnitReader(config.treeSuffix());
        List<SourceUnit> units = new ArrayList<>();
        List<FileFailure> unreadable = new ArrayList<>();
        for (Path source : sources) {
            try {
                units.add(reader.read(source));
            } catch (UncheckedIOException ex) {
                LOGGER.warn("Skipping unreadable input {}: {}", source, ex.getMessage());
                unreadable.add(new FileFailure(source.toString(), ex.getMessage()));
            }
        }
        ParseCache cache = config.cacheDirectory()
                .<ParseCache>map(JsonFileParseCache::new)
                .orElse(ParseCache.disabled());
        ParseService service = new ParseService(new TreeTextDecoder(config.decodeMode(), config.indentWidth()),
                new StructuralExtractor(), cache, corpus, config.parseThreads());
        return service.parseAll(units).withFailures(unreadable);
    }

    private Object runQuery(Config config, QueryEngine engine) {
        return switch (config.queryType()) {
            case REGISTERS -> engine.queryRegisters(config.scope(), config.kind());
            case MODULE -> engine.analyzeModule(config.module().orElseThrow(), config.facet());
            case TRACE -> engine.traceSignal(config.signal().orElseThrow(), config.scope());
            case STATS -> engine.getProjectStats();
            case MODULES -> engine.listModules();
        };
    }

    private String render(Object result) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to render query result", ex);
        }
    }
}
