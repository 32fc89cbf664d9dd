package ai.rtlparser.analyzer.config;

import ai.rtlparser.analyzer.cli.CliArguments;
import ai.rtlparser.analyzer.cst.DecodeMode;
import ai.rtlparser.analyzer.cst.TreeTextDecoder;
import ai.rtlparser.analyzer.parse.SourceUnitReader;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults.
 * A CLI value always wins over the environment.
 */
public class ConfigLoader {

    static final String ENV_QUERY = "RTL_QUERY";
    static final String ENV_TREE_SUFFIX = "RTL_TREE_SUFFIX";
    static final String ENV_DECODE_MODE = "RTL_DECODE_MODE";
    static final String ENV_INDENT_WIDTH = "RTL_INDENT_WIDTH";
    static final String ENV_PARSE_THREADS = "RTL_PARSE_THREADS";
    static final String ENV_CACHE_DIR = "RTL_CACHE_DIR";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_PROJECT_ROOT = "RTL_PROJECT_ROOT";
    static final String ENV_INCLUDE = "RTL_INCLUDE";
    static final String ENV_EXCLUDE = "RTL_EXCLUDE";

    private final EnvironmentReader environmentReader;
    private final int availableProcessors;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, Runtime.getRuntime().availableProcessors());
    }

    ConfigLoader(EnvironmentReader environmentReader, int availableProcessors) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.availableProcessors = Math.max(1, availableProcessors);
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        QueryType queryType = resolveQueryType(arguments);
        String treeSuffix = firstNonBlank(arguments.treeSuffix(), ENV_TREE_SUFFIX, SourceUnitReader.DEFAULT_TREE_SUFFIX);
        DecodeMode decodeMode = resolveDecodeMode(arguments);
        int indentWidth = resolvePositive(arguments.indentWidth(), ENV_INDENT_WIDTH, TreeTextDecoder.DEFAULT_INDENT_WIDTH);
        int parseThreads = resolvePositive(arguments.threads(), ENV_PARSE_THREADS, availableProcessors);
        Optional<Path> cacheDirectory = Optional.ofNullable(arguments.cacheDirectory())
                .or(() -> environmentReader.get(ENV_CACHE_DIR)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(Path::of));
        LogFormat logFormat = resolveLogFormat(arguments);
        Optional<Path> projectRoot = Optional.ofNullable(arguments.projectRoot())
                .or(() -> environmentReader.get(ENV_PROJECT_ROOT)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(Path::of));
        List<String> includePatterns = resolvePatterns(arguments.includePatterns(), ENV_INCLUDE);
        List<String> excludePatterns = resolvePatterns(arguments.excludePatterns(), ENV_EXCLUDE);

        return new Config(queryType,
                arguments.sources(),
                projectRoot,
                includePatterns,
                excludePatterns,
                optional(arguments.module()),
                arguments.facet(),
                optional(arguments.signal()),
                optional(arguments.scope()),
                arguments.kind(),
                treeSuffix,
                decodeMode,
                indentWidth,
                parseThreads,
                cacheDirectory,
                logFormat,
                arguments.verbose());
    }

    private QueryType resolveQueryType(CliArguments arguments) {
        QueryType cliQuery = arguments.queryType();
        if (cliQuery != null) {
            return cliQuery;
        }
        return environmentReader.get(ENV_QUERY)
                .filter(ConfigLoader::isNotBlank)
                .map(QueryType::from)
                .orElse(QueryType.STATS);
    }

    private DecodeMode resolveDecodeMode(CliArguments arguments) {
        DecodeMode cliMode = arguments.decodeMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_DECODE_MODE)
                .filter(ConfigLoader::isNotBlank)
                .map(DecodeMode::from)
                .orElse(DecodeMode.LENIENT);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolvePositive(Integer cliValue, String envKey, int defaultValue) {
        if (cliValue != null) {
            return requirePositive(cliValue, envKey);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePositiveInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private List<String> resolvePatterns(List<String> cliPatterns, String envKey) {
        List<String> patterns = cliPatterns == null ? List.of() : parsePatterns(cliPatterns.stream());
        if (!patterns.isEmpty()) {
            return patterns;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(raw -> parsePatterns(Arrays.stream(raw.split(","))))
                .orElse(List.of());
    }

    private static List<String> parsePatterns(Stream<String> raw) {
        return raw.map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.replace('\\', '/'))
                .collect(Collectors.toList());
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static int parsePositiveInteger(String raw, String key) {
        try {
            return requirePositive(Integer.parseInt(raw), key);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static int requirePositive(int value, String key) {
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be at least 1");
        }
        return value;
    }

    private static Optional<String> optional(String value) {
        return Optional.ofNullable(value).filter(ConfigLoader::isNotBlank);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
