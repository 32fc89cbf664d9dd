package ai.rtlparser.analyzer.config;

import ai.rtlparser.analyzer.cst.DecodeMode;
import ai.rtlparser.analyzer.parse.SourceFinder;
import ai.rtlparser.analyzer.query.AnalysisFacet;
import ai.rtlparser.analyzer.query.RegisterKindFilter;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        QueryType queryType,
        List<Path> sources,
        Optional<Path> projectRoot,
        List<String> includePatterns,
        List<String> excludePatterns,
        Optional<String> module,
        AnalysisFacet facet,
        Optional<String> signal,
        Optional<String> scope,
        RegisterKindFilter kind,
        String treeSuffix,
        DecodeMode decodeMode,
        int indentWidth,
        int parseThreads,
        Optional<Path> cacheDirectory,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(queryType, "queryType");
        sources = sources == null ? List.of() : List.copyOf(sources);
        projectRoot = projectRoot == null ? Optional.empty() : projectRoot;
        if (sources.isEmpty() && projectRoot.isEmpty()) {
            throw new IllegalArgumentException("At least one source file or --root must be provided");
        }
        includePatterns = includePatterns == null || includePatterns.isEmpty()
                ? SourceFinder.DEFAULT_INCLUDES
                : List.copyOf(includePatterns);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        module = module == null ? Optional.empty() : module;
        facet = facet == null ? AnalysisFacet.ALL : facet;
        signal = signal == null ? Optional.empty() : signal;
        scope = scope == null ? Optional.empty() : scope;
        kind = kind == null ? RegisterKindFilter.ALL : kind;
        treeSuffix = requireNonBlank(treeSuffix, "treeSuffix");
        Objects.requireNonNull(decodeMode, "decodeMode");
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be at least 1");
        }
        if (parseThreads < 1) {
            throw new IllegalArgumentException("parseThreads must be at least 1");
        }
        cacheDirectory = cacheDirectory == null ? Optional.empty() : cacheDirectory;
        Objects.requireNonNull(logFormat, "logFormat");
        if (queryType == QueryType.MODULE && module.isEmpty()) {
            throw new IllegalArgumentException("--module is required for the module query");
        }
        if (queryType == QueryType.TRACE && signal.isEmpty()) {
            throw new IllegalArgumentException("--signal is required for the trace query");
        }
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
