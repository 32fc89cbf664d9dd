package ai.rtlparser.analyzer.parse;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the source files of a project tree by glob.
 *
 * <p>A pattern without {@code /} is matched against the file name at any depth ({@code *.sv}), a
 * pattern with one against the path relative to the root ({@code rtl/**}, {@code tb/*.v}).
 * A file is kept when it matches an include pattern and no exclude pattern.
 */
public class SourceFinder {

    public static final List<String> DEFAULT_INCLUDES = List.of("*.v", "*.sv");

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceFinder.class);

    private final List<String> includes;
    private final List<String> excludes;

    public SourceFinder() {
        this(DEFAULT_INCLUDES, List.of());
    }

    public SourceFinder(List<String> includes, List<String> excludes) {
        Objects.requireNonNull(includes, "includes");
        Objects.requireNonNull(excludes, "excludes");
        this.includes = includes.isEmpty() ? DEFAULT_INCLUDES : List.copyOf(includes);
        this.excludes = List.copyOf(excludes);
    }

    /**
     * Matching files under {@code root}, ordered by their relative path.
     */
    public List<Path> find(Path root) {
        Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root)) {
            throw new UncheckedIOException("Project root is not a directory: " + root,
                    new NotDirectoryException(root.toString()));
        }
        List<Glob> includeGlobs = compile(includes);
        List<Glob> excludeGlobs = compile(excludes);
        List<Path> matches;
        try (Stream<Path> paths = Files.walk(root)) {
            matches = paths.filter(Files::isRegularFile)
                    .filter(path -> {
                        Path relative = root.relativize(path);
                        return matchesAny(includeGlobs, relative) && !matchesAny(excludeGlobs, relative);
                    })
                    .sorted(Comparator.comparing(path -> separatorsToSlash(root.relativize(path))))
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to scan " + root, ex);
        }
        LOGGER.info("Found {} source file(s) under {}", matches.size(), root);
        return matches;
    }

    private static List<Glob> compile(List<String> patterns) {
        List<Glob> globs = new ArrayList<>(patterns.size());
        for (String raw : patterns) {
            String pattern = raw.trim().replace('\\', '/');
            if (pattern.isEmpty()) {
                continue;
            }
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            globs.add(new Glob(matcher, !pattern.contains("/")));
        }
        return globs;
    }

    private static boolean matchesAny(List<Glob> globs, Path relative) {
        for (Glob glob : globs) {
            Path candidate = glob.fileNameOnly() ? relative.getFileName() : relative;
            if (candidate != null && glob.matcher().matches(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static String separatorsToSlash(Path path) {
        return path.toString().replace('\\', '/');
    }

    private record Glob(PathMatcher matcher, boolean fileNameOnly) {
    }
}
