package ai.rtlparser.analyzer.parse;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads a source file together with the CST dump stored next to it as {@code <source><suffix>}.
 */
public class SourceUnitReader {

    public static final String DEFAULT_TREE_SUFFIX = ".cst";

    private final String treeSuffix;

    public SourceUnitReader() {
        this(DEFAULT_TREE_SUFFIX);
    }

    public SourceUnitReader(String treeSuffix) {
        this.treeSuffix = Objects.requireNonNull(treeSuffix, "treeSuffix");
    }

    public SourceUnit read(Path source) {
        Path tree = treeFileFor(source);
        return new SourceUnit(source.toString(), readString(source), readString(tree));
    }

    public Path treeFileFor(Path source) {
        return source.resolveSibling(source.getFileName() + treeSuffix);
    }

    private static String readString(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + path, ex);
        }
    }
}
