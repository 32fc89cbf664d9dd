package ai.rtlparser.analyzer.parse;

import java.util.Objects;

/**
 * A source file and the CST dump produced for it, both already in memory.
 */
public record SourceUnit(String path, String sourceText, String treeText) {

    public SourceUnit {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(sourceText, "sourceText");
        Objects.requireNonNull(treeText, "treeText");
    }
}
