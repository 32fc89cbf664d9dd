package ai.rtlparser.analyzer.cst;

import java.util.Objects;

/**
 * Terminal token of the concrete syntax tree with its byte span in the source file.
 */
public record TreeLeaf(int index, String tag, String text, int startOffset, int endOffset) implements TreeElement {

    public TreeLeaf {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(text, "text");
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid leaf offsets " + startOffset + "-" + endOffset);
        }
    }

    @Override
    public boolean isLeaf() {
        return true;
    }
}
