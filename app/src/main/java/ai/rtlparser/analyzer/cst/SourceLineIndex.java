package ai.rtlparser.analyzer.cst;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Translates UTF-8 byte offsets reported by the CST dump into 1-based source line numbers.
 */
public final class SourceLineIndex {

    private final int[] newlineOffsets;

    public SourceLineIndex(String sourceText) {
        Objects.requireNonNull(sourceText, "sourceText");
        byte[] bytes = sourceText.getBytes(StandardCharsets.UTF_8);
        int count = 0;
        for (byte b : bytes) {
            if (b == '\n') {
                count++;
            }
        }
        int[] offsets = new int[count];
        int cursor = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                offsets[cursor++] = i;
            }
        }
        this.newlineOffsets = offsets;
    }

    public int lineCount() {
        return newlineOffsets.length + 1;
    }

    /**
     * Line containing the byte at {@code offset}: one plus the number of newlines before it.
     */
    public int lineOf(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        int position = Arrays.binarySearch(newlineOffsets, offset);
        int newlinesBefore = position >= 0 ? position : -position - 1;
        return newlinesBefore + 1;
    }
}
