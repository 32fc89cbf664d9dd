package ai.rtlparser.analyzer.extract;

import ai.rtlparser.analyzer.cst.TreeLeaf;
import ai.rtlparser.analyzer.cst.TreeNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Bit width of a declaration from its packed dimensions: {@code |msb-lsb|+1} per range, ranges
 * multiplied. Anything symbolic or malformed yields 1.
 */
final class DimensionWidth {

    static final int DEFAULT_WIDTH = 1;

    private static final Pattern DECIMAL = Pattern.compile("[0-9][0-9_]*");

    private DimensionWidth() {
    }

    static int of(TreeNode declaration) {
        return declaration.findFirst(CstTags.PACKED_DIMENSIONS)
                .map(DimensionWidth::ofDimensions)
                .orElse(DEFAULT_WIDTH);
    }

    static int ofDimensions(TreeNode dimensions) {
        List<TreeLeaf> leaves = dimensions.leaves();
        List<List<TreeLeaf>> ranges = splitRanges(leaves);
        if (ranges.isEmpty()) {
            return bareBounds(leaves);
        }
        long width = 1;
        for (List<TreeLeaf> range : ranges) {
            Optional<Integer> rangeWidth = rangeWidth(range);
            if (rangeWidth.isEmpty()) {
                return DEFAULT_WIDTH;
            }
            width *= rangeWidth.get();
            if (width < 1 || width > Integer.MAX_VALUE) {
                return DEFAULT_WIDTH;
            }
        }
        return (int) width;
    }

    // Contents between each '[' and its closing ']'.
    private static List<List<TreeLeaf>> splitRanges(List<TreeLeaf> leaves) {
        List<List<TreeLeaf>> ranges = new ArrayList<>();
        List<TreeLeaf> current = null;
        int nesting = 0;
        for (TreeLeaf leaf : leaves) {
            String text = leaf.text();
            if ("[".equals(text)) {
                nesting++;
                if (nesting == 1) {
                    current = new ArrayList<>();
                    continue;
                }
            } else if ("]".equals(text)) {
                nesting--;
                if (nesting == 0 && current != null) {
                    ranges.add(current);
                    current = null;
                    continue;
                }
            }
            if (current != null) {
                current.add(leaf);
            }
        }
        return ranges;
    }

    private static Optional<Integer> rangeWidth(List<TreeLeaf> range) {
        int colon = -1;
        for (int i = 0; i < range.size(); i++) {
            if (":".equals(range.get(i).text())) {
                colon = i;
                break;
            }
        }
        if (colon != 1 || range.size() != 3) {
            return Optional.empty();
        }
        Optional<Integer> msb = parseBound(range.get(0));
        Optional<Integer> lsb = parseBound(range.get(2));
        if (msb.isEmpty() || lsb.isEmpty()) {
            return Optional.empty();
        }
        long width = span(msb.get(), lsb.get());
        return width > Integer.MAX_VALUE ? Optional.empty() : Optional.of((int) width);
    }

    private static int bareBounds(List<TreeLeaf> leaves) {
        List<Integer> numbers = new ArrayList<>();
        for (TreeLeaf leaf : leaves) {
            if (CstTags.isIdentifier(leaf.tag())) {
                return DEFAULT_WIDTH;
            }
            parseBound(leaf).ifPresent(numbers::add);
        }
        if (numbers.size() != 2) {
            return DEFAULT_WIDTH;
        }
        long width = span(numbers.get(0), numbers.get(1));
        return width > Integer.MAX_VALUE ? DEFAULT_WIDTH : (int) width;
    }

    private static long span(int msb, int lsb) {
        return Math.abs((long) msb - lsb) + 1;
    }

    private static Optional<Integer> parseBound(TreeLeaf leaf) {
        String text = leaf.text().trim();
        if (!DECIMAL.matcher(text).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(text.replace("_", "")));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
