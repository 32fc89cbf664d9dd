package ai.rtlparser.analyzer.cst;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds a {@link SyntaxTree} from the indentation-based text dump printed by
 * {@code verible-verilog-syntax --printtree}.
 *
 * <pre>
 *   Node @0 (tag: kModuleDeclaration) {
 *     Leaf @0 (#"module" @0-6: "module")
 *     Leaf @1 (#SymbolIdentifier @7-10: "dff")
 * </pre>
 *
 * Depth comes from the leading spaces divided by the indent width. Open nodes are tracked on an
 * explicit stack; leaves attach to the stack top and are never pushed.
 */
public class TreeTextDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeTextDecoder.class);

    public static final int DEFAULT_INDENT_WIDTH = 2;

    private static final Pattern NODE_LINE = Pattern.compile("^( *)Node @\\d+ \\(tag: ([^\\s)]+)\\)\\s*(?:\\{\\s*}?)?\\s*$");
    private static final Pattern LEAF_LINE = Pattern.compile(
            "^( *)Leaf @\\d+ \\(#(\"(?:[^\"\\\\]|\\\\.)*\"|[^\\s\"]+) @(\\d+)-(\\d+): \"(.*)\"\\)\\s*$");
    private static final Pattern NOISE_LINE = Pattern.compile("^[\\s{}]*$");

    private final DecodeMode mode;
    private final int indentWidth;

    public TreeTextDecoder() {
        this(DecodeMode.LENIENT, DEFAULT_INDENT_WIDTH);
    }

    public TreeTextDecoder(DecodeMode mode, int indentWidth) {
        this.mode = Objects.requireNonNull(mode, "mode");
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be at least 1");
        }
        this.indentWidth = indentWidth;
    }

    public DecodeMode mode() {
        return mode;
    }

    public SyntaxTree decode(String dump) {
        Objects.requireNonNull(dump, "dump");
        SyntaxTree.Builder builder = SyntaxTree.builder();
        Deque<Integer> openNodes = new ArrayDeque<>();
        int skipped = 0;
        int lineNumber = 0;

        for (String line : dump.split("\\R", -1)) {
            lineNumber++;
            if (NOISE_LINE.matcher(line).matches()) {
                continue;
            }
            Matcher nodeMatch = NODE_LINE.matcher(line);
            if (nodeMatch.matches()) {
                int depth = depthOf(nodeMatch.group(1), lineNumber);
                unwindTo(openNodes, depth);
                int parent = openNodes.isEmpty() ? SyntaxTree.NO_PARENT : openNodes.peek();
                openNodes.push(builder.addNode(parent, nodeMatch.group(2)));
                continue;
            }
            Matcher leafMatch = LEAF_LINE.matcher(line);
            if (leafMatch.matches()) {
                int depth = depthOf(leafMatch.group(1), lineNumber);
                unwindTo(openNodes, depth);
                if (openNodes.isEmpty()) {
                    LOGGER.debug("Dropping leaf without an open node at dump line {}", lineNumber);
                    continue;
                }
                builder.addLeaf(openNodes.peek(),
                        unquote(leafMatch.group(2)),
                        unescape(leafMatch.group(5)),
                        parseOffset(leafMatch.group(3), lineNumber),
                        parseOffset(leafMatch.group(4), lineNumber));
                continue;
            }
            if (mode == DecodeMode.STRICT) {
                throw new TreeDecodeException("Unrecognized CST line " + lineNumber + ": " + abbreviate(line));
            }
            skipped++;
        }

        if (!builder.hasRoot()) {
            throw new TreeDecodeException("No root node found in CST dump");
        }
        if (skipped > 0) {
            LOGGER.warn("Skipped {} unrecognized CST line(s)", skipped);
        }
        return builder.skippedLines(skipped).build();
    }

    private int depthOf(String indent, int lineNumber) {
        int spaces = indent.length();
        if (mode == DecodeMode.STRICT && spaces % indentWidth != 0) {
            throw new TreeDecodeException("Indentation of " + spaces + " spaces at line " + lineNumber
                    + " is not a multiple of " + indentWidth);
        }
        return spaces / indentWidth;
    }

    private static void unwindTo(Deque<Integer> openNodes, int depth) {
        while (openNodes.size() > depth) {
            openNodes.pop();
        }
    }

    private static int parseOffset(String raw, int lineNumber) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new TreeDecodeException("Offset out of range at line " + lineNumber + ": " + raw, ex);
        }
    }

    private static String unquote(String tag) {
        if (tag.length() >= 2 && tag.startsWith("\"") && tag.endsWith("\"")) {
            return unescape(tag.substring(1, tag.length() - 1));
        }
        return tag;
    }

    private static String unescape(String text) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                switch (next) {
                    case '"', '\\' -> {
                        builder.append(next);
                        i++;
                    }
                    case 'n' -> {
                        builder.append('\n');
                        i++;
                    }
                    case 't' -> {
                        builder.append('\t');
                        i++;
                    }
                    default -> builder.append(ch);
                }
            } else {
                builder.append(ch);
            }
        }
        return builder.toString();
    }

    private static String abbreviate(String line) {
        return line.length() <= 120 ? line : line.substring(0, 117) + "...";
    }
}
