package ai.rtlparser.analyzer.cst;

/**
 * Controls how the tree decoder treats lines that match neither the node nor the leaf grammar.
 */
public enum DecodeMode {
    LENIENT,
    STRICT;

    public static DecodeMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return LENIENT;
        }
        for (DecodeMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported decode mode: " + raw);
    }
}
