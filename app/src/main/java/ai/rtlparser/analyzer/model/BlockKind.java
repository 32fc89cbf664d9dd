package ai.rtlparser.analyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Sensitivity classification of a procedural block.
 */
public enum BlockKind {
    COMBINATIONAL("combinational"),
    SEQUENTIAL("sequential");

    private final String label;

    BlockKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static BlockKind from(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (BlockKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported block kind: " + raw);
    }
}
