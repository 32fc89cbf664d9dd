package ai.rtlparser.analyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Declared storage type of a port or signal. {@code reg} and {@code logic} may infer storage.
 */
public enum NetType {
    WIRE("wire"),
    REG("reg"),
    LOGIC("logic");

    private final String label;

    NetType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean mayHoldState() {
        return this == REG || this == LOGIC;
    }

    @JsonCreator
    public static NetType from(String raw) {
        if (raw == null || raw.isBlank()) {
            return WIRE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (NetType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported net type: " + raw);
    }
}
