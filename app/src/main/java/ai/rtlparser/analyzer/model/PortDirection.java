package ai.rtlparser.analyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Direction keyword of a port declaration.
 */
public enum PortDirection {
    INPUT("input"),
    OUTPUT("output"),
    INOUT("inout");

    private final String label;

    PortDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean drivesOut() {
        return this != INPUT;
    }

    @JsonCreator
    public static PortDirection from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Port direction must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (PortDirection direction : values()) {
            if (direction.label.equals(normalized)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unsupported port direction: " + raw);
    }
}
