package ai.rtlparser.analyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Storage classification of a register. {@link #POTENTIAL_REGISTER} only exists between
 * extraction and classification.
 */
public enum RegisterKind {
    POTENTIAL_REGISTER("potential_register"),
    FLIP_FLOP("flip_flop"),
    LATCH("latch");

    private final String label;

    RegisterKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isResolved() {
        return this != POTENTIAL_REGISTER;
    }

    @JsonCreator
    public static RegisterKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Register kind must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (RegisterKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported register kind: " + raw);
    }
}
