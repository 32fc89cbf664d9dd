package ai.rtlparser.analyzer.query;

import ai.rtlparser.analyzer.model.RegisterKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Register kind selector accepted by register queries.
 */
public enum RegisterKindFilter {
    FLIP_FLOP("flip_flop"),
    LATCH("latch"),
    ALL("all");

    private final String label;

    RegisterKindFilter(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean matches(RegisterKind kind) {
        return switch (this) {
            case FLIP_FLOP -> kind == RegisterKind.FLIP_FLOP;
            case LATCH -> kind == RegisterKind.LATCH;
            case ALL -> true;
        };
    }

    @JsonCreator
    public static RegisterKindFilter from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (RegisterKindFilter filter : values()) {
            if (filter.label.equals(normalized)) {
                return filter;
            }
        }
        throw new IllegalArgumentException("Unsupported register kind: " + raw);
    }
}
