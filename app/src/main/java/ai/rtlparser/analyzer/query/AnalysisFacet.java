package ai.rtlparser.analyzer.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Part of a module reported by {@link QueryEngine#analyzeModule(String, AnalysisFacet)}.
 */
public enum AnalysisFacet {
    HIERARCHY("hierarchy"),
    PORTS("ports"),
    PARAMETERS("parameters"),
    ALL("all");

    private final String label;

    AnalysisFacet(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean includes(AnalysisFacet facet) {
        return this == ALL || this == facet;
    }

    @JsonCreator
    public static AnalysisFacet from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AnalysisFacet facet : values()) {
            if (facet.label.equals(normalized)) {
                return facet;
            }
        }
        throw new IllegalArgumentException("Unsupported analysis facet: " + raw);
    }
}
