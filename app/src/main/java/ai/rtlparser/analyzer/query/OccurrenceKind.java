package ai.rtlparser.analyzer.query;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OccurrenceKind {
    PORT("port"),
    SIGNAL("signal"),
    REGISTER("register"),
    ASSIGNMENT("assignment"),
    CONNECTION("connection");

    private final String label;

    OccurrenceKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
