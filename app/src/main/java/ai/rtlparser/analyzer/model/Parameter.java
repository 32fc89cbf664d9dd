package ai.rtlparser.analyzer.model;

import java.util.Objects;

/**
 * Parameter or localparam declaration. The value is the raw token text, never evaluated.
 */
public record Parameter(String name, String type, String value, int line, boolean local) {

    public static final String DEFAULT_TYPE = "integer";

    public Parameter {
        Objects.requireNonNull(name, "name");
        type = type == null || type.isBlank() ? DEFAULT_TYPE : type;
        value = value == null ? "" : value;
    }
}
