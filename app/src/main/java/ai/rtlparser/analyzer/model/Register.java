package ai.rtlparser.analyzer.model;

import java.util.Objects;

/**
 * Storage element inferred from a {@code reg}/{@code logic} declaration.
 */
public record Register(String name, int width, int line, RegisterKind kind) {

    public Register {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (width < 1) {
            throw new IllegalArgumentException("Register width must be at least 1: " + name);
        }
    }

    public static Register provisional(String name, int width, int line) {
        return new Register(name, width, line, RegisterKind.POTENTIAL_REGISTER);
    }

    public Register withKind(RegisterKind resolved) {
        return new Register(name, width, line, resolved);
    }
}
