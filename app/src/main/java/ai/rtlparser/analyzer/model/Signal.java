package ai.rtlparser.analyzer.model;

import java.util.Objects;

/**
 * Internal net or variable declared inside a module body.
 */
public record Signal(String name, NetType type, int width, int line) {

    public Signal {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (width < 1) {
            throw new IllegalArgumentException("Signal width must be at least 1: " + name);
        }
    }
}
