package ai.rtlparser.analyzer.model;

import java.util.Objects;

/**
 * Module port with its declared direction, storage type and bit width.
 */
public record Port(String name, PortDirection direction, NetType type, int width, int line) {

    public Port {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(type, "type");
        if (width < 1) {
            throw new IllegalArgumentException("Port width must be at least 1: " + name);
        }
    }
}
