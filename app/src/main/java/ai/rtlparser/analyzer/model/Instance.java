package ai.rtlparser.analyzer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Instantiation of another module. Connections map a formal port to the connected signal name
 * (empty when left open); overrides map a parameter name to its raw value text.
 */
public record Instance(String moduleType,
                       String name,
                       int line,
                       Map<String, String> connections,
                       Map<String, String> parameterOverrides) {

    public Instance {
        Objects.requireNonNull(moduleType, "moduleType");
        Objects.requireNonNull(name, "name");
        connections = connections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(connections));
        parameterOverrides = parameterOverrides == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameterOverrides));
    }
}
