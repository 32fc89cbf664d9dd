package ai.rtlparser.analyzer.model;

import java.util.Objects;

/**
 * Left-hand side identifier of an assignment and the line it appears on.
 */
public record AssignmentTarget(String name, int line) {

    public AssignmentTarget {
        Objects.requireNonNull(name, "name");
    }
}
