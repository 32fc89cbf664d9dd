package ai.rtlparser.analyzer.query;

import ai.rtlparser.analyzer.model.RegisterKind;
import java.util.Objects;

/**
 * A register together with the module and file that declare it.
 */
public record RegisterEntry(String module, String file, String name, int width, int line, RegisterKind kind) {

    public RegisterEntry {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }
}
