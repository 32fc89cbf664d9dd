package ai.rtlparser.analyzer.parse;

import java.util.Objects;

public record FileFailure(String path, String message) {

    public FileFailure {
        Objects.requireNonNull(path, "path");
        message = message == null ? "" : message;
    }
}
