package ai.rtlparser.analyzer.query;

public class InvalidScopeException extends QueryException {

    private final String scope;

    public InvalidScopeException(String scope) {
        super("Scope does not match any module: " + scope);
        this.scope = scope;
    }

    public String scope() {
        return scope;
    }
}
