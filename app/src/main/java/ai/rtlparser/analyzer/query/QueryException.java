package ai.rtlparser.analyzer.query;

/**
 * Base type for queries that name something the corpus does not contain.
 */
public class QueryException extends RuntimeException {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
