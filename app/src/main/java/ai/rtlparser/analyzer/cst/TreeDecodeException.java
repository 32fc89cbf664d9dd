package ai.rtlparser.analyzer.cst;

/**
 * Runtime exception raised when a CST dump cannot be turned into a tree.
 */
public class TreeDecodeException extends RuntimeException {

    public TreeDecodeException(String message) {
        super(message);
    }

    public TreeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
