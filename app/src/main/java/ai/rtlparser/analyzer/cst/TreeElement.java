package ai.rtlparser.analyzer.cst;

/**
 * Common view over an entry of a {@link SyntaxTree}, either a {@link TreeNode} or a {@link TreeLeaf}.
 */
public interface TreeElement {

    int index();

    String tag();

    boolean isLeaf();
}
