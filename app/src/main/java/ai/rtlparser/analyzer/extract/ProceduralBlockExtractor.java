package ai.rtlparser.analyzer.extract;

import ai.rtlparser.analyzer.cst.SourceLineIndex;
import ai.rtlparser.analyzer.cst.TreeLeaf;
import ai.rtlparser.analyzer.cst.TreeNode;
import ai.rtlparser.analyzer.model.AssignmentTarget;
import ai.rtlparser.analyzer.model.BlockKind;
import ai.rtlparser.analyzer.model.ProceduralBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads {@code always} blocks and continuous assignments: sensitivity, clock edges and the
 * left-hand targets written inside them.
 */
class ProceduralBlockExtractor {

    private final SourceLineIndex lines;

    ProceduralBlockExtractor(SourceLineIndex lines) {
        this.lines = Objects.requireNonNull(lines, "lines");
    }

    ProceduralBlock block(TreeNode always) {
        List<TreeLeaf> leaves = always.leaves();
        String keyword = leaves.isEmpty() || !HdlKeywords.ALWAYS_KEYWORDS.contains(leaves.get(0).text())
                ? HdlKeywords.ALWAYS
                : leaves.get(0).text();
        int line = leaves.isEmpty() ? 0 : lines.lineOf(leaves.get(0).startOffset());

        List<TreeNode> events = always.findAll(CstTags.EVENT_EXPRESSION);
        boolean clocked = isClocked(events);
        BlockKind kind = clocked || HdlKeywords.ALWAYS_FF.equals(keyword) ? BlockKind.SEQUENTIAL : BlockKind.COMBINATIONAL;

        return new ProceduralBlock(keyword, kind, clocked, sensitivityList(always, events), line, assignmentTargets(always));
    }

    List<AssignmentTarget> continuousAssignments(TreeNode module) {
        List<AssignmentTarget> targets = new ArrayList<>();
        for (TreeNode statement : module.findAll(CstTags.CONTINUOUS_ASSIGNMENT)) {
            for (TreeNode assignment : statement.findAll(CstTags.NET_VARIABLE_ASSIGNMENT)) {
                lhsIdentifier(assignment).ifPresent(leaf ->
                        targets.add(new AssignmentTarget(leaf.text(), lines.lineOf(leaf.startOffset()))));
            }
        }
        return targets;
    }

    /**
     * A block is clocked iff any event-expression leaf reads exactly {@code posedge} or {@code negedge}.
     */
    static boolean isClocked(List<TreeNode> events) {
        for (TreeNode event : events) {
            for (TreeLeaf leaf : event.leaves()) {
                if (HdlKeywords.CLOCK_EDGES.contains(leaf.text())) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<String> sensitivityList(TreeNode always, List<TreeNode> events) {
        if (!events.isEmpty()) {
            List<String> entries = new ArrayList<>(events.size());
            for (TreeNode event : events) {
                entries.add(event.leaves().stream().map(TreeLeaf::text).collect(Collectors.joining(" ")));
            }
            return entries;
        }
        Optional<TreeNode> control = always.findFirst(CstTags.EVENT_CONTROL);
        if (control.isPresent()) {
            for (TreeLeaf leaf : control.get().leaves()) {
                if ("*".equals(leaf.text()) || "@*".equals(leaf.text())) {
                    return List.of("*");
                }
            }
        }
        return List.of();
    }

    private List<AssignmentTarget> assignmentTargets(TreeNode block) {
        List<AssignmentTarget> targets = new ArrayList<>();
        for (TreeNode assignment : block.findAll(CstTags.ASSIGNMENTS)) {
            lhsIdentifier(assignment).ifPresent(leaf ->
                    targets.add(new AssignmentTarget(leaf.text(), lines.lineOf(leaf.startOffset()))));
        }
        return targets;
    }

    // First identifier of the LHS; indices and member selects that follow are ignored.
    private static Optional<TreeLeaf> lhsIdentifier(TreeNode assignment) {
        Optional<TreeNode> lhs = assignment.findFirst(CstTags.LP_VALUE);
        if (lhs.isPresent()) {
            return DeclarationExtractor.firstIdentifier(lhs.get());
        }
        for (TreeLeaf leaf : assignment.leaves()) {
            if ("=".equals(leaf.text()) || "<=".equals(leaf.text())) {
                break;
            }
            if (CstTags.isIdentifier(leaf.tag())) {
                return Optional.of(leaf);
            }
        }
        return Optional.empty();
    }
}
