package ai.rtlparser.analyzer.model;

import java.util.List;
import java.util.Objects;

/**
 * An {@code always}-family block with its sensitivity and the targets assigned inside it.
 *
 * @param keyword the block keyword: {@code always}, {@code always_ff}, {@code always_comb} or {@code always_latch}
 * @param clocked true when an event expression uses {@code posedge} or {@code negedge}
 */
public record ProceduralBlock(String keyword,
                              BlockKind kind,
                              boolean clocked,
                              List<String> sensitivityList,
                              int line,
                              List<AssignmentTarget> assignments) {

    public ProceduralBlock {
        Objects.requireNonNull(keyword, "keyword");
        Objects.requireNonNull(kind, "kind");
        sensitivityList = sensitivityList == null ? List.of() : List.copyOf(sensitivityList);
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
    }
}
