package ai.rtlparser.analyzer.classify;

import ai.rtlparser.analyzer.model.AssignmentTarget;
import ai.rtlparser.analyzer.model.ProceduralBlock;
import ai.rtlparser.analyzer.model.Register;
import ai.rtlparser.analyzer.model.RegisterKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves provisional registers. A register assigned anywhere inside a clocked block is a
 * flip-flop; every other provisional register is a latch. Write order across blocks is not tracked,
 * so a register written in both a clocked and an unclocked block is still a flip-flop.
 */
public class RegisterClassifier {

    public List<Register> classify(List<Register> provisional, List<ProceduralBlock> blocks) {
        Set<String> clockedTargets = clockedTargets(blocks);
        List<Register> resolved = new ArrayList<>(provisional.size());
        for (Register register : provisional) {
            if (register.kind().isResolved()) {
                throw new IllegalStateException("Register " + register.name() + " is already classified as "
                        + register.kind().label());
            }
            resolved.add(register.withKind(kindOf(register, clockedTargets)));
        }
        return resolved;
    }

    public static RegisterKind kindOf(Register register, Set<String> clockedTargets) {
        return clockedTargets.contains(register.name()) ? RegisterKind.FLIP_FLOP : RegisterKind.LATCH;
    }

    public static Set<String> clockedTargets(List<ProceduralBlock> blocks) {
        Set<String> targets = new HashSet<>();
        for (ProceduralBlock block : blocks) {
            if (!block.clocked()) {
                continue;
            }
            for (AssignmentTarget target : block.assignments()) {
                targets.add(target.name());
            }
        }
        return targets;
    }
}
