package ai.rtlparser.analyzer.extract;

import ai.rtlparser.analyzer.cst.SourceLineIndex;
import ai.rtlparser.analyzer.cst.TreeLeaf;
import ai.rtlparser.analyzer.cst.TreeNode;
import ai.rtlparser.analyzer.model.NetType;
import ai.rtlparser.analyzer.model.Port;
import ai.rtlparser.analyzer.model.PortDirection;
import ai.rtlparser.analyzer.model.Register;
import ai.rtlparser.analyzer.model.Signal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns port, data and net declarations into ports, signals and provisional registers.
 *
 * <p>Leaves are classified one by one into direction keywords, storage keywords, identifiers and
 * everything else, so a single keyword set applies to every identifier of a grouped declaration
 * regardless of order. Dimension subtrees are pruned so symbolic bounds never become names.
 */
class DeclarationExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeclarationExtractor.class);

    private final SourceLineIndex lines;

    DeclarationExtractor(SourceLineIndex lines) {
        this.lines = Objects.requireNonNull(lines, "lines");
    }

    List<Port> ports(TreeNode declaration) {
        PortDirection direction = PortDirection.INPUT;
        NetType type = null;
        List<TreeLeaf> names = new ArrayList<>();
        for (TreeLeaf leaf : declaration.leaves(CstTags.DIMENSIONS)) {
            switch (variantOf(leaf)) {
                case DIRECTION -> direction = PortDirection.from(leaf.text());
                case STORAGE_TYPE -> {
                    if (type == null) {
                        type = NetType.from(leaf.text());
                    }
                }
                case IDENTIFIER -> names.add(leaf);
                case OTHER -> {
                }
            }
        }
        if (type == null) {
            type = NetType.WIRE;
        }
        if (names.isEmpty()) {
            LOGGER.debug("Port declaration at line {} has no identifiers", lineOf(declaration));
            return List.of();
        }
        int width = DimensionWidth.of(declaration);
        List<Port> ports = new ArrayList<>(names.size());
        for (TreeLeaf name : names) {
            ports.add(new Port(name.text(), direction, type, width, lines.lineOf(name.startOffset())));
        }
        return ports;
    }

    DeclaredSignals dataDeclaration(TreeNode declaration) {
        NetType type = storageTypeOf(declaration);
        int width = DimensionWidth.of(declaration);
        List<TreeLeaf> names = declaredNames(declaration);

        List<Signal> signals = new ArrayList<>(names.size());
        List<Register> registers = new ArrayList<>();
        for (TreeLeaf name : names) {
            int line = lines.lineOf(name.startOffset());
            signals.add(new Signal(name.text(), type, width, line));
            if (type.mayHoldState()) {
                registers.add(Register.provisional(name.text(), width, line));
            }
        }
        return new DeclaredSignals(signals, registers);
    }

    /**
     * Whether a data declaration is really a module instantiation, which Verible prints as a
     * data declaration with a gate instance and no storage keyword.
     */
    boolean isInstantiation(TreeNode declaration) {
        if (!declaration.contains(CstTags.GATE_INSTANCE)) {
            return false;
        }
        return explicitStorageType(declaration).isEmpty();
    }

    private NetType storageTypeOf(TreeNode declaration) {
        return explicitStorageType(declaration).orElseGet(() -> {
            LOGGER.debug("Declaration at line {} has no storage keyword; assuming wire", lineOf(declaration));
            return NetType.WIRE;
        });
    }

    private Optional<NetType> explicitStorageType(TreeNode declaration) {
        for (TreeLeaf leaf : declaration.leaves(CstTags.DIMENSIONS)) {
            if (variantOf(leaf) == LeafVariant.STORAGE_TYPE) {
                return Optional.of(NetType.from(leaf.text()));
            }
        }
        return Optional.empty();
    }

    private List<TreeLeaf> declaredNames(TreeNode declaration) {
        List<TreeNode> variables = declaration.findAll(CstTags.DECLARED_VARIABLES);
        List<TreeLeaf> names = new ArrayList<>();
        if (!variables.isEmpty()) {
            for (TreeNode variable : variables) {
                firstIdentifier(variable).ifPresent(names::add);
            }
            return names;
        }
        // No variable nodes: every bare identifier is a name, except initializer operands.
        boolean inInitializer = false;
        for (TreeLeaf leaf : declaration.leaves(CstTags.DIMENSIONS)) {
            String text = leaf.text();
            if ("=".equals(text)) {
                inInitializer = true;
            } else if (",".equals(text) || ";".equals(text)) {
                inInitializer = false;
            } else if (!inInitializer && variantOf(leaf) == LeafVariant.IDENTIFIER) {
                names.add(leaf);
            }
        }
        return names;
    }

    static Optional<TreeLeaf> firstIdentifier(TreeNode node) {
        for (TreeLeaf leaf : node.leaves(CstTags.DIMENSIONS)) {
            if (variantOf(leaf) == LeafVariant.IDENTIFIER) {
                return Optional.of(leaf);
            }
        }
        return Optional.empty();
    }

    static LeafVariant variantOf(TreeLeaf leaf) {
        String text = leaf.text();
        if (HdlKeywords.DIRECTIONS.contains(text)) {
            return LeafVariant.DIRECTION;
        }
        if (HdlKeywords.NET_TYPES.contains(text)) {
            return LeafVariant.STORAGE_TYPE;
        }
        if (CstTags.isIdentifier(leaf.tag())) {
            return LeafVariant.IDENTIFIER;
        }
        return LeafVariant.OTHER;
    }

    private int lineOf(TreeNode node) {
        return node.firstLeaf().map(leaf -> lines.lineOf(leaf.startOffset())).orElse(0);
    }

    enum LeafVariant {
        DIRECTION,
        STORAGE_TYPE,
        IDENTIFIER,
        OTHER
    }

    record DeclaredSignals(List<Signal> signals, List<Register> registers) {
    }
}
