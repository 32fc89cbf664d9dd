package ai.rtlparser.analyzer.extract;

import ai.rtlparser.analyzer.classify.RegisterClassifier;
import ai.rtlparser.analyzer.cst.SourceLineIndex;
import ai.rtlparser.analyzer.cst.SyntaxTree;
import ai.rtlparser.analyzer.cst.TreeLeaf;
import ai.rtlparser.analyzer.cst.TreeNode;
import ai.rtlparser.analyzer.model.AssignmentTarget;
import ai.rtlparser.analyzer.model.HdlModule;
import ai.rtlparser.analyzer.model.Instance;
import ai.rtlparser.analyzer.model.Parameter;
import ai.rtlparser.analyzer.model.Port;
import ai.rtlparser.analyzer.model.ProceduralBlock;
import ai.rtlparser.analyzer.model.Register;
import ai.rtlparser.analyzer.model.Signal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts one {@link HdlModule} per module declaration found in a decoded CST. Extraction is purely
 * syntactic: widths are never evaluated and parameters are kept as raw text.
 */
public class StructuralExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(StructuralExtractor.class);

    private final RegisterClassifier classifier;

    public StructuralExtractor() {
        this(new RegisterClassifier());
    }

    public StructuralExtractor(RegisterClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public List<HdlModule> extract(SyntaxTree tree, String sourceText, String file) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(file, "file");
        SourceLineIndex lines = new SourceLineIndex(sourceText);
        List<HdlModule> modules = new ArrayList<>();
        for (TreeNode top : tree.topLevelNodes()) {
            for (TreeNode declaration : top.findAll(CstTags.MODULE_DECLARATION)) {
                extractModule(declaration, lines, file).ifPresent(modules::add);
            }
        }
        LOGGER.debug("Extracted {} module(s) from {}", modules.size(), file);
        return modules;
    }

    private Optional<HdlModule> extractModule(TreeNode declaration, SourceLineIndex lines, String file) {
        TreeNode header = declaration.findFirst(CstTags.MODULE_HEADER).orElse(declaration);
        Optional<TreeLeaf> nameLeaf = moduleName(header);
        if (nameLeaf.isEmpty()) {
            LOGGER.warn("Skipping module declaration without a name in {}", file);
            return Optional.empty();
        }
        String name = nameLeaf.get().text();

        DeclarationExtractor declarations = new DeclarationExtractor(lines);
        ProceduralBlockExtractor procedural = new ProceduralBlockExtractor(lines);

        List<Parameter> parameters = new ArrayList<>();
        for (TreeNode node : declaration.findAll(CstTags.PARAM_DECLARATION)) {
            parameter(node, lines).ifPresent(parameters::add);
        }

        List<Port> ports = new ArrayList<>();
        for (TreeNode node : declaration.findAll(CstTags.PORT_DECLARATION)) {
            ports.addAll(declarations.ports(node));
        }

        List<Register> provisional = new ArrayList<>();
        Set<String> registerNames = new HashSet<>();
        for (Port port : ports) {
            if (port.direction().drivesOut() && port.type().mayHoldState() && registerNames.add(port.name())) {
                provisional.add(Register.provisional(port.name(), port.width(), port.line()));
            }
        }

        List<Signal> signals = new ArrayList<>();
        List<Instance> instances = new ArrayList<>();
        for (TreeNode node : declaration.findAll(Set.of(CstTags.DATA_DECLARATION, CstTags.NET_DECLARATION,
                CstTags.MODULE_INSTANTIATION))) {
            if (CstTags.MODULE_INSTANTIATION.equals(node.tag())
                    || (CstTags.DATA_DECLARATION.equals(node.tag()) && declarations.isInstantiation(node))) {
                instance(node, lines).ifPresent(instances::add);
                continue;
            }
            DeclarationExtractor.DeclaredSignals declared = declarations.dataDeclaration(node);
            signals.addAll(declared.signals());
            for (Register register : declared.registers()) {
                if (registerNames.add(register.name())) {
                    provisional.add(register);
                }
            }
        }

        List<ProceduralBlock> blocks = new ArrayList<>();
        for (TreeNode node : declaration.findAll(CstTags.ALWAYS_STATEMENT)) {
            blocks.add(procedural.block(node));
        }
        List<AssignmentTarget> continuous = procedural.continuousAssignments(declaration);

        List<Register> registers = classifier.classify(provisional, blocks);
        int line = lines.lineOf(nameLeaf.get().startOffset());
        return Optional.of(new HdlModule(name, file, line, ports, parameters, signals, registers, instances, blocks, continuous));
    }

    private Optional<TreeLeaf> moduleName(TreeNode header) {
        List<TreeLeaf> leaves = header.leaves();
        for (int i = 0; i < leaves.size(); i++) {
            String text = leaves.get(i).text();
            if (!HdlKeywords.MODULE.equals(text) && !HdlKeywords.MACROMODULE.equals(text)) {
                continue;
            }
            for (int j = i + 1; j < leaves.size(); j++) {
                if (CstTags.isIdentifier(leaves.get(j).tag())) {
                    return Optional.of(leaves.get(j));
                }
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    private Optional<Parameter> parameter(TreeNode declaration, SourceLineIndex lines) {
        List<TreeLeaf> leaves = declaration.leaves(CstTags.DIMENSIONS);
        Optional<TreeLeaf> name = DeclarationExtractor.firstIdentifier(declaration);
        if (name.isEmpty()) {
            LOGGER.debug("Parameter declaration without identifier skipped");
            return Optional.empty();
        }
        boolean local = false;
        String type = Parameter.DEFAULT_TYPE;
        boolean typeFound = false;
        String value = "";
        for (int i = 0; i < leaves.size(); i++) {
            String text = leaves.get(i).text();
            if (HdlKeywords.LOCALPARAM.equals(text)) {
                local = true;
            } else if (!typeFound && HdlKeywords.PARAMETER_TYPES.contains(text)) {
                type = text;
                typeFound = true;
            } else if ("=".equals(text)) {
                if (i + 1 < leaves.size()) {
                    value = leaves.get(i + 1).text();
                }
                break;
            }
        }
        return Optional.of(new Parameter(name.get().text(), type, value, lines.lineOf(name.get().startOffset()), local));
    }

    private Optional<Instance> instance(TreeNode node, SourceLineIndex lines) {
        List<TreeLeaf> identifiers = node.leaves(CstTags.DIMENSIONS).stream()
                .filter(leaf -> CstTags.isIdentifier(leaf.tag()))
                .collect(Collectors.toList());
        if (identifiers.isEmpty()) {
            LOGGER.debug("Instantiation without identifiers skipped");
            return Optional.empty();
        }
        TreeLeaf moduleType = identifiers.get(0);
        Optional<TreeLeaf> instanceName = node.findFirst(CstTags.GATE_INSTANCE)
                .flatMap(DeclarationExtractor::firstIdentifier)
                .or(() -> identifiers.size() > 1 ? Optional.of(identifiers.get(1)) : Optional.empty());
        if (instanceName.isEmpty()) {
            LOGGER.debug("Instantiation of {} without an instance name skipped", moduleType.text());
            return Optional.empty();
        }

        Map<String, String> connections = new LinkedHashMap<>();
        for (TreeNode port : node.findAll(CstTags.ACTUAL_NAMED_PORT)) {
            List<TreeLeaf> ids = port.leaves().stream()
                    .filter(leaf -> CstTags.isIdentifier(leaf.tag()))
                    .collect(Collectors.toList());
            if (!ids.isEmpty()) {
                connections.put(ids.get(0).text(), ids.size() > 1 ? ids.get(1).text() : "");
            }
        }
        Map<String, String> overrides = new LinkedHashMap<>();
        for (TreeNode parameter : node.findAll(CstTags.PARAM_BY_NAME)) {
            namedValue(parameter).ifPresent(entry -> overrides.put(entry.getKey(), entry.getValue()));
        }
        return Optional.of(new Instance(moduleType.text(), instanceName.get().text(),
                lines.lineOf(moduleType.startOffset()), connections, overrides));
    }

    // ".NAME(value)" -> NAME=value, with the value's tokens concatenated.
    private static Optional<Map.Entry<String, String>> namedValue(TreeNode node) {
        List<TreeLeaf> leaves = node.leaves();
        int nameIndex = -1;
        for (int i = 0; i < leaves.size(); i++) {
            if (CstTags.isIdentifier(leaves.get(i).tag())) {
                nameIndex = i;
                break;
            }
        }
        if (nameIndex < 0) {
            return Optional.empty();
        }
        List<TreeLeaf> rest = new ArrayList<>(leaves.subList(nameIndex + 1, leaves.size()));
        if (!rest.isEmpty() && "(".equals(rest.get(0).text())) {
            rest.remove(0);
        }
        if (!rest.isEmpty() && ")".equals(rest.get(rest.size() - 1).text())) {
            rest.remove(rest.size() - 1);
        }
        String value = rest.stream().map(TreeLeaf::text).collect(Collectors.joining());
        return Optional.of(Map.entry(leaves.get(nameIndex).text(), value));
    }
}
