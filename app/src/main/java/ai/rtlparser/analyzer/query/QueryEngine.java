package ai.rtlparser.analyzer.query;

import ai.rtlparser.analyzer.corpus.CorpusSnapshot;
import ai.rtlparser.analyzer.corpus.ModuleCorpus;
import ai.rtlparser.analyzer.model.AssignmentTarget;
import ai.rtlparser.analyzer.model.HdlModule;
import ai.rtlparser.analyzer.model.Instance;
import ai.rtlparser.analyzer.model.Parameter;
import ai.rtlparser.analyzer.model.Port;
import ai.rtlparser.analyzer.model.PortDirection;
import ai.rtlparser.analyzer.model.ProceduralBlock;
import ai.rtlparser.analyzer.model.Register;
import ai.rtlparser.analyzer.model.RegisterKind;
import ai.rtlparser.analyzer.model.Signal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers structural queries. Each call reads one corpus snapshot taken on entry, so results stay
 * consistent while other threads keep indexing.
 */
public class QueryEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryEngine.class);

    private final Supplier<CorpusSnapshot> snapshots;

    public QueryEngine(ModuleCorpus corpus) {
        this(Objects.requireNonNull(corpus, "corpus")::snapshot);
    }

    public QueryEngine(Supplier<CorpusSnapshot> snapshots) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    }

    public RegisterQueryResult queryRegisters(Optional<String> scope, RegisterKindFilter kind) {
        Objects.requireNonNull(kind, "kind");
        CorpusSnapshot snapshot = snapshots.get();
        if (scope.isPresent() && !snapshot.containsModule(scope.get())) {
            throw new InvalidScopeException(scope.get());
        }

        List<RegisterEntry> entries = new ArrayList<>();
        Map<String, Integer> byModule = new LinkedHashMap<>();
        int flipFlops = 0;
        int latches = 0;
        long flipFlopBits = 0;
        long latchBits = 0;
        for (HdlModule module : inScope(snapshot, scope)) {
            for (Register register : module.registers()) {
                if (!kind.matches(register.kind())) {
                    continue;
                }
                entries.add(new RegisterEntry(module.name(), module.file(), register.name(), register.width(),
                        register.line(), register.kind()));
                byModule.merge(module.name(), 1, Integer::sum);
                if (register.kind() == RegisterKind.FLIP_FLOP) {
                    flipFlops++;
                    flipFlopBits += register.width();
                } else {
                    latches++;
                    latchBits += register.width();
                }
            }
        }
        LOGGER.debug("Register query scope={} kind={} matched {}", scope.orElse("*"), kind.label(), entries.size());
        RegisterStats stats = new RegisterStats(entries.size(), flipFlops, latches, flipFlopBits, latchBits, byModule);
        return new RegisterQueryResult(entries, stats);
    }

    public ModuleAnalysis analyzeModule(String name, AnalysisFacet facet) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(facet, "facet");
        CorpusSnapshot snapshot = snapshots.get();
        HdlModule module = snapshot.findModule(name).orElseThrow(() -> new ModuleNotFoundException(name));

        Optional<List<Port>> ports = Optional.empty();
        Optional<PortSummary> portSummary = Optional.empty();
        if (facet.includes(AnalysisFacet.PORTS)) {
            ports = Optional.of(module.ports());
            portSummary = Optional.of(summarize(module.ports()));
        }
        Optional<List<Parameter>> parameters = facet.includes(AnalysisFacet.PARAMETERS)
                ? Optional.of(module.parameters())
                : Optional.empty();

        Optional<List<Instance>> instances = Optional.empty();
        Optional<List<String>> instantiates = Optional.empty();
        Optional<List<String>> instantiatedIn = Optional.empty();
        if (facet.includes(AnalysisFacet.HIERARCHY)) {
            instances = Optional.of(module.instances());
            Set<String> types = new LinkedHashSet<>();
            for (Instance instance : module.instances()) {
                types.add(instance.moduleType());
            }
            instantiates = Optional.of(List.copyOf(types));
            instantiatedIn = Optional.of(parentsOf(snapshot, module.name()));
        }
        return new ModuleAnalysis(module.name(), module.file(), module.line(), ports, portSummary, parameters,
                instances, instantiates, instantiatedIn);
    }

    /**
     * Every declaration, assignment and instance connection that uses {@code name}. Unknown names
     * and unknown scopes both give an empty list.
     */
    public List<SignalOccurrence> traceSignal(String name, Optional<String> scope) {
        Objects.requireNonNull(name, "name");
        CorpusSnapshot snapshot = snapshots.get();
        Set<SignalOccurrence> occurrences = new LinkedHashSet<>();
        for (HdlModule module : inScope(snapshot, scope)) {
            for (Port port : module.ports()) {
                if (port.name().equals(name)) {
                    occurrences.add(occurrence(name, OccurrenceKind.PORT, module, port.line(), port.direction().label()));
                }
            }
            for (Signal signal : module.signals()) {
                if (signal.name().equals(name)) {
                    occurrences.add(occurrence(name, OccurrenceKind.SIGNAL, module, signal.line(), signal.type().label()));
                }
            }
            for (Register register : module.registers()) {
                if (register.name().equals(name)) {
                    occurrences.add(occurrence(name, OccurrenceKind.REGISTER, module, register.line(), register.kind().label()));
                }
            }
            for (ProceduralBlock block : module.proceduralBlocks()) {
                for (AssignmentTarget target : block.assignments()) {
                    if (target.name().equals(name)) {
                        occurrences.add(occurrence(name, OccurrenceKind.ASSIGNMENT, module, target.line(), block.keyword()));
                    }
                }
            }
            for (AssignmentTarget target : module.continuousAssignments()) {
                if (target.name().equals(name)) {
                    occurrences.add(occurrence(name, OccurrenceKind.ASSIGNMENT, module, target.line(), "assign"));
                }
            }
            for (Instance instance : module.instances()) {
                instance.connections().forEach((port, connected) -> {
                    if (connected.equals(name)) {
                        occurrences.add(occurrence(name, OccurrenceKind.CONNECTION, module, instance.line(),
                                instance.name() + "." + port));
                    }
                });
            }
        }
        return List.copyOf(occurrences);
    }

    public ProjectStats getProjectStats() {
        CorpusSnapshot snapshot = snapshots.get();
        if (snapshot.isEmpty()) {
            return ProjectStats.empty();
        }
        int registers = 0;
        int flipFlops = 0;
        int latches = 0;
        int ports = 0;
        int inputs = 0;
        int outputs = 0;
        int inouts = 0;
        int instances = 0;
        int signals = 0;
        int parameters = 0;
        Set<String> files = new HashSet<>();
        for (HdlModule module : snapshot.modules()) {
            files.add(module.file());
            for (Register register : module.registers()) {
                registers++;
                if (register.kind() == RegisterKind.FLIP_FLOP) {
                    flipFlops++;
                } else {
                    latches++;
                }
            }
            PortSummary summary = summarize(module.ports());
            ports += summary.total();
            inputs += summary.inputs();
            outputs += summary.outputs();
            inouts += summary.inouts();
            instances += module.instances().size();
            signals += module.signals().size();
            parameters += module.parameters().size();
        }
        return new ProjectStats(snapshot.modules().size(), files.size(), registers, flipFlops, latches,
                ports, inputs, outputs, inouts, instances, signals, parameters);
    }

    public List<ModuleSummary> listModules() {
        List<ModuleSummary> summaries = new ArrayList<>();
        for (HdlModule module : snapshots.get().modules()) {
            summaries.add(new ModuleSummary(module.name(), module.file(), module.line(), module.ports().size(),
                    module.registers().size(), module.instances().size()));
        }
        return summaries;
    }

    private static List<HdlModule> inScope(CorpusSnapshot snapshot, Optional<String> scope) {
        if (scope.isEmpty()) {
            return snapshot.modules();
        }
        List<HdlModule> matches = new ArrayList<>();
        for (HdlModule module : snapshot.modules()) {
            if (module.name().equals(scope.get())) {
                matches.add(module);
            }
        }
        return matches;
    }

    private static List<String> parentsOf(CorpusSnapshot snapshot, String moduleName) {
        Set<String> parents = new LinkedHashSet<>();
        for (HdlModule candidate : snapshot.modules()) {
            for (Instance instance : candidate.instances()) {
                if (instance.moduleType().equals(moduleName)) {
                    parents.add(candidate.name());
                }
            }
        }
        return List.copyOf(parents);
    }

    private static PortSummary summarize(List<Port> ports) {
        int inputs = 0;
        int outputs = 0;
        int inouts = 0;
        for (Port port : ports) {
            if (port.direction() == PortDirection.INPUT) {
                inputs++;
            } else if (port.direction() == PortDirection.OUTPUT) {
                outputs++;
            } else {
                inouts++;
            }
        }
        return new PortSummary(ports.size(), inputs, outputs, inouts);
    }

    private static SignalOccurrence occurrence(String name, OccurrenceKind kind, HdlModule module, int line, String detail) {
        return new SignalOccurrence(name, kind, module.name(), module.file(), line, detail);
    }
}
