package ai.rtlparser.analyzer.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import ai.rtlparser.analyzer.TestFixtures;
import ai.rtlparser.analyzer.corpus.ModuleCorpus;
import ai.rtlparser.analyzer.model.HdlModule;
import ai.rtlparser.analyzer.model.Instance;
import ai.rtlparser.analyzer.model.Parameter;
import ai.rtlparser.analyzer.model.Register;
import ai.rtlparser.analyzer.model.RegisterKind;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class QueryEngineTest {

    private final QueryEngine engine = new QueryEngine(
            TestFixtures.corpusOf(TestFixtures.DFF, TestFixtures.LATCH, TestFixtures.SOC));

    @Test
    void queryRegistersReturnsEveryRegisterWithStatistics() {
        RegisterQueryResult result = engine.queryRegisters(Optional.empty(), RegisterKindFilter.ALL);

        assertThat(result.registers())
                .extracting(RegisterEntry::module, RegisterEntry::name, RegisterEntry::kind)
                .containsExactly(
                        tuple("dff", "q", RegisterKind.FLIP_FLOP),
                        tuple("l", "q", RegisterKind.LATCH),
                        tuple("counter", "count", RegisterKind.FLIP_FLOP),
                        tuple("counter", "state", RegisterKind.FLIP_FLOP),
                        tuple("counter", "next_state", RegisterKind.LATCH),
                        tuple("counter", "unused_flag", RegisterKind.LATCH));
        RegisterStats stats = result.stats();
        assertThat(stats.total()).isEqualTo(6);
        assertThat(stats.flipFlops()).isEqualTo(3);
        assertThat(stats.latches()).isEqualTo(3);
        assertThat(stats.flipFlopBits()).isEqualTo(9);
        assertThat(stats.latchBits()).isEqualTo(6);
        assertThat(stats.byModule()).containsExactly(
                Map.entry("dff", 1), Map.entry("l", 1), Map.entry("counter", 4));
    }

    @Test
    void queryRegistersFiltersByScopeAndKind() {
        RegisterQueryResult result = engine.queryRegisters(Optional.of("counter"), RegisterKindFilter.FLIP_FLOP);

        assertThat(result.registers()).extracting(RegisterEntry::name).containsExactly("count", "state");
        assertThat(result.registers()).extracting(RegisterEntry::file).containsOnly(TestFixtures.SOC);
        assertThat(result.stats().latches()).isZero();
    }

    @Test
    void queryRegistersRejectsUnknownScope() {
        Throwable thrown = catchThrowable(() -> engine.queryRegisters(Optional.of("nope"), RegisterKindFilter.ALL));

        assertThat(thrown).isInstanceOf(InvalidScopeException.class).hasMessageContaining("nope");
        assertThat(((InvalidScopeException) thrown).scope()).isEqualTo("nope");
    }

    @Test
    void analyzeModuleReportsHierarchyInBothDirections() {
        ModuleAnalysis counter = engine.analyzeModule("counter", AnalysisFacet.HIERARCHY);

        assertThat(counter.file()).isEqualTo(TestFixtures.SOC);
        assertThat(counter.line()).isEqualTo(2);
        assertThat(counter.instances()).contains(List.of());
        assertThat(counter.instantiatedIn()).contains(List.of("top"));
        assertThat(counter.ports()).isEmpty();
        assertThat(counter.parameters()).isEmpty();

        ModuleAnalysis top = engine.analyzeModule("top", AnalysisFacet.HIERARCHY);
        assertThat(top.instantiates()).contains(List.of("counter"));
        assertThat(top.instances().orElseThrow()).extracting(Instance::name).containsExactly("u_counter");
    }

    @Test
    void analyzeModuleWithAllFacets() {
        ModuleAnalysis top = engine.analyzeModule("top", AnalysisFacet.ALL);

        assertThat(top.portSummary()).contains(new PortSummary(3, 2, 1, 0));
        assertThat(top.parameters()).contains(List.of());
        assertThat(top.instantiatedIn()).contains(List.of());

        ModuleAnalysis counter = engine.analyzeModule("counter", AnalysisFacet.PARAMETERS);
        assertThat(counter.parameters().orElseThrow()).extracting(Parameter::name).containsExactly("WIDTH", "STEP");
        assertThat(counter.instances()).isEmpty();
    }

    @Test
    void analyzeModuleFailsForUnknownModule() {
        Throwable thrown = catchThrowable(() -> engine.analyzeModule("ghost", AnalysisFacet.ALL));

        assertThat(thrown).isInstanceOf(ModuleNotFoundException.class).hasMessageContaining("ghost");
    }

    @Test
    void traceSignalFindsDeclarationsAssignmentsAndConnections() {
        List<SignalOccurrence> occurrences = engine.traceSignal("done", Optional.empty());

        assertThat(occurrences)
                .extracting(SignalOccurrence::kind, SignalOccurrence::module, SignalOccurrence::line, SignalOccurrence::detail)
                .containsExactly(
                        tuple(OccurrenceKind.PORT, "counter", 10, "output"),
                        tuple(OccurrenceKind.ASSIGNMENT, "counter", 16, "assign"),
                        tuple(OccurrenceKind.PORT, "top", 28, "output"),
                        tuple(OccurrenceKind.CONNECTION, "top", 30, "u_counter.done"));
    }

    @Test
    void traceSignalWithinScopeReportsRegisterAndProceduralWrites() {
        List<SignalOccurrence> occurrences = engine.traceSignal("state", Optional.of("counter"));

        assertThat(occurrences)
                .extracting(SignalOccurrence::kind, SignalOccurrence::line, SignalOccurrence::detail)
                .containsExactly(
                        tuple(OccurrenceKind.SIGNAL, 12, "reg"),
                        tuple(OccurrenceKind.REGISTER, 12, "flip_flop"),
                        tuple(OccurrenceKind.ASSIGNMENT, 19, "always"),
                        tuple(OccurrenceKind.ASSIGNMENT, 21, "always"));
    }

    @Test
    void traceSignalOnUnknownNameOrScopeIsEmpty() {
        assertThat(engine.traceSignal("no_such_signal", Optional.empty())).isEmpty();
        assertThat(engine.traceSignal("clk", Optional.of("no_such_module"))).isEmpty();
    }

    @Test
    void projectStatsAggregateTheWholeCorpus() {
        ProjectStats stats = engine.getProjectStats();

        assertThat(stats).isEqualTo(new ProjectStats(4, 3, 6, 3, 3, 14, 9, 5, 0, 1, 5, 2));
    }

    @Test
    void projectStatsOnEmptyCorpusAreZero() {
        ProjectStats stats = new QueryEngine(new ModuleCorpus()).getProjectStats();

        assertThat(stats).isEqualTo(ProjectStats.empty());
        assertThat(stats.modules()).isZero();
        assertThat(stats.registers()).isZero();
    }

    @Test
    void listModulesSummarizesInCorpusOrder() {
        assertThat(engine.listModules())
                .extracting(ModuleSummary::name, ModuleSummary::ports, ModuleSummary::registers, ModuleSummary::instances)
                .containsExactly(
                        tuple("dff", 3, 1, 0),
                        tuple("l", 3, 1, 0),
                        tuple("counter", 5, 4, 0),
                        tuple("top", 3, 0, 1));
    }

    @Test
    void eachCallReadsTheCurrentSnapshot() {
        ModuleCorpus corpus = new ModuleCorpus();
        QueryEngine live = new QueryEngine(corpus);
        assertThat(live.listModules()).isEmpty();

        corpus.insert(TestFixtures.DFF, TestFixtures.extract(TestFixtures.DFF));

        assertThat(live.listModules()).extracting(ModuleSummary::name).containsExactly("dff");
    }

    @Test
    void projectStatsCountOnlyFilesThatDeclareModules() {
        ModuleCorpus corpus = TestFixtures.corpusOf(TestFixtures.DFF);
        corpus.insert("package_only.sv", List.of());

        ProjectStats stats = new QueryEngine(corpus).getProjectStats();

        assertThat(stats.files()).isEqualTo(1);
        assertThat(stats.modules()).isEqualTo(1);
    }

    @Test
    void registerBitTotalsExceedingAnIntAreNotTruncated() {
        ModuleCorpus corpus = new ModuleCorpus();
        corpus.insert("wide.sv", List.of(
                wideModule("wide_a", RegisterKind.FLIP_FLOP),
                wideModule("wide_b", RegisterKind.FLIP_FLOP),
                wideModule("wide_c", RegisterKind.LATCH),
                wideModule("wide_d", RegisterKind.LATCH)));

        RegisterStats stats = new QueryEngine(corpus).queryRegisters(Optional.empty(), RegisterKindFilter.ALL).stats();

        assertThat(stats.flipFlopBits()).isEqualTo(2L * Integer.MAX_VALUE);
        assertThat(stats.latchBits()).isEqualTo(2L * Integer.MAX_VALUE);
    }

    private static HdlModule wideModule(String name, RegisterKind kind) {
        return new HdlModule(name, "wide.sv", 1, List.of(), List.of(), List.of(),
                List.of(new Register("bus", Integer.MAX_VALUE, 2, kind)), List.of(), List.of(), List.of());
    }
}
