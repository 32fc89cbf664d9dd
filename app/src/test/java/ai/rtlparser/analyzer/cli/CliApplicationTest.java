package ai.rtlparser.analyzer.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.rtlparser.analyzer.TestFixtures;
import ai.rtlparser.analyzer.config.ConfigLoader;
import ai.rtlparser.analyzer.model.ModelJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    private final ObjectMapper mapper = ModelJson.newObjectMapper();
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @TempDir
    Path workDir;

    private Path dff;
    private Path latch;
    private Path soc;

    @BeforeEach
    void copyFixtures() throws Exception {
        dff = TestFixtures.copyTo(workDir, TestFixtures.DFF);
        latch = TestFixtures.copyTo(workDir, TestFixtures.LATCH);
        soc = TestFixtures.copyTo(workDir, TestFixtures.SOC);
    }

    @Test
    void statsQueryPrintsProjectCountsAsJson() throws Exception {
        int exitCode = run("--query", "stats", "--threads", "2", dff.toString(), latch.toString(), soc.toString());

        assertThat(exitCode).isZero();
        JsonNode stats = mapper.readTree(out.toString());
        assertThat(stats.get("modules").asInt()).isEqualTo(4);
        assertThat(stats.get("files").asInt()).isEqualTo(3);
        assertThat(stats.get("registers").asInt()).isEqualTo(6);
        assertThat(stats.get("flipFlops").asInt()).isEqualTo(3);
        assertThat(stats.get("latches").asInt()).isEqualTo(3);
        assertThat(stats.get("instances").asInt()).isEqualTo(1);
    }

    @Test
    void registersQueryFiltersByKind() throws Exception {
        int exitCode = run("--query", "registers", "--kind", "flip_flop", dff.toString(), latch.toString(), soc.toString());

        assertThat(exitCode).isZero();
        JsonNode result = mapper.readTree(out.toString());
        List<String> names = new ArrayList<>();
        for (JsonNode register : result.get("registers")) {
            assertThat(register.get("kind").asText()).isEqualTo("flip_flop");
            names.add(register.get("module").asText() + "." + register.get("name").asText());
        }
        assertThat(names).containsExactly("dff.q", "counter.count", "counter.state");
        assertThat(result.get("stats").get("latches").asInt()).isZero();
    }

    @Test
    void moduleQueryReportsHierarchy() throws Exception {
        int exitCode = run("--query", "module", "--module", "counter", "--facet", "hierarchy", soc.toString());

        assertThat(exitCode).isZero();
        JsonNode analysis = mapper.readTree(out.toString());
        assertThat(analysis.get("name").asText()).isEqualTo("counter");
        assertThat(analysis.get("instantiatedIn").get(0).asText()).isEqualTo("top");
        assertThat(analysis.has("ports")).isFalse();
    }

    @Test
    void unknownModuleIsAQueryFailure() {
        int exitCode = run("--query", "module", "--module", "nope", soc.toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_QUERY_FAILURE);
        assertThat(err.toString()).contains("Module not found: nope");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unknownScopeIsAQueryFailure() {
        int exitCode = run("--query", "registers", "--scope", "missing", soc.toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_QUERY_FAILURE);
        assertThat(err.toString()).contains("missing");
    }

    @Test
    void fileWithoutDumpDoesNotStopTheOthers() throws Exception {
        Path lonely = workDir.resolve("lonely.v");
        Files.writeString(lonely, "module lonely; endmodule\n");

        int exitCode = run("--query", "modules", lonely.toString(), dff.toString());

        assertThat(exitCode).isZero();
        assertThat(err.toString()).contains("Failed to parse " + lonely);
        JsonNode modules = mapper.readTree(out.toString());
        assertThat(modules).hasSize(1);
        assertThat(modules.get(0).get("name").asText()).isEqualTo("dff");
    }

    @Test
    void failsWhenNoInputCanBeParsed() {
        int exitCode = run("--query", "stats", workDir.resolve("absent.v").toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_QUERY_FAILURE);
        assertThat(err.toString()).contains("No input could be parsed");
    }

    @Test
    void missingSourcesIsInvalidInput() {
        int exitCode = run("--query", "stats");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unsupportedQueryTypeIsInvalidInput() {
        int exitCode = run("--query", "everything", dff.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("everything");
    }

    @Test
    void cacheDirectoryIsPopulated() throws Exception {
        Path cacheDir = workDir.resolve("cache");

        int exitCode = run("--cache-dir", cacheDir.toString(), dff.toString());

        assertThat(exitCode).isZero();
        try (var entries = Files.list(cacheDir)) {
            assertThat(entries).hasSize(1);
        }
    }

    @Test
    void projectRootIsScannedWithIncludeAndExcludePatterns() throws Exception {
        Path project = workDir.resolve("project");
        Files.createDirectories(project.resolve("rtl"));
        Files.createDirectories(project.resolve("tb"));
        TestFixtures.copyTo(project.resolve("rtl"), TestFixtures.SOC);
        TestFixtures.copyTo(project.resolve("tb"), TestFixtures.DFF);

        int exitCode = run("--query", "modules", "--root", project.toString(), "--exclude", "tb/**");

        assertThat(exitCode).isZero();
        JsonNode modules = mapper.readTree(out.toString());
        List<String> names = new ArrayList<>();
        for (JsonNode module : modules) {
            names.add(module.get("name").asText());
        }
        assertThat(names).containsExactly("counter", "top");
    }

    @Test
    void explicitSourcesAndProjectRootAreCombinedWithoutDuplicates() throws Exception {
        int exitCode = run("--query", "stats", "--include", "dff.v,soc.sv", "--root", workDir.toString(), dff.toString());

        assertThat(exitCode).isZero();
        JsonNode stats = mapper.readTree(out.toString());
        assertThat(stats.get("files").asInt()).isEqualTo(2);
        assertThat(stats.get("modules").asInt()).isEqualTo(3);
    }

    @Test
    void unreadableProjectRootIsAFailure() {
        int exitCode = run("--root", workDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_QUERY_FAILURE);
        assertThat(err.toString()).contains("Project root is not a directory");
    }

    private int run(String... args) {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                new PrintWriter(out, true), new PrintWriter(err, true));
        return application.run(args);
    }
}
