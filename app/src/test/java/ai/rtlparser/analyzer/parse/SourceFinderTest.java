package ai.rtlparser.analyzer.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceFinderTest {

    @TempDir
    Path root;

    @BeforeEach
    void createProject() throws IOException {
        write("top.v");
        write("rtl/core.v");
        write("rtl/core.v.cst");
        write("rtl/sub/alu.sv");
        write("tb/tb_top.sv");
        write("docs/readme.md");
    }

    @Test
    void defaultPatternsCollectVerilogAndSystemVerilogAtAnyDepth() {
        List<Path> found = new SourceFinder().find(root);

        assertThat(relative(found)).containsExactly("rtl/core.v", "rtl/sub/alu.sv", "tb/tb_top.sv", "top.v");
    }

    @Test
    void excludePatternWithDirectorySkipsThatSubtree() {
        List<Path> found = new SourceFinder(List.of(), List.of("tb/**")).find(root);

        assertThat(relative(found)).containsExactly("rtl/core.v", "rtl/sub/alu.sv", "top.v");
    }

    @Test
    void excludePatternWithoutDirectoryMatchesFileNames() {
        List<Path> found = new SourceFinder(SourceFinder.DEFAULT_INCLUDES, List.of("tb_*", "core.*")).find(root);

        assertThat(relative(found)).containsExactly("rtl/sub/alu.sv", "top.v");
    }

    @Test
    void includePatternWithDirectoryIsRelativeToTheRoot() {
        List<Path> found = new SourceFinder(List.of("rtl/**.sv", "*.v"), List.of()).find(root);

        assertThat(relative(found)).containsExactly("rtl/core.v", "rtl/sub/alu.sv", "top.v");
    }

    @Test
    void missingRootIsReported() {
        Path missing = root.resolve("nowhere");

        Throwable thrown = catchThrowable(() -> new SourceFinder().find(missing));

        assertThat(thrown)
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Project root is not a directory");
    }

    private void write(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "// " + relative + "\n");
    }

    private List<String> relative(List<Path> paths) {
        return paths.stream()
                .map(path -> root.relativize(path).toString().replace('\\', '/'))
                .collect(Collectors.toList());
    }
}
