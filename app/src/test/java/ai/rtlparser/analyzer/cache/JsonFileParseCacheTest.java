package ai.rtlparser.analyzer.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.rtlparser.analyzer.TestFixtures;
import ai.rtlparser.analyzer.model.HdlModule;
import ai.rtlparser.analyzer.model.ModelJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileParseCacheTest {

    @TempDir
    Path cacheDir;

    @Test
    void storedModulesRoundTripThroughJson() {
        List<HdlModule> modules = TestFixtures.extract(TestFixtures.SOC);
        FileIdentity identity = identityOf(TestFixtures.SOC);
        JsonFileParseCache cache = new JsonFileParseCache(cacheDir);

        cache.store(identity, modules);

        assertThat(new JsonFileParseCache(cacheDir).lookup(identity)).contains(modules);
    }

    @Test
    void missingEntryIsAMiss() {
        assertThat(new JsonFileParseCache(cacheDir).lookup(identityOf(TestFixtures.DFF))).isEmpty();
    }

    @Test
    void changedContentIsAMiss() {
        JsonFileParseCache cache = new JsonFileParseCache(cacheDir);
        cache.store(identityOf(TestFixtures.DFF), TestFixtures.extract(TestFixtures.DFF));

        FileIdentity edited = FileIdentity.of(TestFixtures.DFF, TestFixtures.read(TestFixtures.DFF) + "\n",
                TestFixtures.read(TestFixtures.DFF + ".cst"));

        assertThat(cache.lookup(edited)).isEmpty();
    }

    @Test
    void storeOverwritesPreviousEntryForSamePath() {
        JsonFileParseCache cache = new JsonFileParseCache(cacheDir);
        FileIdentity first = new FileIdentity("a.v", "one");
        FileIdentity second = new FileIdentity("a.v", "two");
        cache.store(first, TestFixtures.extract(TestFixtures.DFF));

        cache.store(second, TestFixtures.extract(TestFixtures.LATCH));

        assertThat(cache.lookup(first)).isEmpty();
        assertThat(cache.lookup(second).orElseThrow()).extracting(HdlModule::name).containsExactly("l");
    }

    @Test
    void corruptEntryRaisesCacheException() throws Exception {
        JsonFileParseCache cache = new JsonFileParseCache(cacheDir);
        FileIdentity identity = identityOf(TestFixtures.DFF);
        Files.writeString(cache.entryFile(identity), "{not json");

        Throwable thrown = catchThrowable(() -> cache.lookup(identity));

        assertThat(thrown)
                .isInstanceOf(CacheException.class)
                .hasMessageContaining("Failed to read cache entry");
    }

    @Test
    void failedWriteLeavesNoTemporaryFileBehind() throws Exception {
        ObjectMapper failingMapper = new ObjectMapper() {
            @Override
            public void writeValue(File resultFile, Object value) throws IOException {
                throw new IOException("disk full");
            }
        };
        JsonFileParseCache cache = new JsonFileParseCache(cacheDir, failingMapper);
        FileIdentity identity = identityOf(TestFixtures.DFF);

        Throwable thrown = catchThrowable(() -> cache.store(identity, TestFixtures.extract(TestFixtures.DFF)));

        assertThat(thrown)
                .isInstanceOf(CacheException.class)
                .hasMessageContaining("Failed to write cache entry")
                .hasRootCauseMessage("disk full");
        try (Stream<Path> entries = Files.list(cacheDir)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void successfulStoreLeavesOnlyTheEntryFile() throws Exception {
        JsonFileParseCache cache = new JsonFileParseCache(cacheDir);
        FileIdentity identity = identityOf(TestFixtures.DFF);

        cache.store(identity, TestFixtures.extract(TestFixtures.DFF));

        String json = Files.readString(cache.entryFile(identity));
        assertThat(ModelJson.newObjectMapper().readTree(json).get("contentHash").asText())
                .isEqualTo(identity.contentHash());
        try (Stream<Path> entries = Files.list(cacheDir)) {
            assertThat(entries).containsExactly(cache.entryFile(identity));
        }
    }

    private static FileIdentity identityOf(String name) {
        return FileIdentity.of(name, TestFixtures.read(name), TestFixtures.read(name + ".cst"));
    }
}
