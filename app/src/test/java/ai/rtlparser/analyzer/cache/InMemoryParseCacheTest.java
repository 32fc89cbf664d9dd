package ai.rtlparser.analyzer.cache;

import static org.assertj.core.api.Assertions.assertThat;

import ai.rtlparser.analyzer.TestFixtures;
import ai.rtlparser.analyzer.model.HdlModule;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryParseCacheTest {

    @Test
    void lookupHitsOnlyForIdenticalIdentity() {
        InMemoryParseCache cache = new InMemoryParseCache();
        List<HdlModule> modules = TestFixtures.extract(TestFixtures.DFF);
        FileIdentity identity = FileIdentity.of("dff.v", "source", "tree");

        cache.store(identity, modules);

        assertThat(cache.lookup(FileIdentity.of("dff.v", "source", "tree"))).contains(modules);
        assertThat(cache.lookup(FileIdentity.of("dff.v", "source", "other tree"))).isEmpty();
        assertThat(cache.lookup(FileIdentity.of("copy.v", "source", "tree"))).isEmpty();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void contentHashSeparatesSourceFromTree() {
        assertThat(FileIdentity.of("a.v", "ab", "c").contentHash())
                .isNotEqualTo(FileIdentity.of("a.v", "a", "bc").contentHash())
                .hasSize(64);
    }

    @Test
    void disabledCacheNeverHits() {
        ParseCache cache = ParseCache.disabled();
        FileIdentity identity = FileIdentity.of("a.v", "a", "b");

        cache.store(identity, TestFixtures.extract(TestFixtures.DFF));

        assertThat(cache.lookup(identity)).isEmpty();
    }
}
