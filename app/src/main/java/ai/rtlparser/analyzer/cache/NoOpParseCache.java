package ai.rtlparser.analyzer.cache;

import ai.rtlparser.analyzer.model.HdlModule;
import java.util.List;
import java.util.Optional;

final class NoOpParseCache implements ParseCache {

    static final NoOpParseCache INSTANCE = new NoOpParseCache();

    private NoOpParseCache() {
    }

    @Override
    public Optional<List<HdlModule>> lookup(FileIdentity identity) {
        return Optional.empty();
    }

    @Override
    public void store(FileIdentity identity, List<HdlModule> modules) {
        // nothing to keep
    }
}
