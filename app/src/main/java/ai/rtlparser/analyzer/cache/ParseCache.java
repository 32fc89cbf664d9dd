package ai.rtlparser.analyzer.cache;

import ai.rtlparser.analyzer.model.HdlModule;
import java.util.List;
import java.util.Optional;

/**
 * Stores extraction results so unchanged files skip decoding and extraction.
 */
public interface ParseCache {

    Optional<List<HdlModule>> lookup(FileIdentity identity);

    void store(FileIdentity identity, List<HdlModule> modules);

    static ParseCache disabled() {
        return NoOpParseCache.INSTANCE;
    }
}
