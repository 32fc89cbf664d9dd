package ai.rtlparser.analyzer.cache;

import ai.rtlparser.analyzer.model.HdlModule;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryParseCache implements ParseCache {

    private final ConcurrentMap<FileIdentity, List<HdlModule>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<List<HdlModule>> lookup(FileIdentity identity) {
        return Optional.ofNullable(entries.get(Objects.requireNonNull(identity, "identity")));
    }

    @Override
    public void store(FileIdentity identity, List<HdlModule> modules) {
        entries.put(Objects.requireNonNull(identity, "identity"), List.copyOf(modules));
    }

    public int size() {
        return entries.size();
    }
}
