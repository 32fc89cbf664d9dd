package ai.rtlparser.analyzer.corpus;

import ai.rtlparser.analyzer.model.HdlModule;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of the corpus at one point in time. Files keep insertion order; modules keep
 * declaration order within their file.
 */
public final class CorpusSnapshot {

    private static final CorpusSnapshot EMPTY = new CorpusSnapshot(Map.of());

    private final Map<String, List<HdlModule>> modulesByFile;
    private final List<HdlModule> modules;

    private CorpusSnapshot(Map<String, List<HdlModule>> modulesByFile) {
        LinkedHashMap<String, List<HdlModule>> copy = new LinkedHashMap<>();
        List<HdlModule> all = new ArrayList<>();
        modulesByFile.forEach((file, list) -> {
            List<HdlModule> frozen = List.copyOf(list);
            copy.put(file, frozen);
            all.addAll(frozen);
        });
        this.modulesByFile = Collections.unmodifiableMap(copy);
        this.modules = List.copyOf(all);
    }

    public static CorpusSnapshot empty() {
        return EMPTY;
    }

    public static CorpusSnapshot of(Map<String, List<HdlModule>> modulesByFile) {
        return new CorpusSnapshot(Objects.requireNonNull(modulesByFile, "modulesByFile"));
    }

    public List<HdlModule> modules() {
        return modules;
    }

    public List<String> files() {
        return List.copyOf(modulesByFile.keySet());
    }

    public List<HdlModule> modulesIn(String file) {
        return modulesByFile.getOrDefault(file, List.of());
    }

    /**
     * First module with the given name in corpus order.
     */
    public Optional<HdlModule> findModule(String name) {
        for (HdlModule module : modules) {
            if (module.name().equals(name)) {
                return Optional.of(module);
            }
        }
        return Optional.empty();
    }

    public boolean containsModule(String name) {
        return findModule(name).isPresent();
    }

    public boolean isEmpty() {
        return modulesByFile.isEmpty();
    }

    CorpusSnapshot with(String file, List<HdlModule> fileModules) {
        LinkedHashMap<String, List<HdlModule>> next = new LinkedHashMap<>(modulesByFile);
        next.put(file, fileModules);
        return new CorpusSnapshot(next);
    }

    CorpusSnapshot without(String file) {
        if (!modulesByFile.containsKey(file)) {
            return this;
        }
        LinkedHashMap<String, List<HdlModule>> next = new LinkedHashMap<>(modulesByFile);
        next.remove(file);
        return new CorpusSnapshot(next);
    }
}
