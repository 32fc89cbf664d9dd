package ai.rtlparser.analyzer.corpus;

import ai.rtlparser.analyzer.model.HdlModule;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared store of extracted modules keyed by source file. Writers are serialized and publish a new
 * {@link CorpusSnapshot}; readers take the current snapshot without locking.
 */
public class ModuleCorpus {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModuleCorpus.class);

    private final AtomicReference<CorpusSnapshot> current = new AtomicReference<>(CorpusSnapshot.empty());
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * Replaces whatever was indexed for {@code file}. A re-inserted file keeps its original position.
     */
    public void insert(String file, List<HdlModule> modules) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(modules, "modules");
        writeLock.lock();
        try {
            current.set(current.get().with(file, modules));
        } finally {
            writeLock.unlock();
        }
        LOGGER.debug("Indexed {} module(s) from {}", modules.size(), file);
    }

    public boolean remove(String file) {
        Objects.requireNonNull(file, "file");
        writeLock.lock();
        try {
            CorpusSnapshot before = current.get();
            CorpusSnapshot after = before.without(file);
            current.set(after);
            return after != before;
        } finally {
            writeLock.unlock();
        }
    }

    public CorpusSnapshot snapshot() {
        return current.get();
    }
}
