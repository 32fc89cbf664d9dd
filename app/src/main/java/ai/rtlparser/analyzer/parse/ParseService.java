package ai.rtlparser.analyzer.parse;

import ai.rtlparser.analyzer.cache.CacheException;
import ai.rtlparser.analyzer.cache.FileIdentity;
import ai.rtlparser.analyzer.cache.ParseCache;
import ai.rtlparser.analyzer.corpus.ModuleCorpus;
import ai.rtlparser.analyzer.cst.SyntaxTree;
import ai.rtlparser.analyzer.cst.TreeTextDecoder;
import ai.rtlparser.analyzer.extract.StructuralExtractor;
import ai.rtlparser.analyzer.model.HdlModule;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs decode, extraction and classification for source units and publishes the modules to the
 * corpus. Batches are parsed on a fixed pool but inserted in input order.
 */
public class ParseService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParseService.class);
    static final String MDC_FILE = "file";

    private final TreeTextDecoder decoder;
    private final StructuralExtractor extractor;
    private final ParseCache cache;
    private final ModuleCorpus corpus;
    private final int threads;

    public ParseService(TreeTextDecoder decoder,
                        StructuralExtractor extractor,
                        ParseCache cache,
                        ModuleCorpus corpus,
                        int threads) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.corpus = Objects.requireNonNull(corpus, "corpus");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        this.threads = threads;
    }

    public List<HdlModule> parse(SourceUnit unit) {
        return parseUnit(unit).modules();
    }

    public List<HdlModule> parseAndIndex(SourceUnit unit) {
        List<HdlModule> modules = parse(unit);
        corpus.insert(unit.path(), modules);
        return modules;
    }

    public ParseReport parseAll(List<SourceUnit> units) {
        Objects.requireNonNull(units, "units");
        if (units.isEmpty()) {
            return new ParseReport(0, 0, 0, List.of());
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, units.size()));
        try {
            List<CompletableFuture<ParsedUnit>> pending = new ArrayList<>(units.size());
            for (SourceUnit unit : units) {
                pending.add(CompletableFuture.supplyAsync(() -> parseUnit(unit), executor));
            }
            int parsed = 0;
            int modules = 0;
            int cacheHits = 0;
            List<FileFailure> failures = new ArrayList<>();
            for (int i = 0; i < units.size(); i++) {
                SourceUnit unit = units.get(i);
                try {
                    ParsedUnit result = pending.get(i).join();
                    corpus.insert(unit.path(), result.modules());
                    parsed++;
                    modules += result.modules().size();
                    if (result.fromCache()) {
                        cacheHits++;
                    }
                } catch (CompletionException ex) {
                    Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                    LOGGER.warn("Failed to parse {}: {}", unit.path(), cause.getMessage());
                    failures.add(new FileFailure(unit.path(), cause.getMessage()));
                }
            }
            LOGGER.info("Parsed {} of {} file(s), {} module(s) indexed, {} from cache",
                    parsed, units.size(), modules, cacheHits);
            return new ParseReport(parsed, modules, cacheHits, failures);
        } finally {
            executor.shutdown();
        }
    }

    private ParsedUnit parseUnit(SourceUnit unit) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_FILE, unit.path())) {
            FileIdentity identity = FileIdentity.of(unit.path(), unit.sourceText(), unit.treeText());
            Optional<List<HdlModule>> cached = lookup(identity);
            if (cached.isPresent()) {
                LOGGER.debug("Cache hit for {}", unit.path());
                return new ParsedUnit(cached.get(), true);
            }
            SyntaxTree tree = decoder.decode(unit.treeText());
            List<HdlModule> modules = extractor.extract(tree, unit.sourceText(), unit.path());
            store(identity, modules);
            return new ParsedUnit(modules, false);
        }
    }

    private Optional<List<HdlModule>> lookup(FileIdentity identity) {
        try {
            return cache.lookup(identity);
        } catch (CacheException ex) {
            LOGGER.warn("Ignoring unreadable cache entry for {}: {}", identity.path(), ex.getMessage());
            return Optional.empty();
        }
    }

    private void store(FileIdentity identity, List<HdlModule> modules) {
        try {
            cache.store(identity, modules);
        } catch (CacheException ex) {
            LOGGER.warn("Could not cache {}: {}", identity.path(), ex.getMessage());
        }
    }

    private record ParsedUnit(List<HdlModule> modules, boolean fromCache) {
    }
}
