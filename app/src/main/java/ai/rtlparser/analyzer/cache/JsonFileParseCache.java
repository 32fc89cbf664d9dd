package ai.rtlparser.analyzer.cache;

import ai.rtlparser.analyzer.model.HdlModule;
import ai.rtlparser.analyzer.model.ModelJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one JSON document per source path under a cache directory. An entry whose content hash no
 * longer matches is treated as a miss and overwritten on the next store.
 */
public class JsonFileParseCache implements ParseCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileParseCache.class);

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonFileParseCache(Path directory) {
        this(directory, ModelJson.newObjectMapper());
    }

    JsonFileParseCache(Path directory, ObjectMapper mapper) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Optional<List<HdlModule>> lookup(FileIdentity identity) {
        Path entryFile = entryFile(identity);
        if (!Files.isRegularFile(entryFile)) {
            return Optional.empty();
        }
        CacheEntry entry;
        try {
            entry = mapper.readValue(entryFile.toFile(), CacheEntry.class);
        } catch (IOException ex) {
            throw new CacheException("Failed to read cache entry " + entryFile, ex);
        }
        if (!identity.path().equals(entry.path()) || !identity.contentHash().equals(entry.contentHash())) {
            LOGGER.debug("Stale cache entry for {}", identity.path());
            return Optional.empty();
        }
        return Optional.of(entry.modules());
    }

    @Override
    public void store(FileIdentity identity, List<HdlModule> modules) {
        Path entryFile = entryFile(identity);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "entry", ".tmp");
            mapper.writeValue(temp.toFile(), new CacheEntry(identity.path(), identity.contentHash(), modules));
            Files.move(temp, entryFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            CacheException failure = new CacheException("Failed to write cache entry " + entryFile, ex);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
        LOGGER.debug("Cached {} module(s) for {}", modules.size(), identity.path());
    }

    Path entryFile(FileIdentity identity) {
        return directory.resolve(FileIdentity.hashOf(identity.path()) + ".json");
    }

    record CacheEntry(String path, String contentHash, List<HdlModule> modules) {

        CacheEntry {
            modules = modules == null ? List.of() : List.copyOf(modules);
        }
    }
}
