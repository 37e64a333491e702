package org.scholargraph.resources.cache;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.typesafe.config.Config;
import org.scholargraph.api.resources.cache.CacheKey;
import org.scholargraph.api.resources.cache.CacheManifest;
import org.scholargraph.api.resources.cache.CacheReadResult;
import org.scholargraph.api.resources.cache.IArtifactCache;
import org.scholargraph.api.resources.store.IColumnarStore;
import org.scholargraph.api.resources.store.QueryResult;
import org.scholargraph.api.resources.store.StoreException;
import org.scholargraph.resources.AbstractResource;
import org.scholargraph.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Disk cache storing each artifact as a Parquet file plus a JSON manifest.
 * <p>
 * File layout inside {@code directory}:
 * <pre>
 * filtered_paper_ids_5yr_3fa1c0d2e4b59a77.parquet
 * filtered_paper_ids_5yr_3fa1c0d2e4b59a77.json
 * </pre>
 * Both files are written to a temporary name first and moved into place atomically; the
 * manifest is moved last, so a data file without a manifest is an interrupted write and is
 * reported as corrupt.
 */
public class ParquetArtifactCache extends AbstractResource implements IArtifactCache {

    private static final Logger log = LoggerFactory.getLogger(ParquetArtifactCache.class);

    private final Path directory;
    private final IColumnarStore store;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong corrupt = new AtomicLong(0);
    private final AtomicLong writes = new AtomicLong(0);
    private final AtomicLong writeFailures = new AtomicLong(0);

    public ParquetArtifactCache(String name, Config options, IColumnarStore store) {
        super(name, options);
        this.store = Objects.requireNonNull(store, "store");
        if (!options.hasPath("directory")) {
            throw new IllegalArgumentException("directory is required for ParquetArtifactCache '" + name + "'");
        }
        this.directory = PathExpansion.expandAbsolute(options.getString("directory"), "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to create cache directory: " + directory, e);
        }
    }

    @Override
    public Path directory() {
        return directory;
    }

    @Override
    public CacheReadResult read(CacheKey key) {
        Path dataFile = directory.resolve(key.fileName());
        if (!Files.exists(dataFile)) {
            misses.incrementAndGet();
            log.debug("Cache miss for {}", key.fileName());
            return CacheReadResult.miss();
        }

        Path manifestFile = directory.resolve(key.manifestFileName());
        CacheManifest manifest;
        try {
            manifest = gson.fromJson(Files.readString(manifestFile, StandardCharsets.UTF_8), CacheManifest.class);
        } catch (IOException | JsonParseException e) {
            return corrupt(key, "manifest unreadable: " + e.getMessage());
        }
        if (manifest == null || !manifest.describes(key)) {
            return corrupt(key, "manifest does not describe this key");
        }

        QueryResult rows;
        try {
            rows = store.readParquet(dataFile);
        } catch (StoreException e) {
            return corrupt(key, "data file unreadable: " + e.getMessage());
        }
        if (rows.rowCount() != manifest.rowCount()) {
            return corrupt(key, "expected " + manifest.rowCount() + " rows, found " + rows.rowCount());
        }

        hits.incrementAndGet();
        log.debug("Cache hit for {} ({} rows)", key.fileName(), rows.rowCount());
        return CacheReadResult.hit(rows);
    }

    @Override
    public boolean write(CacheKey key, QueryResult rows, String criteria) {
        Path dataFile = directory.resolve(key.fileName());
        Path manifestFile = directory.resolve(key.manifestFileName());
        Path dataTemp = tempSibling(dataFile);
        Path manifestTemp = tempSibling(manifestFile);
        try {
            // Invalidate the old manifest first so a crash between the two moves cannot pair new data with it
            Files.deleteIfExists(manifestFile);
            store.writeParquet(rows, dataTemp);
            Files.move(dataTemp, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            CacheManifest manifest = new CacheManifest(key.kind().name(), key.lookbackYears(), key.signature(),
                criteria, rows.rowCount(), Instant.now().toString());
            Files.writeString(manifestTemp, gson.toJson(manifest), StandardCharsets.UTF_8);
            Files.move(manifestTemp, manifestFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            writes.incrementAndGet();
            log.debug("Cached {} rows as {}", rows.rowCount(), key.fileName());
            return true;
        } catch (IOException | StoreException | IllegalArgumentException e) {
            writeFailures.incrementAndGet();
            log.warn("Failed to persist cache entry {}, result is kept in memory only: {}", key.fileName(), e.getMessage());
            log.debug("Cache write failure details", e);
            recordError("CACHE_WRITE_FAILED", "Failed to persist cache entry", "File: " + dataFile);
            deleteQuietly(dataTemp);
            deleteQuietly(manifestTemp);
            return false;
        }
    }

    @Override
    public boolean deleteLegacy(CacheKey key) {
        Path legacy = directory.resolve(key.legacyFileName());
        try {
            boolean deleted = Files.deleteIfExists(legacy);
            if (deleted) {
                log.info("Deleted untagged legacy cache file {}", legacy.getFileName());
            }
            return deleted;
        } catch (IOException e) {
            log.warn("Failed to delete legacy cache file {}: {}", legacy, e.getMessage());
            recordError("LEGACY_DELETE_FAILED", "Failed to delete legacy cache file", "File: " + legacy);
            return false;
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("cache_hits", hits.get());
        metrics.put("cache_misses", misses.get());
        metrics.put("cache_corrupt", corrupt.get());
        metrics.put("cache_writes", writes.get());
        metrics.put("cache_write_failures", writeFailures.get());
    }

    private CacheReadResult corrupt(CacheKey key, String reason) {
        corrupt.incrementAndGet();
        log.warn("Ignoring corrupt cache entry {}: {}", key.fileName(), reason);
        recordError("CACHE_CORRUPT", "Cache entry could not be used", key.fileName() + ": " + reason);
        return CacheReadResult.corrupt(reason);
    }

    private static Path tempSibling(Path file) {
        return file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Failed to clean up temp file {}", file, e);
        }
    }
}
