package com.doctrace.core.cache;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.util.ContentHashes;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Content-addressed memo of diagram analyses, persisted as one versioned JSON document.
 *
 * <p>Two tiers are kept:
 * <ol>
 *   <li>absolute path to {@link FileFingerprint}, the last seen state of each tracked file,
 *       which {@link #prune(Duration)} drops once the file is gone</li>
 *   <li>content hash to {@link ParseCacheEntry}</li>
 * </ol>
 *
 * <p>Lookups and inserts are safe from many threads. Only {@link #flush()} writes the file, and it
 * is serialized, so the persisted document has a single writer. A missing, unreadable, corrupt or
 * differently versioned file yields an empty cache; the cache can only make a pass faster,
 * never change its outcome.
 */
public class ParseCache {

    private static final Logger log = LoggerFactory.getLogger(ParseCache.class);

    /** Current cache format version. Any other version invalidates the whole file. */
    public static final String VERSION = "1.0";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private final Path cacheFile;
    private final Clock clock;
    private final Map<String, ParseCacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, FileFingerprint> files = new ConcurrentHashMap<>();
    private final AtomicBoolean dirty = new AtomicBoolean(false);
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    ParseCache(Path cacheFile, Clock clock) {
        this.cacheFile = cacheFile;
        this.clock = clock;
    }

    /**
     * Opens the cache stored at the given file, starting empty when it cannot be used.
     *
     * @param cacheFile cache document location
     * @return cache
     */
    public static ParseCache open(Path cacheFile) {
        return open(cacheFile, Clock.systemUTC());
    }

    static ParseCache open(Path cacheFile, Clock clock) {
        ParseCache cache = new ParseCache(cacheFile, clock);
        cache.load();
        return cache;
    }

    /**
     * Creates a cache that is never persisted.
     *
     * @return in-memory cache
     */
    public static ParseCache inMemory() {
        return new ParseCache(null, Clock.systemUTC());
    }

    private void load() {
        if (cacheFile == null || !Files.exists(cacheFile)) {
            log.debug("No parse cache at {}; starting empty", cacheFile);
            return;
        }
        try {
            ParseCacheDocument document = JSON_MAPPER.readValue(cacheFile.toFile(), ParseCacheDocument.class);
            if (document == null || !VERSION.equals(document.version())) {
                log.info("Parse cache version {} does not match {}; rebuilding",
                    document == null ? null : document.version(), VERSION);
                dirty.set(true);
                return;
            }
            entries.putAll(document.entries());
            files.putAll(document.files());
            log.debug("Loaded parse cache with {} entries from {}", entries.size(), cacheFile);
        } catch (IOException | RuntimeException e) {
            log.warn("Parse cache {} is unreadable ({}); rebuilding", cacheFile, e.getMessage());
            entries.clear();
            files.clear();
            dirty.set(true);
        }
    }

    /**
     * Looks up the analysis of the given content.
     *
     * @param content raw content
     * @return cached analysis flagged {@code fromCache}, or empty on a miss
     */
    public Optional<ParseResult> get(String content) {
        return getByHash(ContentHashes.sha256(content));
    }

    /**
     * Looks up an analysis by content hash.
     *
     * @param contentHash SHA-256 of the content
     * @return cached analysis flagged {@code fromCache}, or empty on a miss
     */
    public Optional<ParseResult> getByHash(String contentHash) {
        ParseCacheEntry entry = entries.get(contentHash);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(new ParseResult(entry.toAnalysis(), true));
    }

    /**
     * Stores the analysis of the given content. An existing entry for the same hash is kept.
     *
     * @param content raw content
     * @param filePath file the content came from
     * @param analysis analysis of the content
     */
    public void put(String content, String filePath, DiagramAnalysis analysis) {
        putByHash(ContentHashes.sha256(content), filePath, analysis);
    }

    void putByHash(String contentHash, String filePath, DiagramAnalysis analysis) {
        ParseCacheEntry entry = ParseCacheEntry.of(contentHash, clock.millis(), filePath, analysis);
        if (entries.putIfAbsent(contentHash, entry) == null) {
            dirty.set(true);
        }
    }

    /**
     * Returns the cached analysis of a file's content, computing and storing it on a miss.
     *
     * @param file absolute path of the file
     * @param content content read from the file
     * @param analyzer analysis function used on a miss
     * @return analysis with cache provenance
     */
    public ParseResult getOrAnalyze(Path file, String content, Function<String, DiagramAnalysis> analyzer) {
        String hash = hashFor(file, content);
        Optional<ParseResult> cached = getByHash(hash);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", file);
            return cached.get();
        }
        log.debug("Cache miss for {}", file);
        DiagramAnalysis analysis = analyzer.apply(content);
        putByHash(hash, file == null ? null : file.toString(), analysis);
        return new ParseResult(analysis, false);
    }

    /**
     * Returns the content hash of a file and records its fingerprint.
     *
     * <p>The hash always comes from {@code content}: a rewrite that keeps the size and modification
     * time must not resolve to the previous analysis. The fingerprint is rewritten only when the
     * modification time, size or hash changed.
     *
     * @param file absolute path of the file, or null to skip the fingerprint
     * @param content content read from the file
     * @return SHA-256 of the content
     */
    public String hashFor(Path file, String content) {
        String hash = ContentHashes.sha256(content);
        if (file == null) {
            return hash;
        }
        String key = file.toAbsolutePath().normalize().toString();
        try {
            FileFingerprint current = new FileFingerprint(
                Files.getLastModifiedTime(file).toMillis(), Files.size(file), hash);
            if (!current.equals(files.put(key, current))) {
                dirty.set(true);
            }
        } catch (IOException e) {
            log.debug("Cannot stat {} ({}); fingerprint not recorded", file, e.getMessage());
        }
        return hash;
    }

    /**
     * Writes the cache document if anything changed since it was loaded or last flushed.
     * Failures are logged and otherwise ignored.
     */
    public synchronized void flush() {
        if (cacheFile == null || !dirty.get()) {
            return;
        }
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ParseCacheDocument document = new ParseCacheDocument(VERSION, clock.millis(), Map.copyOf(entries), Map.copyOf(files));
            Path temp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
            JSON_MAPPER.writeValue(temp.toFile(), document);
            move(temp, cacheFile);
            dirty.set(false);
            log.debug("Saved parse cache with {} entries to {}", entries.size(), cacheFile);
        } catch (IOException e) {
            log.warn("Failed to save parse cache {}: {}", cacheFile, e.getMessage());
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Drops fingerprints of files that no longer exist and entries older than {@code maxAge}.
     *
     * @param maxAge maximum entry age
     * @return number of removed entries and fingerprints
     */
    public int prune(Duration maxAge) {
        long cutoff = clock.millis() - maxAge.toMillis();
        int before = entries.size() + files.size();
        files.keySet().removeIf(path -> !Files.exists(Path.of(path)));
        entries.values().removeIf(entry -> entry.timestamp() < cutoff);
        int removed = before - entries.size() - files.size();
        if (removed > 0) {
            dirty.set(true);
        }
        log.info("Pruned {} parse cache records", removed);
        return removed;
    }

    /**
     * Removes every entry and fingerprint.
     */
    public void clear() {
        entries.clear();
        files.clear();
        dirty.set(true);
    }

    public CacheStats stats() {
        return new CacheStats(entries.size(), files.size(), hits.get(), misses.get());
    }

    public Path getCacheFile() {
        return cacheFile;
    }

    boolean isDirty() {
        return dirty.get();
    }
}
