/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.pricing;

/**
 *
 * @author rachanakeshav
 */
import com.clustercost.pricing.PricingModels.PriceKey;
import com.fasterxml.jackson.core.type.TypeReference;
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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Durable price cache kept as a single JSON document under a cache directory.
 * <p>
 * Every write re-reads the document, applies the change and replaces the file with an
 * atomic rename, so processes sharing the directory see either the old or the new
 * document. Writes replace the whole document: when two processes write at the same
 * time, the later one drops any keys the other added in between, not just the shared
 * key. A dropped key costs one extra catalog call on a later run. Once
 * {@code maxEntries} is exceeded the entries stored longest ago are evicted.
 */
public class FilePriceCache implements PriceCache {

    private static final Logger log = LoggerFactory.getLogger(FilePriceCache.class);

    static final String FILE_NAME = "prices.json";

    private static final TypeReference<LinkedHashMap<String, StoredEntry>> DOC_TYPE =
            new TypeReference<>() {
            };

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path directory;
    private final Path file;
    private final int maxEntries;
    private final Clock clock;

    public record StoredEntry(double value, long storedAt, long expiresAt) {
    }

    public FilePriceCache(Path directory, int maxEntries) {
        this(directory, maxEntries, Clock.systemUTC());
    }

    public FilePriceCache(Path directory, int maxEntries, Clock clock) {
        this.directory = directory;
        this.file = directory.resolve(FILE_NAME);
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    @Override
    public Optional<Double> get(PriceKey key) {
        StoredEntry e = load().get(key.canonical());
        if (e == null || clock.millis() >= e.expiresAt()) {
            return Optional.empty();
        }
        return Optional.of(e.value());
    }

    @Override
    public synchronized void put(PriceKey key, double price, Duration ttl) {
        long now = clock.millis();
        LinkedHashMap<String, StoredEntry> doc = load();
        doc.values().removeIf(e -> now >= e.expiresAt());
        doc.remove(key.canonical());
        doc.put(key.canonical(), new StoredEntry(price, now, now + ttl.toMillis()));
        evict(doc);
        write(doc);
    }

    @Override
    public int size() {
        long now = clock.millis();
        return (int) load().values().stream().filter(e -> now < e.expiresAt()).count();
    }

    private void evict(LinkedHashMap<String, StoredEntry> doc) {
        int excess = doc.size() - maxEntries;
        if (excess <= 0) return;
        doc.entrySet().stream()
                .sorted(Comparator.comparingLong(en -> en.getValue().storedAt()))
                .limit(excess)
                .map(Map.Entry::getKey)
                .toList()
                .forEach(doc::remove);
        log.debug("Price cache evicted {} entries (max {})", excess, maxEntries);
    }

    private LinkedHashMap<String, StoredEntry> load() {
        if (!Files.isRegularFile(file)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, StoredEntry> doc = mapper.readValue(file.toFile(), DOC_TYPE);
            return doc != null ? doc : new LinkedHashMap<>();
        } catch (IOException e) {
            log.warn("Price cache {} unreadable ({}); treating as empty", file, e.toString());
            return new LinkedHashMap<>();
        }
    }

    private void write(Map<String, StoredEntry> doc) {
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, FILE_NAME, ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), doc);
                try {
                    Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new RuntimeException("Price cache write failed: " + e, e);
        }
    }
}
