package com.clustercost.pricing;

import com.clustercost.fakes.MutableClock;
import com.clustercost.pricing.PricingModels.PriceKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilePriceCache Tests")
class FilePriceCacheTest {

    private static final String OREGON = "US West (Oregon)";

    @TempDir
    Path dir;

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("Stored price is returned until the 7 day ttl elapses")
    void testGet_WithinAndAfterTtl() {
        FilePriceCache cache = new FilePriceCache(dir, 100, clock);
        PriceKey key = PriceKey.compute("m5.large", OREGON);

        cache.put(key, 0.096, PriceCache.DEFAULT_TTL);
        clock.advance(Duration.ofDays(6));
        assertEquals(Optional.of(0.096), cache.get(key));

        clock.advance(Duration.ofDays(1));
        assertEquals(Optional.empty(), cache.get(key));
    }

    @Test
    @DisplayName("Entries survive a new cache instance on the same directory")
    void testDurability_AcrossInstances() {
        PriceKey key = PriceKey.storage("gp3", OREGON);
        new FilePriceCache(dir, 100, clock).put(key, 0.08, PriceCache.DEFAULT_TTL);

        FilePriceCache reopened = new FilePriceCache(dir, 100, clock);
        assertEquals(Optional.of(0.08), reopened.get(key));
        assertTrue(Files.isRegularFile(dir.resolve(FilePriceCache.FILE_NAME)));
    }

    @Test
    @DisplayName("Writes from two handles on the same directory are both visible, last writer wins per key")
    void testConcurrentHandles_LastWriterWins() {
        FilePriceCache first = new FilePriceCache(dir, 100, clock);
        FilePriceCache second = new FilePriceCache(dir, 100, clock);
        PriceKey m5 = PriceKey.compute("m5.large", OREGON);
        PriceKey c5 = PriceKey.compute("c5.large", OREGON);

        first.put(m5, 0.096, PriceCache.DEFAULT_TTL);
        second.put(c5, 0.085, PriceCache.DEFAULT_TTL);
        second.put(m5, 0.097, PriceCache.DEFAULT_TTL);

        assertEquals(Optional.of(0.097), first.get(m5));
        assertEquals(Optional.of(0.085), first.get(c5));
        assertEquals(2, first.size());
    }

    @Test
    @DisplayName("Least recently stored entries are evicted past the size ceiling")
    void testEviction_LeastRecentlyStored() {
        FilePriceCache cache = new FilePriceCache(dir, 2, clock);
        PriceKey a = PriceKey.compute("a1.large", OREGON);
        PriceKey b = PriceKey.compute("b1.large", OREGON);
        PriceKey c = PriceKey.compute("c1.large", OREGON);

        cache.put(a, 1.0, PriceCache.DEFAULT_TTL);
        clock.advance(Duration.ofSeconds(1));
        cache.put(b, 2.0, PriceCache.DEFAULT_TTL);
        clock.advance(Duration.ofSeconds(1));
        cache.put(a, 1.5, PriceCache.DEFAULT_TTL);   // a is now the newest
        clock.advance(Duration.ofSeconds(1));
        cache.put(c, 3.0, PriceCache.DEFAULT_TTL);

        assertEquals(Optional.empty(), cache.get(b));
        assertEquals(Optional.of(1.5), cache.get(a));
        assertEquals(Optional.of(3.0), cache.get(c));
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("A corrupt cache document is treated as empty and replaced on the next write")
    void testCorruptDocument() throws IOException {
        Files.writeString(dir.resolve(FilePriceCache.FILE_NAME), "{not json");
        FilePriceCache cache = new FilePriceCache(dir, 100, clock);
        PriceKey key = PriceKey.compute("m5.large", OREGON);

        assertEquals(Optional.empty(), cache.get(key));
        cache.put(key, 0.096, PriceCache.DEFAULT_TTL);
        assertEquals(Optional.of(0.096), cache.get(key));
    }

    @Test
    @DisplayName("Missing cache directory is created on first write")
    void testCreatesDirectory() {
        Path nested = dir.resolve("a").resolve("b");
        FilePriceCache cache = new FilePriceCache(nested, 100, clock);
        PriceKey key = PriceKey.compute("m5.large", OREGON);

        assertEquals(0, cache.size());
        cache.put(key, 0.096, PriceCache.DEFAULT_TTL);
        assertEquals(Optional.of(0.096), cache.get(key));
    }
}
