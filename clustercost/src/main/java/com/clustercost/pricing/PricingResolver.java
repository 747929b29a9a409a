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
import com.clustercost.pricing.PricingModels.PriceLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

// Failures stay in memory for this run only unless cacheUnavailable is set
public class PricingResolver {

    private static final Logger log = LoggerFactory.getLogger(PricingResolver.class);

    private final PricingProvider provider;
    private final PriceCache cache;
    private final Duration ttl;
    private final boolean cacheUnavailable;
    private final Map<PriceKey, PriceLookup> unavailableThisRun = new HashMap<>();

    public PricingResolver(PricingProvider provider, PriceCache cache, Duration ttl, boolean cacheUnavailable) {
        this.provider = provider;
        this.cache = cache;
        this.ttl = ttl;
        this.cacheUnavailable = cacheUnavailable;
    }

    public PricingResolver(PricingProvider provider, PriceCache cache) {
        this(provider, cache, PriceCache.DEFAULT_TTL, false);
    }

    /** USD per hour, or 0.0 when no price could be resolved. */
    public double resolveInstancePrice(String instanceType, String region) {
        return lookup(PriceKey.compute(instanceType, region)).price();
    }

    /** USD per GB-month, or 0.0 when no price could be resolved. */
    public double resolveVolumePrice(String volumeType, String region) {
        return lookup(PriceKey.storage(volumeType, region)).price();
    }

    public PriceLookup lookup(PriceKey key) {
        Optional<Double> cached = readCache(key);
        if (cached.isPresent()) {
            return PriceLookup.cached(cached.get());
        }
        PriceLookup known = unavailableThisRun.get(key);
        if (known != null) {
            return known;
        }

        log.info("Pricing: fetching {} from {}", key.canonical(), provider.name());
        PriceLookup result;
        try {
            result = provider.fetch(key);
        } catch (RuntimeException e) {
            result = PriceLookup.unavailable("provider error: " + e.getMessage());
        }
        if (result == null) {
            result = PriceLookup.unavailable("provider returned nothing");
        }

        if (result.available()) {
            putIfSuccess(key, result);
        } else {
            log.warn("Pricing: no price for {} ({})", key.canonical(), result.note());
            unavailableThisRun.put(key, result);
            if (cacheUnavailable) {
                writeCache(key, 0.0);
            }
        }
        return result;
    }

    private void putIfSuccess(PriceKey key, PriceLookup result) {
        if (result.available()) {
            writeCache(key, result.price());
        }
    }

    private Optional<Double> readCache(PriceKey key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("Pricing: cache read failed for {}: {}", key.canonical(), e.toString());
            return Optional.empty();
        }
    }

    private void writeCache(PriceKey key, double price) {
        try {
            cache.put(key, price, ttl);
        } catch (RuntimeException e) {
            log.warn("Pricing: cache write failed for {}: {}", key.canonical(), e.toString());
        }
    }
}
