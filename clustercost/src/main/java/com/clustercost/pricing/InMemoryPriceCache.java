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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPriceCache implements PriceCache {

  private final Map<PriceKey, CacheEntry> byKey = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryPriceCache() {
    this(Clock.systemUTC());
  }

  public InMemoryPriceCache(Clock clock) {
    this.clock = clock;
  }

  private static final class CacheEntry {

    final double price;
    final Instant expiresAt;

    CacheEntry(double price, Instant expiresAt) {
      this.price = price;
      this.expiresAt = expiresAt;
    }
  }

  @Override
  public Optional<Double> get(PriceKey key) {
    CacheEntry e = byKey.get(key);
    if (e == null) return Optional.empty();
    if (!clock.instant().isBefore(e.expiresAt)) {
      byKey.remove(key, e);
      return Optional.empty();
    }
    return Optional.of(e.price);
  }

  @Override
  public void put(PriceKey key, double price, Duration ttl) {
    byKey.put(key, new CacheEntry(price, clock.instant().plus(ttl)));
  }

  @Override
  public int size() {
    return byKey.size();
  }
}
