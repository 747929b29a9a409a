/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Interface.java to edit this template
 */
package com.clustercost.pricing;

/**
 *
 * @author rachanakeshav
 */
import com.clustercost.pricing.PricingModels.PriceKey;

import java.time.Duration;
import java.util.Optional;

public interface PriceCache {

    Duration DEFAULT_TTL = Duration.ofDays(7);

    /** Live (non-expired) price for the key, if any. */
    Optional<Double> get(PriceKey key);

    /** Stores or overwrites the price for the key; last writer wins. */
    void put(PriceKey key, double price, Duration ttl);

    int size();
}
