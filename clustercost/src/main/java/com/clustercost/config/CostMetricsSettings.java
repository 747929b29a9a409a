/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.config;

/**
 *
 * @author rachanakeshav
 */
import com.typesafe.config.Config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Typed view of the {@code clustercost} block of application.conf.
 */
public record CostMetricsSettings(
        String region,               // pricing "location", e.g. "US West (Oregon)"
        String pricingEndpointRegion,
        String capacityStatus,
        boolean cacheUnavailable,
        String cacheStore,           // "file" or "memory"
        Path cacheDirectory,
        int cacheMaxEntries,
        Duration cacheTtl,
        String ec2Region,            // blank = SDK default chain
        Path clusterConfig,
        String sinfoPath,
        Duration schedulerTimeout,
        int nodeCountColumn,
        String workerRootVolumeType,
        int workerRootVolumeGb,
        double hoursPerMonth,
        String pushUrl,
        Duration pushTimeout,
        Duration runTimeout
) {

    public static CostMetricsSettings fromConfig(Config root) {
        Config c = root.getConfig("clustercost");
        Config pricing = c.getConfig("pricing");
        Config cache = c.getConfig("cache");
        Config scheduler = c.getConfig("scheduler");
        Config worker = c.getConfig("worker");
        Config metrics = c.getConfig("metrics");

        return new CostMetricsSettings(
                c.getString("region"),
                pricing.getString("endpoint-region"),
                pricing.getString("capacity-status"),
                pricing.getBoolean("cache-unavailable"),
                cache.getString("store"),
                Paths.get(cache.getString("directory")),
                cache.getInt("max-entries"),
                cache.getDuration("ttl"),
                c.getString("ec2.region"),
                Paths.get(c.getString("cluster-config")),
                scheduler.getString("sinfo-path"),
                scheduler.getDuration("timeout"),
                scheduler.getInt("node-count-column"),
                worker.getString("root-volume-type"),
                worker.getInt("root-volume-gb"),
                c.getDouble("hours-per-month"),
                metrics.getString("push-url"),
                metrics.getDuration("timeout"),
                c.getDuration("run-timeout"));
    }

    public boolean durableCache() {
        return !"memory".equalsIgnoreCase(cacheStore);
    }
}
