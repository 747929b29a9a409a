/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost;

/**
 *
 * @author rachanakeshav
 */
import com.clustercost.config.ClusterConfigLoader;
import com.clustercost.config.CostMetricsSettings;
import com.clustercost.cost.CostAggregator;
import com.clustercost.inspect.ControlNodeInspector;
import com.clustercost.inspect.Ec2InfrastructureProvider;
import com.clustercost.inspect.Ec2InstanceMetadata;
import com.clustercost.inspect.NodeStateParser;
import com.clustercost.inspect.SinfoSchedulerClient;
import com.clustercost.inspect.WorkerFleetInspector;
import com.clustercost.metrics.MetricSink;
import com.clustercost.metrics.PushGatewayMetricSink;
import com.clustercost.pricing.AwsPricingProvider;
import com.clustercost.pricing.FilePriceCache;
import com.clustercost.pricing.InMemoryPriceCache;
import com.clustercost.pricing.PriceCache;
import com.clustercost.pricing.PricingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Everything one collection run needs, built once at process entry and handed to the
 * collector.
 */
public record CollectionContext(
        CostAggregator aggregator,
        MetricSink sink,
        Duration runTimeout
) {

    private static final Logger log = LoggerFactory.getLogger(CollectionContext.class);

    public static CollectionContext create(CostMetricsSettings s) {
        PriceCache cache;
        if (s.durableCache()) {
            cache = new FilePriceCache(s.cacheDirectory(), s.cacheMaxEntries());
            log.info("PriceCache: file {} (max {} entries, ttl {})", s.cacheDirectory(), s.cacheMaxEntries(), s.cacheTtl());
        } else {
            cache = new InMemoryPriceCache();
            log.info("PriceCache: InMemory");
        }

        PricingResolver resolver = new PricingResolver(
                AwsPricingProvider.create(s.pricingEndpointRegion(), s.capacityStatus()),
                cache, s.cacheTtl(), s.cacheUnavailable());

        ControlNodeInspector controlNode = new ControlNodeInspector(
                new Ec2InstanceMetadata(), Ec2InfrastructureProvider.create(s.ec2Region()));

        WorkerFleetInspector workerFleet = new WorkerFleetInspector(
                ClusterConfigLoader.fromFile(s.clusterConfig()),
                new SinfoSchedulerClient(s.sinfoPath(), s.schedulerTimeout()),
                new NodeStateParser(s.nodeCountColumn()));

        CostAggregator aggregator = new CostAggregator(resolver, controlNode, workerFleet, s.region(),
                s.workerRootVolumeType(), s.workerRootVolumeGb(), s.hoursPerMonth());

        return new CollectionContext(aggregator,
                new PushGatewayMetricSink(s.pushUrl(), s.pushTimeout()),
                s.runTimeout());
    }
}
