/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.cost;

/**
 *
 * @author rachanakeshav
 */
import com.clustercost.cost.CostModels.Branch;
import com.clustercost.cost.CostModels.BranchResult;
import com.clustercost.inspect.ControlNodeInspector;
import com.clustercost.inspect.InspectModels.ControlNodeSnapshot;
import com.clustercost.inspect.InspectModels.FleetSnapshot;
import com.clustercost.inspect.InspectModels.NodeGroupState;
import com.clustercost.inspect.InspectModels.VolumeDescriptor;
import com.clustercost.inspect.WorkerFleetInspector;
import com.clustercost.pricing.PricingModels.PriceKey;
import com.clustercost.pricing.PricingModels.PriceLookup;
import com.clustercost.pricing.PricingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns inspected infrastructure into hourly cost totals. Storage GB-month prices are
 * spread over {@code hoursPerMonth}.
 */
public class CostAggregator {

    private static final Logger log = LoggerFactory.getLogger(CostAggregator.class);

    public static final double HOURS_PER_MONTH = 720.0;
    public static final String WORKER_ROOT_VOLUME_TYPE = "gp3";
    public static final int WORKER_ROOT_VOLUME_GB = 100;

    private final PricingResolver resolver;
    private final ControlNodeInspector controlNode;
    private final WorkerFleetInspector workerFleet;
    private final String region;
    private final String workerRootVolumeType;
    private final int workerRootVolumeGb;
    private final double hoursPerMonth;

    public CostAggregator(PricingResolver resolver,
            ControlNodeInspector controlNode,
            WorkerFleetInspector workerFleet,
            String region,
            String workerRootVolumeType,
            int workerRootVolumeGb,
            double hoursPerMonth) {
        this.resolver = resolver;
        this.controlNode = controlNode;
        this.workerFleet = workerFleet;
        this.region = region;
        this.workerRootVolumeType = workerRootVolumeType;
        this.workerRootVolumeGb = workerRootVolumeGb;
        this.hoursPerMonth = hoursPerMonth;
    }

    public CostAggregator(PricingResolver resolver, ControlNodeInspector controlNode,
            WorkerFleetInspector workerFleet, String region) {
        this(resolver, controlNode, workerFleet, region,
                WORKER_ROOT_VOLUME_TYPE, WORKER_ROOT_VOLUME_GB, HOURS_PER_MONTH);
    }

    public BranchResult controlNodeCosts() {
        ControlNodeSnapshot node = controlNode.inspect();
        Tally tally = new Tally(node.lookupsSucceeded(), node.lookupsFailed());

        double compute = tally.price(resolver.lookup(PriceKey.compute(node.instanceType(), region)));

        double storage = 0.0;
        for (VolumeDescriptor v : node.volumes()) {
            double perGbMonth = tally.price(resolver.lookup(PriceKey.storage(v.volumeType(), region)));
            storage += perGbMonth * v.sizeGb() / hoursPerMonth;
        }

        log.info("Control node cost: compute={} storage={} (lookups ok={} failed={})",
                compute, storage, tally.ok, tally.failed);
        return BranchResult.of(Branch.CONTROL_NODE, compute, storage, tally.ok, tally.failed);
    }

    public BranchResult workerFleetCosts() {
        FleetSnapshot fleet = workerFleet.inspect();
        Tally tally = new Tally(fleet.queriesSucceeded(), fleet.queriesFailed());

        double compute = 0.0;
        double storage = 0.0;
        for (NodeGroupState group : fleet.groups()) {
            int n = group.activeNodeCount();
            if (n <= 0) continue;

            double perHour = tally.price(resolver.lookup(PriceKey.compute(group.instanceType(), region)));
            compute += perHour * n;

            double perGbMonth = tally.price(resolver.lookup(PriceKey.storage(workerRootVolumeType, region)));
            storage += perGbMonth * n * workerRootVolumeGb / hoursPerMonth;

            log.debug("Queue {} / {}: {} x {} at {}/h", group.queueName(), group.computeResource(),
                    n, group.instanceType(), perHour);
        }

        log.info("Worker fleet cost: compute={} storage={} (lookups ok={} failed={})",
                compute, storage, tally.ok, tally.failed);
        return BranchResult.of(Branch.WORKER_FLEET, compute, storage, tally.ok, tally.failed);
    }

    private static final class Tally {

        int ok;
        int failed;

        Tally(int ok, int failed) {
            this.ok = ok;
            this.failed = failed;
        }

        double price(PriceLookup lookup) {
            if (lookup.available()) {
                ok++;
            } else {
                failed++;
            }
            return lookup.price();
        }
    }
}
