/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.inspect;

/**
 *
 * @author rachanakeshav
 */
import com.clustercost.config.ClusterConfig;
import com.clustercost.config.ClusterConfig.ComputeResource;
import com.clustercost.config.ClusterConfig.SlurmQueue;
import com.clustercost.inspect.InspectModels.FleetSnapshot;
import com.clustercost.inspect.InspectModels.NodeGroupState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Counts active worker nodes per (queue, compute resource). One partition query per queue.
 */
public class WorkerFleetInspector {

    private static final Logger log = LoggerFactory.getLogger(WorkerFleetInspector.class);

    private final Supplier<ClusterConfig> clusterConfig;
    private final SchedulerClient scheduler;
    private final NodeStateParser parser;

    /** The configuration is read on every {@link #inspect()} call. */
    public WorkerFleetInspector(Supplier<ClusterConfig> clusterConfig, SchedulerClient scheduler, NodeStateParser parser) {
        this.clusterConfig = clusterConfig;
        this.scheduler = scheduler;
        this.parser = parser;
    }

    public WorkerFleetInspector(ClusterConfig clusterConfig, SchedulerClient scheduler, NodeStateParser parser) {
        this(() -> clusterConfig, scheduler, parser);
    }

    public FleetSnapshot inspect() {
        List<NodeGroupState> groups = new ArrayList<>();
        Map<String, Integer> countByQueue = new HashMap<>();
        int ok = 0;
        int failed = 0;

        for (SlurmQueue queue : clusterConfig.get().queues()) {
            String queueName = queue.name();
            if (queueName == null || queueName.isBlank()) {
                log.warn("Skipping queue without a name");
                continue;
            }
            for (ComputeResource resource : queue.resources()) {
                Optional<String> instanceType = resource.firstInstanceType();
                if (instanceType.isEmpty()) {
                    log.debug("Queue {} resource {} has no instance type; skipped", queueName, resource.name());
                    continue;
                }

                Integer active = countByQueue.get(queueName);
                if (active == null) {
                    try {
                        active = parser.activeNodeCount(scheduler.partitionStatus(queueName));
                        ok++;
                    } catch (SchedulerQueryException e) {
                        log.warn("Scheduler query for queue {} failed: {}", queueName, e.getMessage());
                        active = 0;
                        failed++;
                    }
                    countByQueue.put(queueName, active);
                }
                groups.add(new NodeGroupState(queueName, resource.name(), instanceType.get(), active));
            }
        }
        log.info("Worker fleet: {} node group(s) across {} queue(s)", groups.size(), countByQueue.size());
        return new FleetSnapshot(List.copyOf(groups), ok, failed);
    }
}
