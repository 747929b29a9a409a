/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.inspect;

/**
 *
 * @author rachanakeshav
 */
import java.util.List;

public final class InspectModels {

    private InspectModels() {
    }

    // An EBS volume as EC2 describes it
    public record VolumeDescriptor(String volumeId, String volumeType, int sizeGb) {
    }

    public record ControlNodeSnapshot(
            String instanceId,
            String instanceType,
            List<VolumeDescriptor> volumes,
            int lookupsSucceeded,
            int lookupsFailed
    ) {
    }

    // How many worker nodes of one compute resource are up in one partition
    public record NodeGroupState(
            String queueName,
            String computeResource,
            String instanceType,
            int activeNodeCount
    ) {

        public NodeGroupState {
            activeNodeCount = Math.max(0, activeNodeCount);
        }
    }

    public record FleetSnapshot(
            List<NodeGroupState> groups,
            int queriesSucceeded,
            int queriesFailed
    ) {
    }
}
