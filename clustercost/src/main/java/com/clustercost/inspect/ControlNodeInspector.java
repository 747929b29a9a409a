/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.inspect;

/**
 *
 * @author rachanakeshav
 */
import com.clustercost.inspect.InspectModels.ControlNodeSnapshot;
import com.clustercost.inspect.InspectModels.VolumeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ControlNodeInspector {

    private static final Logger log = LoggerFactory.getLogger(ControlNodeInspector.class);

    private final InstanceMetadata metadata;
    private final InfrastructureProvider infrastructure;

    public ControlNodeInspector(InstanceMetadata metadata, InfrastructureProvider infrastructure) {
        this.metadata = metadata;
        this.infrastructure = infrastructure;
    }

    public ControlNodeSnapshot inspect() {
        String instanceType = metadata.instanceType();
        String instanceId = metadata.instanceId();
        int ok = 1;
        int failed = 0;

        Optional<List<String>> volumeIds = infrastructure.attachedVolumeIds(instanceId);
        if (volumeIds.isEmpty()) {
            log.warn("Control node {} not found; skipping attached volumes", instanceId);
            return new ControlNodeSnapshot(instanceId, instanceType, List.of(), ok, failed + 1);
        }
        ok++;

        List<VolumeDescriptor> volumes = new ArrayList<>();
        for (String volumeId : volumeIds.get()) {
            Optional<VolumeDescriptor> vol = infrastructure.describeVolume(volumeId);
            if (vol.isPresent()) {
                volumes.add(vol.get());
                ok++;
            } else {
                log.warn("Volume {} not found; skipping", volumeId);
                failed++;
            }
        }
        log.info("Control node {} ({}) with {} volume(s)", instanceId, instanceType, volumes.size());
        return new ControlNodeSnapshot(instanceId, instanceType, List.copyOf(volumes), ok, failed);
    }
}
