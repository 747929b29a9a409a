/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Interface.java to edit this template
 */
package com.clustercost.inspect;

/**
 *
 * @author rachanakeshav
 */
import com.clustercost.inspect.InspectModels.VolumeDescriptor;

import java.util.List;
import java.util.Optional;

public interface InfrastructureProvider {

    /** EBS volume ids attached to the instance; empty if the instance is unknown. */
    Optional<List<String>> attachedVolumeIds(String instanceId);

    /** Type and size of the volume; empty if the volume is unknown. */
    Optional<VolumeDescriptor> describeVolume(String volumeId);
}
