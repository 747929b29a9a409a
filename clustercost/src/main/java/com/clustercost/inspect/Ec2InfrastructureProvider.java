/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.inspect;

/**
 *
 * @author rachanakeshav
 */
import com.amazonaws.AmazonClientException;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.AmazonEC2ClientBuilder;
import com.amazonaws.services.ec2.model.DescribeInstancesRequest;
import com.amazonaws.services.ec2.model.DescribeInstancesResult;
import com.amazonaws.services.ec2.model.DescribeVolumesRequest;
import com.amazonaws.services.ec2.model.DescribeVolumesResult;
import com.amazonaws.services.ec2.model.Instance;
import com.amazonaws.services.ec2.model.InstanceBlockDeviceMapping;
import com.amazonaws.services.ec2.model.Reservation;
import com.amazonaws.services.ec2.model.Volume;
import com.clustercost.inspect.InspectModels.VolumeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

public class Ec2InfrastructureProvider implements InfrastructureProvider {

    private static final Logger log = LoggerFactory.getLogger(Ec2InfrastructureProvider.class);

    private final Supplier<AmazonEC2> clientFactory;
    private AmazonEC2 ec2;

    public Ec2InfrastructureProvider(AmazonEC2 ec2) {
        this(() -> ec2);
    }

    // Built on first use so a missing region fails a lookup, not startup
    Ec2InfrastructureProvider(Supplier<AmazonEC2> clientFactory) {
        this.clientFactory = clientFactory;
    }

    /** Region may be blank, in which case the SDK's default region chain is used. */
    public static Ec2InfrastructureProvider create(String region) {
        return new Ec2InfrastructureProvider(() -> {
            AmazonEC2ClientBuilder builder = AmazonEC2ClientBuilder.standard();
            if (region != null && !region.isBlank()) {
                builder.withRegion(region);
            }
            return builder.build();
        });
    }

    private AmazonEC2 client() {
        if (ec2 == null) {
            ec2 = clientFactory.get();
        }
        return ec2;
    }

    @Override
    public Optional<List<String>> attachedVolumeIds(String instanceId) {
        try {
            DescribeInstancesResult resp = client().describeInstances(
                    new DescribeInstancesRequest().withInstanceIds(instanceId));
            Instance instance = firstInstance(resp);
            if (instance == null) {
                return Optional.empty();
            }
            List<String> ids = new ArrayList<>();
            for (InstanceBlockDeviceMapping m : instance.getBlockDeviceMappings()) {
                // instance-store devices have no Ebs section
                if (m.getEbs() != null && m.getEbs().getVolumeId() != null) {
                    ids.add(m.getEbs().getVolumeId());
                }
            }
            return Optional.of(ids);
        } catch (AmazonClientException e) {
            log.warn("EC2 DescribeInstances failed for {}: {}", instanceId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<VolumeDescriptor> describeVolume(String volumeId) {
        try {
            DescribeVolumesResult resp = client().describeVolumes(
                    new DescribeVolumesRequest().withVolumeIds(volumeId));
            List<Volume> volumes = resp.getVolumes();
            if (volumes == null || volumes.isEmpty()) {
                return Optional.empty();
            }
            Volume v = volumes.get(0);
            if (v.getVolumeType() == null || v.getSize() == null) {
                return Optional.empty();
            }
            return Optional.of(new VolumeDescriptor(volumeId, v.getVolumeType(), v.getSize()));
        } catch (AmazonClientException e) {
            log.warn("EC2 DescribeVolumes failed for {}: {}", volumeId, e.getMessage());
            return Optional.empty();
        }
    }

    private static Instance firstInstance(DescribeInstancesResult resp) {
        List<Reservation> reservations = resp.getReservations();
        if (reservations == null || reservations.isEmpty()) return null;
        List<Instance> instances = reservations.get(0).getInstances();
        return (instances == null || instances.isEmpty()) ? null : instances.get(0);
    }
}
