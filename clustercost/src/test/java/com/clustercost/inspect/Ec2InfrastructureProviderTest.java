package com.clustercost.inspect;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.ec2.AbstractAmazonEC2;
import com.amazonaws.services.ec2.model.DescribeInstancesRequest;
import com.amazonaws.services.ec2.model.DescribeInstancesResult;
import com.amazonaws.services.ec2.model.DescribeVolumesRequest;
import com.amazonaws.services.ec2.model.DescribeVolumesResult;
import com.amazonaws.services.ec2.model.EbsInstanceBlockDevice;
import com.amazonaws.services.ec2.model.Instance;
import com.amazonaws.services.ec2.model.InstanceBlockDeviceMapping;
import com.amazonaws.services.ec2.model.Reservation;
import com.amazonaws.services.ec2.model.Volume;
import com.clustercost.inspect.InspectModels.VolumeDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Ec2InfrastructureProvider Tests")
class Ec2InfrastructureProviderTest {

    private static final class StubEc2 extends AbstractAmazonEC2 {

        @Override
        public DescribeInstancesResult describeInstances(DescribeInstancesRequest request) {
            if (!request.getInstanceIds().contains("i-0abc")) {
                return new DescribeInstancesResult().withReservations(List.of());
            }
            Instance instance = new Instance()
                    .withInstanceId("i-0abc")
                    .withBlockDeviceMappings(
                            new InstanceBlockDeviceMapping().withDeviceName("/dev/xvda")
                                    .withEbs(new EbsInstanceBlockDevice().withVolumeId("vol-root")),
                            new InstanceBlockDeviceMapping().withDeviceName("/dev/sdb"),
                            new InstanceBlockDeviceMapping().withDeviceName("/dev/sdc")
                                    .withEbs(new EbsInstanceBlockDevice().withVolumeId("vol-data")));
            return new DescribeInstancesResult().withReservations(new Reservation().withInstances(instance));
        }

        @Override
        public DescribeVolumesResult describeVolumes(DescribeVolumesRequest request) {
            String id = request.getVolumeIds().get(0);
            if ("vol-root".equals(id)) {
                return new DescribeVolumesResult().withVolumes(
                        new Volume().withVolumeId(id).withVolumeType("gp3").withSize(40));
            }
            throw new AmazonServiceException("The volume '" + id + "' does not exist.");
        }
    }

    @Test
    @DisplayName("Should list EBS volume ids and skip instance-store devices")
    void testAttachedVolumeIds() {
        Ec2InfrastructureProvider provider = new Ec2InfrastructureProvider(new StubEc2());

        assertEquals(Optional.of(List.of("vol-root", "vol-data")), provider.attachedVolumeIds("i-0abc"));
        assertEquals(Optional.empty(), provider.attachedVolumeIds("i-other"));
    }

    @Test
    @DisplayName("Should describe volume type and size, empty on service errors")
    void testDescribeVolume() {
        Ec2InfrastructureProvider provider = new Ec2InfrastructureProvider(new StubEc2());

        assertEquals(Optional.of(new VolumeDescriptor("vol-root", "gp3", 40)), provider.describeVolume("vol-root"));
        assertEquals(Optional.empty(), provider.describeVolume("vol-data"));
    }

    @Test
    @DisplayName("Client construction failures surface as failed lookups")
    void testLazyClient_ConstructionFails() {
        Ec2InfrastructureProvider provider = new Ec2InfrastructureProvider(() -> {
            throw new SdkClientException("Unable to find a region via the region provider chain");
        });

        assertEquals(Optional.empty(), provider.attachedVolumeIds("i-0abc"));
    }
}
