package com.clustercost.fakes;

import com.clustercost.inspect.InstanceMetadata;

public class FakeInstanceMetadata implements InstanceMetadata {

    private final String instanceId;
    private final String instanceType;

    public FakeInstanceMetadata(String instanceId, String instanceType) {
        this.instanceId = instanceId;
        this.instanceType = instanceType;
    }

    /** Metadata service that is not reachable. */
    public static InstanceMetadata unreachable() {
        return new InstanceMetadata() {
            @Override
            public String instanceId() {
                throw new IllegalStateException("metadata service unreachable");
            }

            @Override
            public String instanceType() {
                throw new IllegalStateException("metadata service unreachable");
            }
        };
    }

    @Override
    public String instanceId() {
        return instanceId;
    }

    @Override
    public String instanceType() {
        return instanceType;
    }
}
