package com.clustercost.inspect;

import com.clustercost.config.ClusterConfig;
import com.clustercost.config.ClusterConfig.ComputeResource;
import com.clustercost.config.ClusterConfig.InstanceSpec;
import com.clustercost.config.ClusterConfig.Scheduling;
import com.clustercost.config.ClusterConfig.SlurmQueue;
import com.clustercost.fakes.FakeScheduler;
import com.clustercost.inspect.InspectModels.FleetSnapshot;
import com.clustercost.inspect.InspectModels.NodeGroupState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WorkerFleetInspector Tests")
class WorkerFleetInspectorTest {

    private static ComputeResource resource(String name, String... types) {
        List<InstanceSpec> specs = new ArrayList<>();
        for (String t : types) {
            specs.add(new InstanceSpec(t));
        }
        return new ComputeResource(name, specs, null);
    }

    private static ClusterConfig config(SlurmQueue... queues) {
        return new ClusterConfig(new Scheduling(List.of(queues)));
    }

    @Test
    @DisplayName("Each template takes its first instance type and the queue's active count")
    void testInspect_Basic() {
        FakeScheduler scheduler = new FakeScheduler()
                .partition("compute", "compute* up infinite 4 alloc compute-dy-c5-[1-4]");
        ClusterConfig cfg = config(new SlurmQueue("compute", List.of(resource("c5", "c5.xlarge", "c5.2xlarge"))));

        FleetSnapshot fleet = new WorkerFleetInspector(cfg, scheduler, new NodeStateParser()).inspect();

        assertEquals(List.of(new NodeGroupState("compute", "c5", "c5.xlarge", 4)), fleet.groups());
        assertEquals(1, fleet.queriesSucceeded());
        assertEquals(0, fleet.queriesFailed());
    }

    @Test
    @DisplayName("Templates without instance types are skipped")
    void testInspect_SkipsEmptyTemplate() {
        FakeScheduler scheduler = new FakeScheduler().partition("q", "q up infinite 1 idle q-1");
        ClusterConfig cfg = config(new SlurmQueue("q", List.of(
                new ComputeResource("none", null, null),
                resource("empty"),
                resource("m5", "m5.large"))));

        FleetSnapshot fleet = new WorkerFleetInspector(cfg, scheduler, new NodeStateParser()).inspect();

        assertEquals(1, fleet.groups().size());
        assertEquals("m5.large", fleet.groups().get(0).instanceType());
    }

    @Test
    @DisplayName("A failing queue counts zero nodes and the other queues still report")
    void testInspect_QueueFailureIsolated() {
        FakeScheduler scheduler = new FakeScheduler()
                .partition("healthy", "healthy up infinite 2 mix healthy-[1-2]");
        ClusterConfig cfg = config(
                new SlurmQueue("broken", List.of(resource("a", "c5.large"))),
                new SlurmQueue("healthy", List.of(resource("b", "m5.large"))));

        FleetSnapshot fleet = new WorkerFleetInspector(cfg, scheduler, new NodeStateParser()).inspect();

        assertEquals(0, fleet.groups().get(0).activeNodeCount());
        assertEquals(2, fleet.groups().get(1).activeNodeCount());
        assertEquals(1, fleet.queriesSucceeded());
        assertEquals(1, fleet.queriesFailed());
    }

    @Test
    @DisplayName("Partition is queried once per queue regardless of template count")
    void testInspect_OneQueryPerQueue() {
        FakeScheduler scheduler = new FakeScheduler().partition("q", "q up infinite 3 alloc q-[1-3]");
        ClusterConfig cfg = config(new SlurmQueue("q", List.of(
                resource("a", "c5.large"), resource("b", "m5.large"))));

        FleetSnapshot fleet = new WorkerFleetInspector(cfg, scheduler, new NodeStateParser()).inspect();

        assertEquals(1, scheduler.calls("q"));
        assertEquals(2, fleet.groups().size());
        assertTrue(fleet.groups().stream().allMatch(g -> g.activeNodeCount() == 3));
    }

    @Test
    @DisplayName("Single InstanceType form is accepted when Instances is absent")
    void testInspect_SingleInstanceTypeForm() {
        FakeScheduler scheduler = new FakeScheduler().partition("q", "q up infinite 1 alloc q-1");
        ClusterConfig cfg = config(new SlurmQueue("q", List.of(new ComputeResource("t", null, "t3.micro"))));

        FleetSnapshot fleet = new WorkerFleetInspector(cfg, scheduler, new NodeStateParser()).inspect();

        assertEquals("t3.micro", fleet.groups().get(0).instanceType());
    }

    @Test
    @DisplayName("Queues without a name are never queried")
    void testInspect_UnnamedQueue() {
        FakeScheduler scheduler = new FakeScheduler();
        ClusterConfig cfg = config(new SlurmQueue(" ", List.of(resource("a", "c5.large"))));

        FleetSnapshot fleet = new WorkerFleetInspector(cfg, scheduler, new NodeStateParser()).inspect();

        assertTrue(fleet.groups().isEmpty());
        assertEquals(0, scheduler.calls(" "));
    }

    @Test
    @DisplayName("Unreadable configuration fails the whole inspection")
    void testInspect_ConfigUnreadable() {
        WorkerFleetInspector inspector = new WorkerFleetInspector(
                () -> {
                    throw new UncheckedIOException(new IOException("no such file"));
                },
                new FakeScheduler(), new NodeStateParser());

        assertThrows(UncheckedIOException.class, inspector::inspect);
    }
}
