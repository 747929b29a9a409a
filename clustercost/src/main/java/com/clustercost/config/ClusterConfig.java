/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.config;

/**
 *
 * @author rachanakeshav
 */
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * The parts of the cluster configuration document (Scheduling.SlurmQueues) needed to
 * find out which instance types the scheduler can launch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterConfig(@JsonProperty("Scheduling") Scheduling scheduling) {

    public static ClusterConfig empty() {
        return new ClusterConfig(new Scheduling(List.of()));
    }

    public List<SlurmQueue> queues() {
        if (scheduling == null || scheduling.slurmQueues() == null) return List.of();
        return scheduling.slurmQueues();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Scheduling(@JsonProperty("SlurmQueues") List<SlurmQueue> slurmQueues) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SlurmQueue(
            @JsonProperty("Name") String name,
            @JsonProperty("ComputeResources") List<ComputeResource> computeResources) {

        public List<ComputeResource> resources() {
            return computeResources == null ? List.of() : computeResources;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComputeResource(
            @JsonProperty("Name") String name,
            @JsonProperty("Instances") List<InstanceSpec> instances,
            @JsonProperty("InstanceType") String instanceType) {

        /** First configured type; the single-type form is used when Instances is absent. */
        public Optional<String> firstInstanceType() {
            if (instances != null) {
                return instances.stream()
                        .map(InstanceSpec::instanceType)
                        .filter(t -> t != null && !t.isBlank())
                        .findFirst();
            }
            if (instanceType != null && !instanceType.isBlank()) {
                return Optional.of(instanceType);
            }
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InstanceSpec(@JsonProperty("InstanceType") String instanceType) {
    }
}
