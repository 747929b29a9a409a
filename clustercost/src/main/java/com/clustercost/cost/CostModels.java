/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.cost;

/**
 *
 * @author rachanakeshav
 */
import java.util.List;

public final class CostModels {

    private CostModels() {
    }

    // One named line item, ready for emission
    public record CostReport(String name, double valueUsd) {
    }

    public enum Branch {
        CONTROL_NODE("master_node_cost", "ebs_master_cost"),
        WORKER_FLEET("compute_nodes_cost", "ebs_compute_cost");

        public final String computeMetric;
        public final String storageMetric;

        Branch(String computeMetric, String storageMetric) {
            this.computeMetric = computeMetric;
            this.storageMetric = storageMetric;
        }
    }

    public record BranchResult(
            Branch branch,
            List<CostReport> reports,
            int lookupsSucceeded,
            int lookupsFailed
    ) {

        public static BranchResult of(Branch branch, double compute, double storage, int ok, int failed) {
            return new BranchResult(branch, List.of(
                    new CostReport(branch.computeMetric, compute),
                    new CostReport(branch.storageMetric, storage)), ok, failed);
        }

        /** Zero totals for a branch that could not run at all. */
        public static BranchResult failed(Branch branch) {
            return of(branch, 0.0, 0.0, 0, 1);
        }
    }
}
