/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.cloudman.server.autoscale;

import java.util.Collection;
import java.util.List;

import com.google.common.collect.ImmutableList;
import io.cloudman.api.cluster.model.AutoScalerPolicy;
import io.cloudman.api.cluster.model.Cluster;
import io.cloudman.api.cluster.model.ClusterNode;

/**
 * Consistent view of a cluster, its autoscaler policies and its nodes, taken when a scale signal is evaluated.
 */
public class ClusterSnapshot {

    private final Cluster cluster;
    private final List<AutoScalerPolicy> policies;
    private final List<ClusterNode> nodes;

    private ClusterSnapshot(Cluster cluster, List<AutoScalerPolicy> policies, List<ClusterNode> nodes) {
        this.cluster = cluster;
        this.policies = policies;
        this.nodes = nodes;
    }

    public Cluster getCluster() {
        return cluster;
    }

    public List<AutoScalerPolicy> getPolicies() {
        return policies;
    }

    public List<ClusterNode> getNodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return "ClusterSnapshot{" +
                "cluster=" + cluster +
                ", policies=" + policies +
                ", nodes=" + nodes +
                '}';
    }

    public static ClusterSnapshot of(Cluster cluster, Collection<AutoScalerPolicy> policies, Collection<ClusterNode> nodes) {
        return new ClusterSnapshot(
                cluster,
                ImmutableList.sortedCopyOf(AutoScalerPolicy.creationOrder(), policies),
                ImmutableList.copyOf(nodes)
        );
    }
}
