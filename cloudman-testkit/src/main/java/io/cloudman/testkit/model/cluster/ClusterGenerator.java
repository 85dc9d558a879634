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

package io.cloudman.testkit.model.cluster;

import java.util.UUID;

import io.cloudman.api.cluster.model.AutoScalerPolicy;
import io.cloudman.api.cluster.model.Cluster;
import io.cloudman.api.cluster.model.ClusterNode;
import io.cloudman.api.cluster.model.NodeLifecycleState;

/**
 * Sample cluster entities for tests.
 */
public final class ClusterGenerator {

    public static final String DEFAULT_ZONE = "us-east-1b";
    public static final String DEFAULT_VM_TYPE = "m2.large";
    public static final String POLICY_VM_TYPE = "m1.medium";

    private ClusterGenerator() {
    }

    public static Cluster cluster(String clusterId) {
        return Cluster.newBuilder()
                .withId(clusterId)
                .withName("cluster-" + clusterId)
                .withAutoScalingEnabled(true)
                .withDefaultZone(DEFAULT_ZONE)
                .withDefaultVmType(DEFAULT_VM_TYPE)
                .build();
    }

    /**
     * Policy template, without id and creation timestamp.
     */
    public static AutoScalerPolicy policyTemplate(String clusterId, String name, String zone, int min, int max) {
        return AutoScalerPolicy.newBuilder()
                .withClusterId(clusterId)
                .withName(name)
                .withVmType(POLICY_VM_TYPE)
                .withZone(zone)
                .withMinNodes(min)
                .withMaxNodes(max)
                .build();
    }

    public static AutoScalerPolicy policy(String clusterId, String name, String zone, int min, int max, long createdAt) {
        return policyTemplate(clusterId, name, zone, min, max).toBuilder()
                .withId(clusterId + '/' + name)
                .withCreatedAt(createdAt)
                .build();
    }

    public static ClusterNode ownedNode(AutoScalerPolicy policy, long createdAt) {
        return node(policy.getClusterId(), policy.getId(), policy.getVmType(), policy.getZone().orElse(null), createdAt);
    }

    public static ClusterNode manualNode(String clusterId, long createdAt) {
        return node(clusterId, null, DEFAULT_VM_TYPE, DEFAULT_ZONE, createdAt);
    }

    private static ClusterNode node(String clusterId, String policyId, String vmType, String zone, long createdAt) {
        String id = UUID.randomUUID().toString();
        return ClusterNode.newBuilder()
                .withId(id)
                .withBackendNodeId("backend-" + id)
                .withClusterId(clusterId)
                .withPolicyId(policyId)
                .withVmType(vmType)
                .withZone(zone)
                .withState(NodeLifecycleState.Active)
                .withCreatedAt(createdAt)
                .withStateTimestamp(createdAt)
                .build();
    }
}
