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

package io.cloudman.api.cluster.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A worker node of a cluster. Nodes created by an autoscaler policy keep a reference to it. Nodes without
 * a policy reference were provisioned manually, and are never touched by the autoscaler.
 */
public class ClusterNode {

    private static final Comparator<ClusterNode> NEWEST_FIRST = Comparator
            .comparingLong(ClusterNode::getCreatedAt)
            .thenComparing(ClusterNode::getId)
            .reversed();

    private final String id;

    private final String backendNodeId;

    private final String clusterId;

    private final String policyId;

    private final String vmType;

    private final String zone;

    private final NodeLifecycleState state;

    private final long createdAt;

    private final long stateTimestamp;

    public ClusterNode(String id,
                       String backendNodeId,
                       String clusterId,
                       String policyId,
                       String vmType,
                       String zone,
                       NodeLifecycleState state,
                       long createdAt,
                       long stateTimestamp) {
        this.id = id;
        this.backendNodeId = backendNodeId;
        this.clusterId = clusterId;
        this.policyId = policyId;
        this.vmType = vmType;
        this.zone = zone;
        this.state = state;
        this.createdAt = createdAt;
        this.stateTimestamp = stateTimestamp;
    }

    public String getId() {
        return id;
    }

    /**
     * Node identifier assigned by the cluster management backend.
     */
    public String getBackendNodeId() {
        return backendNodeId;
    }

    public String getClusterId() {
        return clusterId;
    }

    /**
     * Returns {@link Optional#empty()} for manually provisioned nodes.
     */
    public Optional<String> getPolicyId() {
        return Optional.ofNullable(policyId);
    }

    public boolean isOwnedBy(String policyId) {
        return this.policyId != null && this.policyId.equals(policyId);
    }

    public boolean isManual() {
        return policyId == null;
    }

    public String getVmType() {
        return vmType;
    }

    public Optional<String> getZone() {
        return Optional.ofNullable(zone);
    }

    public NodeLifecycleState getState() {
        return state;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getStateTimestamp() {
        return stateTimestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ClusterNode that = (ClusterNode) o;
        return createdAt == that.createdAt &&
                stateTimestamp == that.stateTimestamp &&
                Objects.equals(id, that.id) &&
                Objects.equals(backendNodeId, that.backendNodeId) &&
                Objects.equals(clusterId, that.clusterId) &&
                Objects.equals(policyId, that.policyId) &&
                Objects.equals(vmType, that.vmType) &&
                Objects.equals(zone, that.zone) &&
                state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, backendNodeId, clusterId, policyId, vmType, zone, state, createdAt, stateTimestamp);
    }

    @Override
    public String toString() {
        return "ClusterNode{" +
                "id='" + id + '\'' +
                ", backendNodeId='" + backendNodeId + '\'' +
                ", clusterId='" + clusterId + '\'' +
                ", policyId='" + policyId + '\'' +
                ", vmType='" + vmType + '\'' +
                ", zone='" + zone + '\'' +
                ", state=" + state +
                ", createdAt=" + createdAt +
                ", stateTimestamp=" + stateTimestamp +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withId(id)
                .withBackendNodeId(backendNodeId)
                .withClusterId(clusterId)
                .withPolicyId(policyId)
                .withVmType(vmType)
                .withZone(zone)
                .withState(state)
                .withCreatedAt(createdAt)
                .withStateTimestamp(stateTimestamp);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Most recently created node first. Nodes created at the same time are ordered by id, in reverse.
     */
    public static Comparator<ClusterNode> newestFirst() {
        return NEWEST_FIRST;
    }

    public static final class Builder {
        private String id;
        private String backendNodeId;
        private String clusterId;
        private String policyId;
        private String vmType;
        private String zone;
        private NodeLifecycleState state;
        private long createdAt;
        private long stateTimestamp;

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withBackendNodeId(String backendNodeId) {
            this.backendNodeId = backendNodeId;
            return this;
        }

        public Builder withClusterId(String clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        public Builder withPolicyId(String policyId) {
            this.policyId = policyId;
            return this;
        }

        public Builder withVmType(String vmType) {
            this.vmType = vmType;
            return this;
        }

        public Builder withZone(String zone) {
            this.zone = zone;
            return this;
        }

        public Builder withState(NodeLifecycleState state) {
            this.state = state;
            return this;
        }

        public Builder withCreatedAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder withStateTimestamp(long stateTimestamp) {
            this.stateTimestamp = stateTimestamp;
            return this;
        }

        public ClusterNode build() {
            return new ClusterNode(id, backendNodeId, clusterId, policyId, vmType, zone, state, createdAt, stateTimestamp);
        }
    }
}
