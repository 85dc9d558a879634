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
 * Scaling rule bounding the number of nodes it creates in a cluster. A policy without a zone is the cluster
 * default, and handles signals from zones that have no dedicated policy.
 */
public class AutoScalerPolicy {

    private static final Comparator<AutoScalerPolicy> CREATION_ORDER = Comparator
            .comparingLong(AutoScalerPolicy::getCreatedAt)
            .thenComparing(AutoScalerPolicy::getId);

    private final String id;

    private final String clusterId;

    private final String name;

    private final String vmType;

    private final String zone;

    private final int minNodes;

    private final int maxNodes;

    private final long createdAt;

    public AutoScalerPolicy(String id,
                            String clusterId,
                            String name,
                            String vmType,
                            String zone,
                            int minNodes,
                            int maxNodes,
                            long createdAt) {
        this.id = id;
        this.clusterId = clusterId;
        this.name = name;
        this.vmType = vmType;
        this.zone = zone;
        this.minNodes = minNodes;
        this.maxNodes = maxNodes;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getClusterId() {
        return clusterId;
    }

    public String getName() {
        return name;
    }

    public String getVmType() {
        return vmType;
    }

    /**
     * Returns {@link Optional#empty()} for the cluster default (unzoned) policy.
     */
    public Optional<String> getZone() {
        return Optional.ofNullable(zone);
    }

    public int getMinNodes() {
        return minNodes;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AutoScalerPolicy that = (AutoScalerPolicy) o;
        return minNodes == that.minNodes &&
                maxNodes == that.maxNodes &&
                createdAt == that.createdAt &&
                Objects.equals(id, that.id) &&
                Objects.equals(clusterId, that.clusterId) &&
                Objects.equals(name, that.name) &&
                Objects.equals(vmType, that.vmType) &&
                Objects.equals(zone, that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, clusterId, name, vmType, zone, minNodes, maxNodes, createdAt);
    }

    @Override
    public String toString() {
        return "AutoScalerPolicy{" +
                "id='" + id + '\'' +
                ", clusterId='" + clusterId + '\'' +
                ", name='" + name + '\'' +
                ", vmType='" + vmType + '\'' +
                ", zone='" + zone + '\'' +
                ", minNodes=" + minNodes +
                ", maxNodes=" + maxNodes +
                ", createdAt=" + createdAt +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withId(id)
                .withClusterId(clusterId)
                .withName(name)
                .withVmType(vmType)
                .withZone(zone)
                .withMinNodes(minNodes)
                .withMaxNodes(maxNodes)
                .withCreatedAt(createdAt);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Oldest policy first. Policies created at the same time are ordered by id.
     */
    public static Comparator<AutoScalerPolicy> creationOrder() {
        return CREATION_ORDER;
    }

    public static final class Builder {
        private String id;
        private String clusterId;
        private String name;
        private String vmType;
        private String zone;
        private int minNodes;
        private int maxNodes;
        private long createdAt;

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withClusterId(String clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
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

        public Builder withMinNodes(int minNodes) {
            this.minNodes = minNodes;
            return this;
        }

        public Builder withMaxNodes(int maxNodes) {
            this.maxNodes = maxNodes;
            return this;
        }

        public Builder withCreatedAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public AutoScalerPolicy build() {
            return new AutoScalerPolicy(id, clusterId, name, vmType, zone, minNodes, maxNodes, createdAt);
        }
    }
}
