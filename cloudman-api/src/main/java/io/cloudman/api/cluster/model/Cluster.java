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

import java.util.Objects;

/**
 * A Kubernetes cluster managed by CloudMan. The cluster is the root of ownership for its autoscaler policies
 * and nodes.
 */
public class Cluster {

    private final String id;

    private final String name;

    private final boolean autoScalingEnabled;

    private final String defaultZone;

    private final String defaultVmType;

    public Cluster(String id,
                   String name,
                   boolean autoScalingEnabled,
                   String defaultZone,
                   String defaultVmType) {
        this.id = id;
        this.name = name;
        this.autoScalingEnabled = autoScalingEnabled;
        this.defaultZone = defaultZone;
        this.defaultVmType = defaultVmType;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * If false, all scale signals sent to this cluster are ignored.
     */
    public boolean isAutoScalingEnabled() {
        return autoScalingEnabled;
    }

    public String getDefaultZone() {
        return defaultZone;
    }

    public String getDefaultVmType() {
        return defaultVmType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Cluster cluster = (Cluster) o;
        return autoScalingEnabled == cluster.autoScalingEnabled &&
                Objects.equals(id, cluster.id) &&
                Objects.equals(name, cluster.name) &&
                Objects.equals(defaultZone, cluster.defaultZone) &&
                Objects.equals(defaultVmType, cluster.defaultVmType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, autoScalingEnabled, defaultZone, defaultVmType);
    }

    @Override
    public String toString() {
        return "Cluster{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", autoScalingEnabled=" + autoScalingEnabled +
                ", defaultZone='" + defaultZone + '\'' +
                ", defaultVmType='" + defaultVmType + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withId(id)
                .withName(name)
                .withAutoScalingEnabled(autoScalingEnabled)
                .withDefaultZone(defaultZone)
                .withDefaultVmType(defaultVmType);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private boolean autoScalingEnabled = true;
        private String defaultZone;
        private String defaultVmType;

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withAutoScalingEnabled(boolean autoScalingEnabled) {
            this.autoScalingEnabled = autoScalingEnabled;
            return this;
        }

        public Builder withDefaultZone(String defaultZone) {
            this.defaultZone = defaultZone;
            return this;
        }

        public Builder withDefaultVmType(String defaultVmType) {
            this.defaultVmType = defaultVmType;
            return this;
        }

        public Cluster build() {
            return new Cluster(id, name, autoScalingEnabled, defaultZone, defaultVmType);
        }
    }
}
