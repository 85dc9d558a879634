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
import java.util.Optional;

/**
 * Mismatch between the backend node list and the local node inventory, found by an audit.
 */
public class NodeDiscrepancy {

    public enum Kind {
        /**
         * Backend node without a local record. Expected after a crash between a successful provisioning call
         * and the inventory update.
         */
        UntrackedBackendNode,

        /**
         * Local pending or active node, which the backend does not know about.
         */
        MissingBackendNode,

        /**
         * Local node left in the draining state after a failed removal.
         */
        StuckDraining
    }

    private final Kind kind;
    private final String backendNodeId;
    private final ClusterNode node;

    private NodeDiscrepancy(Kind kind, String backendNodeId, ClusterNode node) {
        this.kind = kind;
        this.backendNodeId = backendNodeId;
        this.node = node;
    }

    public Kind getKind() {
        return kind;
    }

    public String getBackendNodeId() {
        return backendNodeId;
    }

    /**
     * Local record, if there is one.
     */
    public Optional<ClusterNode> getNode() {
        return Optional.ofNullable(node);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NodeDiscrepancy that = (NodeDiscrepancy) o;
        return kind == that.kind &&
                Objects.equals(backendNodeId, that.backendNodeId) &&
                Objects.equals(node, that.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, backendNodeId, node);
    }

    @Override
    public String toString() {
        return "NodeDiscrepancy{" +
                "kind=" + kind +
                ", backendNodeId='" + backendNodeId + '\'' +
                ", node=" + node +
                '}';
    }

    public static NodeDiscrepancy untracked(String backendNodeId) {
        return new NodeDiscrepancy(Kind.UntrackedBackendNode, backendNodeId, null);
    }

    public static NodeDiscrepancy missing(ClusterNode node) {
        return new NodeDiscrepancy(Kind.MissingBackendNode, node.getBackendNodeId(), node);
    }

    public static NodeDiscrepancy stuckDraining(ClusterNode node) {
        return new NodeDiscrepancy(Kind.StuckDraining, node.getBackendNodeId(), node);
    }
}
