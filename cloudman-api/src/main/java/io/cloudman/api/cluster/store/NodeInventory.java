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

package io.cloudman.api.cluster.store;

import java.util.List;
import java.util.Optional;

import io.cloudman.api.cluster.model.ClusterNode;
import io.cloudman.api.cluster.model.NodeLifecycleState;
import rx.Completable;

/**
 * Local record of cluster nodes, and of the autoscaler policy owning each of them.
 */
public interface NodeInventory {

    List<ClusterNode> getNodes();

    List<ClusterNode> listByCluster(String clusterId);

    Optional<ClusterNode> findNode(String nodeId);

    /**
     * Number of nodes attributed to the given policy. Manually created nodes are never counted.
     */
    int countOwned(String policyId);

    /**
     * Nodes attributed to the given policy, most recently created first.
     */
    List<ClusterNode> listOwned(String policyId);

    /**
     * Persist (add or update) the given node entity. Changing the policy reference of an existing node is
     * rejected with {@link ClusterStoreException}.
     */
    Completable storeNode(ClusterNode node);

    /**
     * Change the lifecycle state of a node.
     *
     * @return {@link ClusterStoreException} if the node is not found
     */
    Completable updateState(String nodeId, NodeLifecycleState state, long timestamp);

    Completable removeNode(String nodeId);
}
