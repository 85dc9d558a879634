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

package io.cloudman.server.cluster.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import javax.inject.Singleton;

import io.cloudman.api.cluster.model.ClusterNode;
import io.cloudman.api.cluster.model.NodeLifecycleState;
import io.cloudman.api.cluster.store.ClusterStoreException;
import io.cloudman.api.cluster.store.NodeInventory;
import rx.Completable;

@Singleton
public class InMemoryNodeInventory implements NodeInventory {

    private final ConcurrentMap<String, ClusterNode> nodeById = new ConcurrentHashMap<>();

    @Override
    public List<ClusterNode> getNodes() {
        return new ArrayList<>(nodeById.values());
    }

    @Override
    public List<ClusterNode> listByCluster(String clusterId) {
        return nodeById.values().stream()
                .filter(node -> node.getClusterId().equals(clusterId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ClusterNode> findNode(String nodeId) {
        return Optional.ofNullable(nodeById.get(nodeId));
    }

    @Override
    public int countOwned(String policyId) {
        return (int) nodeById.values().stream().filter(node -> node.isOwnedBy(policyId)).count();
    }

    @Override
    public List<ClusterNode> listOwned(String policyId) {
        return nodeById.values().stream()
                .filter(node -> node.isOwnedBy(policyId))
                .sorted(ClusterNode.newestFirst())
                .collect(Collectors.toList());
    }

    @Override
    public Completable storeNode(ClusterNode node) {
        return Completable.fromAction(() -> nodeById.compute(node.getId(), (id, current) -> {
            if (current != null && !Objects.equals(current.getPolicyId(), node.getPolicyId())) {
                throw ClusterStoreException.policyReferenceChanged(
                        id, current.getPolicyId().orElse(null), node.getPolicyId().orElse(null)
                );
            }
            return node;
        }));
    }

    @Override
    public Completable updateState(String nodeId, NodeLifecycleState state, long timestamp) {
        return Completable.fromAction(() -> {
            ClusterNode updated = nodeById.computeIfPresent(nodeId, (id, current) ->
                    current.toBuilder().withState(state).withStateTimestamp(timestamp).build()
            );
            if (updated == null) {
                throw ClusterStoreException.nodeNotFound(nodeId);
            }
        });
    }

    @Override
    public Completable removeNode(String nodeId) {
        return Completable.fromAction(() -> nodeById.remove(nodeId));
    }
}
