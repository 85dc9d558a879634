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
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.inject.Singleton;

import io.cloudman.api.cluster.model.Cluster;
import io.cloudman.api.cluster.store.ClusterStore;
import rx.Completable;

@Singleton
public class InMemoryClusterStore implements ClusterStore {

    private final ConcurrentMap<String, Cluster> clusterById = new ConcurrentHashMap<>();

    @Override
    public List<Cluster> getClusters() {
        return new ArrayList<>(clusterById.values());
    }

    @Override
    public Optional<Cluster> findCluster(String clusterId) {
        return Optional.ofNullable(clusterById.get(clusterId));
    }

    @Override
    public Completable storeCluster(Cluster cluster) {
        return Completable.fromAction(() -> clusterById.put(cluster.getId(), cluster));
    }

    @Override
    public Completable removeCluster(String clusterId) {
        return Completable.fromAction(() -> clusterById.remove(clusterId));
    }
}
