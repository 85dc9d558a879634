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

import io.cloudman.api.cluster.model.Cluster;
import rx.Completable;

public interface ClusterStore {

    List<Cluster> getClusters();

    Optional<Cluster> findCluster(String clusterId);

    /**
     * Persist (add or update) the given cluster entity.
     */
    Completable storeCluster(Cluster cluster);

    Completable removeCluster(String clusterId);
}
