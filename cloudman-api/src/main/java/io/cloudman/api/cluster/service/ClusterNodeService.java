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

package io.cloudman.api.cluster.service;

import java.util.List;
import java.util.Optional;

import io.cloudman.api.cluster.model.ClusterNode;
import rx.Completable;
import rx.Observable;

/**
 * Administrative node operations. Nodes added here are not owned by any autoscaler policy.
 */
public interface ClusterNodeService {

    List<ClusterNode> getNodes(String clusterId);

    /**
     * Provision a node outside of autoscaler control. Missing vm type and zone default to the cluster ones.
     */
    Observable<ClusterNode> addNode(String clusterId, Optional<String> vmType, Optional<String> zone);

    /**
     * Drain and delete a node of the cluster, whether it is owned by a policy or not.
     */
    Completable removeNode(String clusterId, String nodeId);

    /**
     * Record that a pending node is ready.
     */
    Completable markActive(String nodeId);

    /**
     * Turn off autoscaling, remove all nodes and policies of the cluster, and the cluster itself. If some nodes
     * cannot be removed, the cluster record is kept.
     */
    Completable removeCluster(String clusterId);
}
