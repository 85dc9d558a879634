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

package io.cloudman.api.connector.node;

import java.util.List;

import rx.Completable;
import rx.Observable;

/**
 * The primary API to create and destroy cluster nodes in the backing orchestration system.
 */
public interface NodeLifecycleGateway {

    /**
     * Request a new node. Emits the backend node id, and completes.
     *
     * @param zone availability zone, or null for the backend default zone
     */
    Observable<String> provision(String vmType, String zone);

    /**
     * Evict workloads from the node. Failures of this operation are not fatal, as the node may already be gone.
     */
    Completable drain(String backendNodeId);

    /**
     * Deregister the node from the cluster, and terminate the underlying VM.
     */
    Completable delete(String backendNodeId);

    /**
     * All nodes known to the backend.
     */
    Observable<List<String>> listNodes();
}
