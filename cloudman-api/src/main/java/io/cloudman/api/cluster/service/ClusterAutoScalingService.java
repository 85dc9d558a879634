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

import io.cloudman.api.cluster.model.NodeDiscrepancy;
import io.cloudman.api.cluster.model.ScaleSignal;
import rx.Completable;
import rx.Observable;

/**
 * Entry point for scale signals. Callers are expected to have authorized the signal already.
 */
public interface ClusterAutoScalingService {

    /**
     * Add or remove at most one node of the cluster, according to the autoscaler policy matching the signal zone.
     * Emits exactly one {@link ScaleResult}. Signals which do not change the cluster (autoscaling disabled,
     * policy bounds reached, and so on) are reported as a not applied result, not as an error.
     *
     * @return {@link AutoScalerException} if the cluster is not found, if a scale operation for the same policy
     * is in progress for too long, or if the node could not be provisioned or deleted
     */
    Observable<ScaleResult> decideAndExecute(String clusterId, ScaleSignal signal);

    /**
     * Turn autoscaling of the cluster on or off.
     *
     * @return {@link AutoScalerException} if the cluster is not found
     */
    Completable updateAutoScalingEnabled(String clusterId, boolean enabled);

    /**
     * Compare the backend node list against the local inventory.
     */
    Observable<List<NodeDiscrepancy>> audit();
}
