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

import io.cloudman.api.cluster.model.AutoScalerPolicy;
import rx.Completable;

/**
 * Autoscaler policy data access. Zone filtering is an exact match only; resolving a zone to its effective policy
 * is not a store concern.
 */
public interface PolicyStore {

    /**
     * Returns policies of the cluster, ordered by creation time.
     *
     * @param zone if set, only policies with exactly this zone are returned
     */
    List<AutoScalerPolicy> listByCluster(String clusterId, Optional<String> zone);

    Optional<AutoScalerPolicy> findPolicy(String policyId);

    /**
     * Persist (add or update) the given policy entity.
     */
    Completable storePolicy(AutoScalerPolicy policy);

    Completable removePolicy(String policyId);

    /**
     * Remove all policies of the given cluster.
     */
    Completable removePolicies(String clusterId);
}
