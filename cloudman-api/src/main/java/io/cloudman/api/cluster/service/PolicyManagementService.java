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

import io.cloudman.api.cluster.model.AutoScalerPolicy;
import rx.Completable;
import rx.Observable;

public interface PolicyManagementService {

    /**
     * Returns all policies of a cluster, ordered by creation time.
     *
     * @throws AutoScalerException if the cluster is not found
     */
    List<AutoScalerPolicy> getPolicies(String clusterId);

    /**
     * Validate and store a new policy. The id and the creation timestamp are assigned by the service.
     * A cluster can have at most one policy per zone (including the unzoned one), and policy names must be unique
     * within a cluster.
     *
     * @return the stored policy, or {@link AutoScalerException} if the policy is invalid
     */
    Observable<AutoScalerPolicy> createPolicy(AutoScalerPolicy policy);

    /**
     * Change an existing policy. The cluster a policy belongs to cannot be changed.
     */
    Completable updatePolicy(AutoScalerPolicy policy);

    /**
     * Remove a policy. Nodes created by the policy are left in place.
     */
    Completable removePolicy(String policyId);
}
