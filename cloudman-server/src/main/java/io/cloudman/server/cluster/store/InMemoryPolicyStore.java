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

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import javax.inject.Singleton;

import io.cloudman.api.cluster.model.AutoScalerPolicy;
import io.cloudman.api.cluster.store.PolicyStore;
import rx.Completable;

@Singleton
public class InMemoryPolicyStore implements PolicyStore {

    private final ConcurrentMap<String, AutoScalerPolicy> policyById = new ConcurrentHashMap<>();

    @Override
    public List<AutoScalerPolicy> listByCluster(String clusterId, Optional<String> zone) {
        return policyById.values().stream()
                .filter(policy -> policy.getClusterId().equals(clusterId))
                .filter(policy -> !zone.isPresent() || policy.getZone().equals(zone))
                .sorted(AutoScalerPolicy.creationOrder())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<AutoScalerPolicy> findPolicy(String policyId) {
        return Optional.ofNullable(policyById.get(policyId));
    }

    @Override
    public Completable storePolicy(AutoScalerPolicy policy) {
        return Completable.fromAction(() -> policyById.put(policy.getId(), policy));
    }

    @Override
    public Completable removePolicy(String policyId) {
        return Completable.fromAction(() -> policyById.remove(policyId));
    }

    @Override
    public Completable removePolicies(String clusterId) {
        return Completable.fromAction(() -> policyById.values().removeIf(policy -> policy.getClusterId().equals(clusterId)));
    }
}
