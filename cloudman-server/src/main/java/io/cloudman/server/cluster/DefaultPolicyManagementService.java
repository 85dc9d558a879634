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

package io.cloudman.server.cluster;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.base.Strings;
import io.cloudman.api.cluster.model.AutoScalerPolicy;
import io.cloudman.api.cluster.model.Cluster;
import io.cloudman.api.cluster.service.AutoScalerException;
import io.cloudman.api.cluster.service.PolicyManagementService;
import io.cloudman.api.cluster.store.ClusterStore;
import io.cloudman.api.cluster.store.PolicyStore;
import io.cloudman.common.runtime.CloudmanRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rx.Completable;
import rx.Observable;

import static io.cloudman.api.cluster.service.AutoScalerException.checkArgument;

@Singleton
public class DefaultPolicyManagementService implements PolicyManagementService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPolicyManagementService.class);

    private final CloudmanRuntime runtime;
    private final ClusterStore clusterStore;
    private final PolicyStore policyStore;

    // Validation and store update of policies must not interleave
    private final Object policyUpdateLock = new Object();

    @Inject
    public DefaultPolicyManagementService(CloudmanRuntime runtime, ClusterStore clusterStore, PolicyStore policyStore) {
        this.runtime = runtime;
        this.clusterStore = clusterStore;
        this.policyStore = policyStore;
    }

    @Override
    public List<AutoScalerPolicy> getPolicies(String clusterId) {
        findCluster(clusterId);
        return policyStore.listByCluster(clusterId, Optional.empty());
    }

    @Override
    public Observable<AutoScalerPolicy> createPolicy(AutoScalerPolicy policy) {
        return Observable.fromCallable(() -> {
            Cluster cluster = findCluster(policy.getClusterId());
            synchronized (policyUpdateLock) {
                AutoScalerPolicy.Builder builder = policy.toBuilder()
                        .withId(UUID.randomUUID().toString())
                        .withCreatedAt(runtime.getClock().wallTime());
                if (Strings.isNullOrEmpty(policy.getVmType())) {
                    builder.withVmType(cluster.getDefaultVmType());
                }
                AutoScalerPolicy newPolicy = builder.build();
                validate(newPolicy);
                policyStore.storePolicy(newPolicy).await();
                logger.info("Created autoscaler policy {}", newPolicy);
                return newPolicy;
            }
        });
    }

    @Override
    public Completable updatePolicy(AutoScalerPolicy policy) {
        return Completable.fromAction(() -> {
            synchronized (policyUpdateLock) {
                AutoScalerPolicy current = policyStore.findPolicy(policy.getId())
                        .orElseThrow(() -> AutoScalerException.policyNotFound(policy.getId()));
                checkArgument(current.getClusterId().equals(policy.getClusterId()),
                        "Policy %s cannot be moved from cluster %s to %s", policy.getId(), current.getClusterId(), policy.getClusterId());
                AutoScalerPolicy updated = policy.toBuilder().withCreatedAt(current.getCreatedAt()).build();
                validate(updated);
                policyStore.storePolicy(updated).await();
                logger.info("Updated autoscaler policy {} -> {}", current, updated);
            }
        });
    }

    @Override
    public Completable removePolicy(String policyId) {
        return Completable.defer(() -> {
            AutoScalerPolicy policy = policyStore.findPolicy(policyId).orElseThrow(() -> AutoScalerException.policyNotFound(policyId));
            logger.info("Removing autoscaler policy {}", policy);
            return policyStore.removePolicy(policyId);
        });
    }

    private Cluster findCluster(String clusterId) {
        return clusterStore.findCluster(clusterId).orElseThrow(() -> AutoScalerException.clusterNotFound(clusterId));
    }

    private void validate(AutoScalerPolicy policy) {
        checkArgument(!Strings.isNullOrEmpty(policy.getName()), "Policy name not set");
        checkArgument(!Strings.isNullOrEmpty(policy.getVmType()), "Policy %s has no vm type", policy.getName());
        checkArgument(policy.getMinNodes() >= 0, "Policy %s: minNodes (%s) must not be negative", policy.getName(), policy.getMinNodes());
        checkArgument(policy.getMinNodes() <= policy.getMaxNodes(),
                "Policy %s: minNodes (%s) must not be greater than maxNodes (%s)", policy.getName(), policy.getMinNodes(), policy.getMaxNodes());

        for (AutoScalerPolicy other : policyStore.listByCluster(policy.getClusterId(), Optional.empty())) {
            if (other.getId().equals(policy.getId())) {
                continue;
            }
            checkArgument(!other.getName().equals(policy.getName()),
                    "Policy named %s already exists in cluster %s", policy.getName(), policy.getClusterId());
            checkArgument(!other.getZone().equals(policy.getZone()),
                    "Cluster %s already has policy %s for zone %s", policy.getClusterId(), other.getName(), policy.getZone().orElse("<default>"));
        }
    }
}
