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
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.cloudman.api.cluster.model.Cluster;
import io.cloudman.api.cluster.model.ClusterNode;
import io.cloudman.api.cluster.model.NodeLifecycleState;
import io.cloudman.api.cluster.service.AutoScalerException;
import io.cloudman.api.cluster.service.ClusterNodeService;
import io.cloudman.api.cluster.store.ClusterStore;
import io.cloudman.api.cluster.store.NodeInventory;
import io.cloudman.api.cluster.store.PolicyStore;
import io.cloudman.common.runtime.CloudmanRuntime;
import io.cloudman.common.util.rx.ObservableExt;
import io.cloudman.server.autoscale.PolicyLocks;
import io.cloudman.server.autoscale.ScaleExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rx.Completable;
import rx.Observable;

import static io.cloudman.api.cluster.service.AutoScalerException.checkArgument;

/**
 * Node operations requested by users. Nodes owned by a policy are removed under the policy lock, so that they
 * do not race with scale signals of the same policy.
 */
@Singleton
public class DefaultClusterNodeService implements ClusterNodeService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultClusterNodeService.class);

    private final CloudmanRuntime runtime;
    private final ClusterStore clusterStore;
    private final PolicyStore policyStore;
    private final NodeInventory nodeInventory;
    private final ScaleExecutor executor;
    private final PolicyLocks policyLocks;

    @Inject
    public DefaultClusterNodeService(CloudmanRuntime runtime,
                                     ClusterStore clusterStore,
                                     PolicyStore policyStore,
                                     NodeInventory nodeInventory,
                                     ScaleExecutor executor,
                                     PolicyLocks policyLocks) {
        this.runtime = runtime;
        this.clusterStore = clusterStore;
        this.policyStore = policyStore;
        this.nodeInventory = nodeInventory;
        this.executor = executor;
        this.policyLocks = policyLocks;
    }

    @Override
    public List<ClusterNode> getNodes(String clusterId) {
        findCluster(clusterId);
        return nodeInventory.listByCluster(clusterId);
    }

    @Override
    public Observable<ClusterNode> addNode(String clusterId, Optional<String> vmType, Optional<String> zone) {
        return Observable.defer(() -> {
            Cluster cluster = findCluster(clusterId);
            String effectiveVmType = vmType.orElse(cluster.getDefaultVmType());
            String effectiveZone = zone.orElse(cluster.getDefaultZone());
            logger.info("Adding manual node of type {} in zone {} to cluster {}", effectiveVmType, effectiveZone, clusterId);
            return executor.provisionNode(clusterId, null, effectiveVmType, effectiveZone);
        });
    }

    @Override
    public Completable removeNode(String clusterId, String nodeId) {
        return Completable.defer(() -> {
            findCluster(clusterId);
            ClusterNode node = nodeInventory.findNode(nodeId)
                    .filter(n -> n.getClusterId().equals(clusterId))
                    .orElseThrow(() -> AutoScalerException.nodeNotFound(nodeId));
            return removeNode(node);
        });
    }

    @Override
    public Completable markActive(String nodeId) {
        return Completable.defer(() -> {
            ClusterNode node = nodeInventory.findNode(nodeId).orElseThrow(() -> AutoScalerException.nodeNotFound(nodeId));
            checkArgument(node.getState() == NodeLifecycleState.Pending,
                    "Node %s is in state %s; only pending nodes can be activated", nodeId, node.getState());
            return nodeInventory.updateState(nodeId, NodeLifecycleState.Active, runtime.getClock().wallTime());
        });
    }

    @Override
    public Completable removeCluster(String clusterId) {
        return Completable.defer(() -> {
            Cluster cluster = findCluster(clusterId);
            logger.info("Removing cluster {}", clusterId);

            Completable disableAutoScaling = clusterStore.storeCluster(cluster.toBuilder().withAutoScalingEnabled(false).build());
            // Scale signals that passed the autoscaling check may still be provisioning under the policy lock
            Completable removeOwnedNodes = ObservableExt.fromCallable(() -> policyStore.listByCluster(clusterId, Optional.empty()))
                    .<Void>concatMapDelayError(policy -> policyLocks.<Void>withLock(clusterId, policy.getId(),
                            () -> Observable.from(liveNodes(clusterId, Optional.of(policy.getId())))
                                    .concatMapDelayError(node -> executor.removeNode(node).<Void>toObservable())
                    ))
                    .toCompletable();
            Completable removeRemainingNodes = Completable.defer(() -> Observable.from(liveNodes(clusterId, Optional.empty()))
                    .concatMapDelayError(node -> removeNode(node).<Void>toObservable())
                    .toCompletable()
            );
            Completable removeNodes = removeOwnedNodes.andThen(removeRemainingNodes)
                    .onErrorResumeNext(error -> {
                        logger.warn("Not all nodes of cluster {} removed; keeping the cluster record", clusterId);
                        return Completable.error(AutoScalerException.clusterTeardownError(clusterId, error));
                    });
            Completable removeRecords = Completable.defer(() -> policyStore.removePolicies(clusterId))
                    .andThen(Completable.defer(() -> clusterStore.removeCluster(clusterId)))
                    .doOnCompleted(() -> logger.info("Cluster {} removed", clusterId));

            return disableAutoScaling.andThen(removeNodes).andThen(removeRecords);
        });
    }

    /**
     * Nodes of the cluster not yet deleted, optionally restricted to those owned by the given policy.
     */
    private List<ClusterNode> liveNodes(String clusterId, Optional<String> policyId) {
        return nodeInventory.listByCluster(clusterId).stream()
                .filter(node -> node.getState() != NodeLifecycleState.Deleted)
                .filter(node -> !policyId.isPresent() || node.getPolicyId().equals(policyId))
                .collect(Collectors.toList());
    }

    private Completable removeNode(ClusterNode node) {
        // Re-read under the lock, as a scale signal may have removed the node in the meantime
        Completable removal = Completable.defer(() -> nodeInventory.findNode(node.getId())
                .map(executor::removeNode)
                .orElseGet(Completable::complete)
        );
        Optional<String> policyId = node.getPolicyId();
        if (policyId.isPresent()) {
            return policyLocks.withLock(node.getClusterId(), policyId.get(), removal);
        }
        return removal;
    }

    private Cluster findCluster(String clusterId) {
        return clusterStore.findCluster(clusterId).orElseThrow(() -> AutoScalerException.clusterNotFound(clusterId));
    }
}
