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

package io.cloudman.server.autoscale;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import io.cloudman.api.cluster.model.AutoScalerPolicy;
import io.cloudman.api.cluster.model.ClusterNode;
import io.cloudman.api.cluster.model.NodeLifecycleState;
import io.cloudman.api.cluster.service.AutoScalerException;
import io.cloudman.api.cluster.service.ScaleResult;
import io.cloudman.api.cluster.store.NodeInventory;
import io.cloudman.api.connector.node.NodeLifecycleGateway;
import io.cloudman.api.connector.node.NodeLifecycleGatewayException;
import io.cloudman.common.runtime.CloudmanRuntime;
import io.cloudman.common.util.time.Clock;
import io.cloudman.server.MetricConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rx.Completable;
import rx.Observable;
import rx.Scheduler;
import rx.schedulers.Schedulers;

/**
 * Applies {@link ScaleDecision}s: provisions nodes through the {@link NodeLifecycleGateway} and records them in
 * the {@link NodeInventory}, or drains and deletes them. Every gateway call is bounded by a timeout.
 * <p>
 * Inventory changes follow the backend: a node is recorded only after the backend returned its id, and it is
 * forgotten only after the backend confirmed its deletion.
 */
@Singleton
public class ScaleExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ScaleExecutor.class);

    private static final String METRIC_ROOT = MetricConstants.METRIC_AUTO_SCALER + "executor.";

    private final AutoScalerConfiguration configuration;
    private final NodeLifecycleGateway gateway;
    private final NodeInventory nodeInventory;
    private final Clock clock;
    private final Scheduler scheduler;

    private final Registry registry;
    private final Id provisionLatencyId;
    private final Id removeLatencyId;
    private final Id drainFailuresId;

    @Inject
    public ScaleExecutor(CloudmanRuntime runtime,
                         AutoScalerConfiguration configuration,
                         NodeLifecycleGateway gateway,
                         NodeInventory nodeInventory) {
        this(runtime, configuration, gateway, nodeInventory, Schedulers.computation());
    }

    @VisibleForTesting
    ScaleExecutor(CloudmanRuntime runtime,
                  AutoScalerConfiguration configuration,
                  NodeLifecycleGateway gateway,
                  NodeInventory nodeInventory,
                  Scheduler scheduler) {
        this.configuration = configuration;
        this.gateway = gateway;
        this.nodeInventory = nodeInventory;
        this.clock = runtime.getClock();
        this.scheduler = scheduler;

        this.registry = runtime.getRegistry();
        this.provisionLatencyId = registry.createId(METRIC_ROOT + "provisionLatency");
        this.removeLatencyId = registry.createId(METRIC_ROOT + "removeLatency");
        this.drainFailuresId = registry.createId(METRIC_ROOT + "drainFailures");
    }

    public Observable<ScaleResult> execute(ScaleDecision decision) {
        switch (decision.getAction()) {
            case Create:
                AutoScalerPolicy policy = decision.getPolicy().get();
                return provisionNode(policy.getClusterId(), policy.getId(), policy.getVmType(), policy.getZone().orElse(null))
                        .map(node -> ScaleResult.created(node.getId()));
            case Delete:
                ClusterNode node = decision.getNode().get();
                return removeNode(node).andThen(Observable.just(ScaleResult.deleted(node.getId())));
            case None:
            default:
                return Observable.just(ScaleResult.noOp(decision.getReason().get()));
        }
    }

    /**
     * Provision a backend node, and record it in the inventory in the {@link NodeLifecycleState#Pending} state.
     *
     * @param policyId owning policy, or null for a node created outside of autoscaler control
     * @return the recorded node or {@link AutoScalerException} with {@link AutoScalerException.ErrorCode#ProvisioningError}
     */
    public Observable<ClusterNode> provisionNode(String clusterId, String policyId, String vmType, String zone) {
        return Observable.defer(() -> {
            Stopwatch stopwatch = Stopwatch.createStarted();
            long timeoutMs = configuration.getProvisionTimeoutMs();

            return gateway.provision(vmType, zone)
                    .take(1)
                    .switchIfEmpty(Observable.error(NodeLifecycleGatewayException.internalError("Backend returned no node id")))
                    .timeout(timeoutMs, TimeUnit.MILLISECONDS, scheduler)
                    .onErrorResumeNext(error -> {
                        Throwable cause = toGatewayError(error, "provision", timeoutMs);
                        logger.warn("Cannot provision node of type {} in zone {} for cluster {}: {}", vmType, zone, clusterId, cause.getMessage());
                        return Observable.error(AutoScalerException.provisioningError(clusterId, vmType, cause));
                    })
                    .flatMap(backendNodeId -> {
                        long now = clock.wallTime();
                        ClusterNode node = ClusterNode.newBuilder()
                                .withId(UUID.randomUUID().toString())
                                .withBackendNodeId(backendNodeId)
                                .withClusterId(clusterId)
                                .withPolicyId(policyId)
                                .withVmType(vmType)
                                .withZone(zone)
                                .withState(NodeLifecycleState.Pending)
                                .withCreatedAt(now)
                                .withStateTimestamp(now)
                                .build();
                        return nodeInventory.storeNode(node)
                                .doOnError(e -> logger.error("Backend node {} provisioned, but not recorded in the inventory", backendNodeId, e))
                                .andThen(Observable.just(node));
                    })
                    .doOnNext(node -> {
                        registry.timer(provisionLatencyId).record(stopwatch.elapsed(TimeUnit.MILLISECONDS), TimeUnit.MILLISECONDS);
                        logger.info("Provisioned node {} (backend id {}) in cluster {} for policy {} in {}ms",
                                node.getId(), node.getBackendNodeId(), clusterId, policyId, stopwatch.elapsed(TimeUnit.MILLISECONDS));
                    });
        });
    }

    /**
     * Drain and delete a node. A failed drain does not stop the removal. If the backend deletion fails, the node
     * stays in the inventory in the {@link NodeLifecycleState#Draining} state.
     *
     * @return {@link AutoScalerException} with {@link AutoScalerException.ErrorCode#DeletionError} if the backend deletion failed
     */
    public Completable removeNode(ClusterNode node) {
        return Completable.defer(() -> {
            Stopwatch stopwatch = Stopwatch.createStarted();
            String backendNodeId = node.getBackendNodeId();
            long drainTimeoutMs = configuration.getDrainTimeoutMs();
            long deleteTimeoutMs = configuration.getDeleteTimeoutMs();

            Completable markDraining = Completable.defer(() -> node.getState() == NodeLifecycleState.Draining
                    ? Completable.complete()
                    : nodeInventory.updateState(node.getId(), NodeLifecycleState.Draining, clock.wallTime())
            );
            Completable drain = gateway.drain(backendNodeId)
                    .timeout(drainTimeoutMs, TimeUnit.MILLISECONDS, scheduler)
                    .doOnError(error -> {
                        registry.counter(drainFailuresId).increment();
                        logger.warn("Drain of node {} (backend id {}) failed; deleting it anyway: {}",
                                node.getId(), backendNodeId, toGatewayError(error, "drain", drainTimeoutMs).getMessage());
                    })
                    .onErrorComplete();
            Completable delete = gateway.delete(backendNodeId)
                    .timeout(deleteTimeoutMs, TimeUnit.MILLISECONDS, scheduler)
                    .onErrorResumeNext(error -> {
                        Throwable cause = toGatewayError(error, "delete", deleteTimeoutMs);
                        logger.warn("Cannot delete node {} (backend id {}); leaving it in the draining state: {}",
                                node.getId(), backendNodeId, cause.getMessage());
                        return Completable.error(AutoScalerException.deletionError(node.getId(), cause));
                    });
            Completable forget = Completable.defer(() -> nodeInventory.updateState(node.getId(), NodeLifecycleState.Deleted, clock.wallTime()))
                    .andThen(Completable.defer(() -> nodeInventory.removeNode(node.getId())));

            return markDraining
                    .andThen(drain)
                    .andThen(delete)
                    .andThen(forget)
                    .doOnCompleted(() -> {
                        registry.timer(removeLatencyId).record(stopwatch.elapsed(TimeUnit.MILLISECONDS), TimeUnit.MILLISECONDS);
                        logger.info("Removed node {} (backend id {}) of cluster {} in {}ms",
                                node.getId(), backendNodeId, node.getClusterId(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
                    });
        });
    }

    private static Throwable toGatewayError(Throwable error, String operation, long timeoutMs) {
        if (error instanceof TimeoutException) {
            return NodeLifecycleGatewayException.timeout(operation, timeoutMs);
        }
        return error;
    }
}
