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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.PreDestroy;

import com.google.common.annotations.VisibleForTesting;
import io.cloudman.api.cluster.model.ClusterNode;
import io.cloudman.api.cluster.model.NodeDiscrepancy;
import io.cloudman.api.cluster.model.NodeLifecycleState;
import io.cloudman.api.cluster.store.NodeInventory;
import io.cloudman.api.connector.node.NodeLifecycleGateway;
import io.cloudman.api.connector.node.NodeLifecycleGatewayException;
import io.cloudman.common.runtime.CloudmanRuntime;
import io.cloudman.common.util.time.Clock;
import io.cloudman.server.MetricConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rx.Observable;
import rx.Scheduler;
import rx.Subscription;
import rx.schedulers.Schedulers;

/**
 * Compares the nodes known to the backend with the local inventory. The audit only reports differences, and
 * never changes the inventory or the backend.
 */
public class NodeInventoryAuditor {

    private static final Logger logger = LoggerFactory.getLogger(NodeInventoryAuditor.class);

    private static final String METRIC_ROOT = MetricConstants.METRIC_AUTO_SCALER + "audit.";

    private final AutoScalerConfiguration configuration;
    private final NodeLifecycleGateway gateway;
    private final NodeInventory nodeInventory;
    private final CloudmanRuntime runtime;
    private final Clock clock;
    private final Scheduler scheduler;

    private Subscription auditSubscription;

    public NodeInventoryAuditor(CloudmanRuntime runtime,
                                AutoScalerConfiguration configuration,
                                NodeLifecycleGateway gateway,
                                NodeInventory nodeInventory) {
        this(runtime, configuration, gateway, nodeInventory, Schedulers.computation());
    }

    @VisibleForTesting
    NodeInventoryAuditor(CloudmanRuntime runtime,
                         AutoScalerConfiguration configuration,
                         NodeLifecycleGateway gateway,
                         NodeInventory nodeInventory,
                         Scheduler scheduler) {
        this.runtime = runtime;
        this.configuration = configuration;
        this.gateway = gateway;
        this.nodeInventory = nodeInventory;
        this.clock = runtime.getClock();
        this.scheduler = scheduler;
    }

    /**
     * Start periodic audits, if enabled by {@link AutoScalerConfiguration#getAuditIntervalMs()}.
     */
    public void enterActiveMode() {
        long intervalMs = configuration.getAuditIntervalMs();
        if (intervalMs <= 0) {
            logger.info("Periodic node inventory audit disabled");
            return;
        }
        this.auditSubscription = Observable.interval(intervalMs, intervalMs, TimeUnit.MILLISECONDS, scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> audit().onErrorResumeNext(error -> {
                    logger.warn("Node inventory audit failed: {}", error.getMessage());
                    return Observable.empty();
                }))
                .subscribe(
                        discrepancies -> {
                        },
                        error -> logger.error("Periodic node inventory audit terminated", error)
                );
    }

    @PreDestroy
    public void shutdown() {
        if (auditSubscription != null) {
            auditSubscription.unsubscribe();
        }
    }

    public Observable<List<NodeDiscrepancy>> audit() {
        long timeoutMs = configuration.getListNodesTimeoutMs();
        return gateway.listNodes()
                .take(1)
                .timeout(timeoutMs, TimeUnit.MILLISECONDS, scheduler)
                .onErrorResumeNext(error -> Observable.error(error instanceof TimeoutException
                        ? NodeLifecycleGatewayException.timeout("listNodes", timeoutMs)
                        : error
                ))
                .map(backendNodeIds -> compare(backendNodeIds, nodeInventory.getNodes()))
                .doOnNext(this::report);
    }

    @VisibleForTesting
    List<NodeDiscrepancy> compare(List<String> backendNodeIds, List<ClusterNode> nodes) {
        Set<String> backend = new HashSet<>(backendNodeIds);
        Set<String> local = new HashSet<>();
        List<NodeDiscrepancy> discrepancies = new ArrayList<>();

        for (ClusterNode node : nodes) {
            local.add(node.getBackendNodeId());
            NodeLifecycleState state = node.getState();
            if (state == NodeLifecycleState.Draining) {
                if (clock.isElapsed(node.getStateTimestamp(), configuration.getDrainingStuckThresholdMs())) {
                    discrepancies.add(NodeDiscrepancy.stuckDraining(node));
                }
            } else if ((state == NodeLifecycleState.Pending || state == NodeLifecycleState.Active) && !backend.contains(node.getBackendNodeId())) {
                discrepancies.add(NodeDiscrepancy.missing(node));
            }
        }
        for (String backendNodeId : backendNodeIds) {
            if (!local.contains(backendNodeId)) {
                discrepancies.add(NodeDiscrepancy.untracked(backendNodeId));
            }
        }
        return discrepancies;
    }

    private void report(List<NodeDiscrepancy> discrepancies) {
        runtime.getRegistry().gauge(METRIC_ROOT + "discrepancies").set(discrepancies.size());
        if (discrepancies.isEmpty()) {
            logger.debug("Node inventory in sync with the backend");
        } else {
            logger.warn("Found {} node inventory discrepancies: {}", discrepancies.size(), discrepancies);
        }
    }
}
