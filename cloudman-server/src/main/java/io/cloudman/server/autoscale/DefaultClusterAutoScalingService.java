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

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.spectator.api.Registry;
import io.cloudman.api.cluster.model.AutoScalerPolicy;
import io.cloudman.api.cluster.model.Cluster;
import io.cloudman.api.cluster.model.NodeDiscrepancy;
import io.cloudman.api.cluster.model.ScaleSignal;
import io.cloudman.api.cluster.service.AutoScalerException;
import io.cloudman.api.cluster.service.ClusterAutoScalingService;
import io.cloudman.api.cluster.service.ScaleResult;
import io.cloudman.api.cluster.store.ClusterStore;
import io.cloudman.api.cluster.store.NodeInventory;
import io.cloudman.api.cluster.store.PolicyStore;
import io.cloudman.common.runtime.CloudmanRuntime;
import io.cloudman.common.util.concurrency.KeyedLocks;
import io.cloudman.server.MetricConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rx.Completable;
import rx.Observable;
import rx.Scheduler;
import rx.schedulers.Schedulers;

/**
 * Processes scale signals. A signal is first evaluated on a snapshot of the cluster to resolve the policy it
 * applies to. It is then evaluated again, on a fresh snapshot, while holding the lock of that policy, and the
 * resulting decision is executed before the lock is released.
 */
@Singleton
public class DefaultClusterAutoScalingService implements ClusterAutoScalingService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultClusterAutoScalingService.class);

    static final String IMPLICIT_DEFAULT_POLICY_NAME = "default";

    private static final String METRIC_ROOT = MetricConstants.METRIC_AUTO_SCALER;

    private final CloudmanRuntime runtime;
    private final AutoScalerConfiguration configuration;
    private final ClusterStore clusterStore;
    private final PolicyStore policyStore;
    private final NodeInventory nodeInventory;
    private final ScaleDecisionEngine decisionEngine;
    private final ScaleExecutor executor;
    private final NodeInventoryAuditor auditor;
    private final PolicyLocks policyLocks;
    private final Scheduler scheduler;

    private final Registry registry;
    private final KeyedLocks<String> implicitPolicyLocks = new KeyedLocks<>();

    @Inject
    public DefaultClusterAutoScalingService(CloudmanRuntime runtime,
                                            AutoScalerConfiguration configuration,
                                            ClusterStore clusterStore,
                                            PolicyStore policyStore,
                                            NodeInventory nodeInventory,
                                            ScaleDecisionEngine decisionEngine,
                                            ScaleExecutor executor,
                                            NodeInventoryAuditor auditor,
                                            PolicyLocks policyLocks) {
        this(runtime, configuration, clusterStore, policyStore, nodeInventory, decisionEngine, executor, auditor, policyLocks, Schedulers.io());
    }

    @VisibleForTesting
    DefaultClusterAutoScalingService(CloudmanRuntime runtime,
                                     AutoScalerConfiguration configuration,
                                     ClusterStore clusterStore,
                                     PolicyStore policyStore,
                                     NodeInventory nodeInventory,
                                     ScaleDecisionEngine decisionEngine,
                                     ScaleExecutor executor,
                                     NodeInventoryAuditor auditor,
                                     PolicyLocks policyLocks,
                                     Scheduler scheduler) {
        this.runtime = runtime;
        this.configuration = configuration;
        this.clusterStore = clusterStore;
        this.policyStore = policyStore;
        this.nodeInventory = nodeInventory;
        this.decisionEngine = decisionEngine;
        this.executor = executor;
        this.auditor = auditor;
        this.policyLocks = policyLocks;
        this.scheduler = scheduler;
        this.registry = runtime.getRegistry();
    }

    @Override
    public Observable<ScaleResult> decideAndExecute(String clusterId, ScaleSignal signal) {
        return Observable.defer(() -> {
            Cluster cluster = findCluster(clusterId);
            ensureImplicitDefaultPolicy(cluster);

            ScaleDecision preliminary = decisionEngine.decide(snapshotOf(cluster), signal);
            if (!preliminary.getPolicy().isPresent()) {
                logger.info("Scale signal {} for cluster {} ignored: {}", signal, clusterId, preliminary.getReason().orElse(null));
                return executor.execute(preliminary);
            }
            String policyId = preliminary.getPolicy().get().getId();
            return policyLocks.withLock(clusterId, policyId, () -> {
                ScaleDecision decision = decisionEngine.decide(snapshotOf(findCluster(clusterId)), signal);
                Optional<AutoScalerPolicy> resolved = decision.getPolicy();
                if (resolved.isPresent() && !resolved.get().getId().equals(policyId)) {
                    return Observable.<ScaleResult>error(AutoScalerException.policyChanged(clusterId, policyId, resolved.get().getId()));
                }
                logger.info("Scale signal {} for cluster {}: {}", signal, clusterId, decision);
                return executor.execute(decision);
            });
        }).doOnNext(result -> recordResult(signal, result)
        ).doOnError(error -> recordError(clusterId, signal, error)
        ).subscribeOn(scheduler);
    }

    @Override
    public Completable updateAutoScalingEnabled(String clusterId, boolean enabled) {
        return Completable.defer(() -> {
            Cluster cluster = findCluster(clusterId);
            logger.info("Changing autoscaling of cluster {} to enabled={}", clusterId, enabled);
            return clusterStore.storeCluster(cluster.toBuilder().withAutoScalingEnabled(enabled).build());
        });
    }

    @Override
    public Observable<List<NodeDiscrepancy>> audit() {
        return auditor.audit();
    }

    private Cluster findCluster(String clusterId) {
        return clusterStore.findCluster(clusterId).orElseThrow(() -> AutoScalerException.clusterNotFound(clusterId));
    }

    private ClusterSnapshot snapshotOf(Cluster cluster) {
        return ClusterSnapshot.of(
                cluster,
                policyStore.listByCluster(cluster.getId(), Optional.empty()),
                nodeInventory.listByCluster(cluster.getId())
        );
    }

    private void ensureImplicitDefaultPolicy(Cluster cluster) {
        if (!configuration.isImplicitDefaultPolicyEnabled() || hasPolicies(cluster)) {
            return;
        }
        long timeoutMs = configuration.getLockTimeoutMs();
        KeyedLocks<String>.LockHandle lock = implicitPolicyLocks.tryAcquire(cluster.getId(), timeoutMs, TimeUnit.MILLISECONDS)
                .orElseThrow(() -> AutoScalerException.lockTimeout(cluster.getId(), IMPLICIT_DEFAULT_POLICY_NAME, timeoutMs));
        try {
            if (hasPolicies(cluster)) {
                return;
            }
            AutoScalerPolicy policy = AutoScalerPolicy.newBuilder()
                    .withId(UUID.randomUUID().toString())
                    .withClusterId(cluster.getId())
                    .withName(IMPLICIT_DEFAULT_POLICY_NAME)
                    .withVmType(cluster.getDefaultVmType())
                    .withMinNodes(0)
                    .withMaxNodes(configuration.getImplicitDefaultPolicyMaxNodes())
                    .withCreatedAt(runtime.getClock().wallTime())
                    .build();
            policyStore.storePolicy(policy).await();
            logger.info("Created default autoscaler policy for cluster {}: {}", cluster.getId(), policy);
        } finally {
            lock.release();
        }
    }

    private boolean hasPolicies(Cluster cluster) {
        return !policyStore.listByCluster(cluster.getId(), Optional.empty()).isEmpty();
    }

    private void recordResult(ScaleSignal signal, ScaleResult result) {
        registry.counter(registry.createId(METRIC_ROOT + "signals")
                .withTag("direction", signal.getDirection().name())
                .withTag("action", result.getAction().name())
                .withTag("reason", result.getReason().map(Enum::name).orElse("none"))
        ).increment();
    }

    private void recordError(String clusterId, ScaleSignal signal, Throwable error) {
        String errorCode = error instanceof AutoScalerException
                ? ((AutoScalerException) error).getErrorCode().name()
                : error.getClass().getSimpleName();
        registry.counter(registry.createId(METRIC_ROOT + "errors")
                .withTag("direction", signal.getDirection().name())
                .withTag("errorCode", errorCode)
        ).increment();
        logger.warn("Scale signal {} for cluster {} failed: {}", signal, clusterId, error.getMessage());
    }
}
