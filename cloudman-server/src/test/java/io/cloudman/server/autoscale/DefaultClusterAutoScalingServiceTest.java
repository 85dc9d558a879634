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
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import io.cloudman.api.cluster.model.AutoScalerPolicy;
import io.cloudman.api.cluster.model.ClusterNode;
import io.cloudman.api.cluster.model.NodeDiscrepancy;
import io.cloudman.api.cluster.model.ScaleSignal;
import io.cloudman.api.cluster.service.AutoScalerException;
import io.cloudman.api.cluster.service.NoOpReason;
import io.cloudman.api.cluster.service.ScaleAction;
import io.cloudman.api.cluster.service.ScaleResult;
import io.cloudman.common.runtime.CloudmanRuntime;
import io.cloudman.common.runtime.CloudmanRuntimes;
import io.cloudman.common.util.archaius2.Archaius2Ext;
import io.cloudman.server.cluster.store.InMemoryClusterStore;
import io.cloudman.server.cluster.store.InMemoryNodeInventory;
import io.cloudman.server.cluster.store.InMemoryPolicyStore;
import io.cloudman.testkit.connector.node.StubbedNodeLifecycleGateway;
import org.junit.Before;
import org.junit.Test;
import rx.Completable;
import rx.Observable;
import rx.Subscription;
import rx.observers.AssertableSubscriber;
import rx.schedulers.Schedulers;

import static io.cloudman.testkit.model.cluster.ClusterGenerator.DEFAULT_VM_TYPE;
import static io.cloudman.testkit.model.cluster.ClusterGenerator.POLICY_VM_TYPE;
import static io.cloudman.testkit.model.cluster.ClusterGenerator.cluster;
import static io.cloudman.testkit.model.cluster.ClusterGenerator.manualNode;
import static io.cloudman.testkit.model.cluster.ClusterGenerator.ownedNode;
import static io.cloudman.testkit.model.cluster.ClusterGenerator.policy;
import static org.assertj.core.api.Assertions.assertThat;

public class DefaultClusterAutoScalingServiceTest {

    private static final String CLUSTER_ID = "cluster1";

    private final CloudmanRuntime runtime = CloudmanRuntimes.test();

    private final InMemoryClusterStore clusterStore = new InMemoryClusterStore();
    private final InMemoryPolicyStore policyStore = new InMemoryPolicyStore();
    private final InMemoryNodeInventory nodeInventory = new InMemoryNodeInventory();
    private final StubbedNodeLifecycleGateway gateway = new StubbedNodeLifecycleGateway();

    private PolicyLocks policyLocks;
    private DefaultClusterAutoScalingService service;

    @Before
    public void setUp() {
        clusterStore.storeCluster(cluster(CLUSTER_ID)).await();
        createService(Archaius2Ext.newConfiguration(AutoScalerConfiguration.class,
                "cloudman.autoScaler.lockTimeoutMs", "5000"
        ));
    }

    @Test
    public void testScaleUpAndDownWithinPolicyBounds() {
        AutoScalerPolicy policy = storePolicy(policy(CLUSTER_ID, "default", null, 1, 2, 0));

        assertThat(signal(ScaleSignal.up(null)).getAction()).isEqualTo(ScaleAction.Create);
        assertThat(signal(ScaleSignal.up(null)).getAction()).isEqualTo(ScaleAction.Create);
        assertThat(signal(ScaleSignal.up(null)).getReason()).contains(NoOpReason.AtMax);
        assertThat(nodeInventory.countOwned(policy.getId())).isEqualTo(2);
        assertThat(gateway.getProvisionedVmTypes()).containsOnly(POLICY_VM_TYPE);

        assertThat(signal(ScaleSignal.down(null)).getAction()).isEqualTo(ScaleAction.Delete);
        assertThat(signal(ScaleSignal.down(null)).getReason()).contains(NoOpReason.AtMin);
        assertThat(signal(ScaleSignal.down(null)).getReason()).contains(NoOpReason.AtMin);
        assertThat(nodeInventory.countOwned(policy.getId())).isEqualTo(1);
        assertThat(gateway.getBackendNodes()).hasSize(1);
    }

    @Test
    public void testManualNodesAreLeftAlone() {
        AutoScalerPolicy policy = storePolicy(policy(CLUSTER_ID, "default", null, 0, 2, 0));
        ClusterNode manual = manualNode(CLUSTER_ID, 0);
        gateway.addBackendNode(manual.getBackendNodeId());
        nodeInventory.storeNode(manual).await();

        assertThat(signal(ScaleSignal.up(null)).getAction()).isEqualTo(ScaleAction.Create);
        assertThat(signal(ScaleSignal.up(null)).getAction()).isEqualTo(ScaleAction.Create);
        assertThat(signal(ScaleSignal.up(null)).getReason()).contains(NoOpReason.AtMax);
        assertThat(nodeInventory.listByCluster(CLUSTER_ID)).hasSize(3);

        assertThat(signal(ScaleSignal.down(null)).getAction()).isEqualTo(ScaleAction.Delete);
        assertThat(signal(ScaleSignal.down(null)).getAction()).isEqualTo(ScaleAction.Delete);
        assertThat(signal(ScaleSignal.down(null)).getReason()).contains(NoOpReason.AtMin);

        assertThat(nodeInventory.countOwned(policy.getId())).isZero();
        assertThat(nodeInventory.listByCluster(CLUSTER_ID)).containsExactly(manual);
        assertThat(gateway.getBackendNodes()).containsExactly(manual.getBackendNodeId());
    }

    @Test
    public void testZoneSignalsScaleOwnPolicies() {
        AutoScalerPolicy defaultPolicy = storePolicy(policy(CLUSTER_ID, "default", null, 0, 5, 0));
        AutoScalerPolicy zonePolicy = storePolicy(policy(CLUSTER_ID, "zone1c", "us-east-1c", 0, 5, 1));

        signal(ScaleSignal.up("us-east-1c"));
        signal(ScaleSignal.up("us-east-1c"));
        signal(ScaleSignal.up(null));
        signal(ScaleSignal.up("us-east-1d"));

        assertThat(nodeInventory.countOwned(zonePolicy.getId())).isEqualTo(2);
        assertThat(nodeInventory.countOwned(defaultPolicy.getId())).isEqualTo(2);
        assertThat(nodeInventory.listOwned(zonePolicy.getId())).allMatch(node -> node.getZone().equals(Optional.of("us-east-1c")));

        signal(ScaleSignal.down("us-east-1c"));

        assertThat(nodeInventory.countOwned(zonePolicy.getId())).isEqualTo(1);
        assertThat(nodeInventory.countOwned(defaultPolicy.getId())).isEqualTo(2);
    }

    @Test
    public void testOwnedNodeCountStaysWithinBounds() {
        AutoScalerPolicy policy = storePolicy(policy(CLUSTER_ID, "default", null, 1, 4, 0));
        Random random = new Random(42);

        int previous = 0;
        for (int i = 0; i < 50; i++) {
            signal(random.nextBoolean() ? ScaleSignal.up(null) : ScaleSignal.down(null));
            int owned = nodeInventory.countOwned(policy.getId());
            assertThat(owned).isLessThanOrEqualTo(4);
            if (previous >= 1) {
                assertThat(owned).isGreaterThanOrEqualTo(1);
            }
            assertThat(Math.abs(owned - previous)).isLessThanOrEqualTo(1);
            previous = owned;
        }
    }

    @Test
    public void testRepeatedScaleUpAtMaxIsIdempotent() {
        storePolicy(policy(CLUSTER_ID, "default", null, 0, 1, 0));
        signal(ScaleSignal.up(null));

        for (int i = 0; i < 3; i++) {
            ScaleResult result = signal(ScaleSignal.up(null));
            assertThat(result.isApplied()).isFalse();
            assertThat(result.getReason()).contains(NoOpReason.AtMax);
            assertThat(result.getHttpStatusHint()).isEqualTo(200);
        }
        assertThat(gateway.getProvisionedVmTypes()).hasSize(1);
    }

    @Test
    public void testConcurrentSignalsDoNotExceedMax() {
        AutoScalerPolicy policy = storePolicy(policy(CLUSTER_ID, "default", null, 0, 3, 0));
        createService(Archaius2Ext.newConfiguration(AutoScalerConfiguration.class), Schedulers.io());

        List<Observable<ScaleResult>> signals = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            signals.add(service.decideAndExecute(CLUSTER_ID, ScaleSignal.up(null)));
        }
        List<ScaleResult> results = Observable.merge(signals).toList().toBlocking().first();

        assertThat(results).filteredOn(result -> result.getAction() == ScaleAction.Create).hasSize(3);
        assertThat(results).filteredOn(result -> result.getReason().equals(Optional.of(NoOpReason.AtMax))).hasSize(7);
        assertThat(nodeInventory.countOwned(policy.getId())).isEqualTo(3);
    }

    @Test
    public void testConcurrentUpAndDownSignalsStayWithinBounds() {
        AutoScalerPolicy policy = storePolicy(policy(CLUSTER_ID, "default", null, 1, 3, 0));
        for (int i = 0; i < 2; i++) {
            ClusterNode node = ownedNode(policy, i);
            gateway.addBackendNode(node.getBackendNodeId());
            nodeInventory.storeNode(node).await();
        }
        createService(Archaius2Ext.newConfiguration(AutoScalerConfiguration.class), Schedulers.io());

        List<Observable<ScaleResult>> signals = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            signals.add(service.decideAndExecute(CLUSTER_ID, ScaleSignal.up(null)));
            signals.add(service.decideAndExecute(CLUSTER_ID, ScaleSignal.down(null)));
        }
        List<ScaleResult> results = Observable.merge(signals).toList().toBlocking().first();

        long created = results.stream().filter(result -> result.isApplied() && result.getAction() == ScaleAction.Create).count();
        long deleted = results.stream().filter(result -> result.isApplied() && result.getAction() == ScaleAction.Delete).count();
        int owned = nodeInventory.countOwned(policy.getId());

        assertThat(results).hasSize(20);
        assertThat(owned).isBetween(1, 3);
        assertThat(created - deleted).isEqualTo(owned - 2);
        assertThat(gateway.getBackendNodes()).hasSize(owned);
    }

    @Test
    public void testLockTimeout() throws Exception {
        AutoScalerPolicy policy = storePolicy(policy(CLUSTER_ID, "default", null, 0, 3, 0));
        createService(Archaius2Ext.newConfiguration(AutoScalerConfiguration.class,
                "cloudman.autoScaler.lockTimeoutMs", "100"
        ));
        gateway.hangProvisioning(true);

        Subscription pending = service.decideAndExecute(CLUSTER_ID, ScaleSignal.up(null))
                .subscribeOn(Schedulers.io())
                .subscribe(result -> {
                }, error -> {
                });
        awaitLocked(policy);

        AssertableSubscriber<ScaleResult> subscriber = service.decideAndExecute(CLUSTER_ID, ScaleSignal.up(null)).test();
        subscriber.assertError(AutoScalerException.class);
        assertThat(AutoScalerException.isThis(subscriber.getOnErrorEvents().get(0), AutoScalerException.ErrorCode.LockTimeout)).isTrue();

        pending.unsubscribe();
        assertThat(policyLocks.isLocked(CLUSTER_ID, policy.getId())).isFalse();
    }

    @Test
    public void testImplicitDefaultPolicy() {
        createService(Archaius2Ext.newConfiguration(AutoScalerConfiguration.class,
                "cloudman.autoScaler.implicitDefaultPolicyEnabled", "true",
                "cloudman.autoScaler.implicitDefaultPolicyMaxNodes", "2"
        ));

        assertThat(signal(ScaleSignal.up(null)).getAction()).isEqualTo(ScaleAction.Create);

        List<AutoScalerPolicy> policies = policyStore.listByCluster(CLUSTER_ID, Optional.empty());
        assertThat(policies).hasSize(1);
        AutoScalerPolicy policy = policies.get(0);
        assertThat(policy.getName()).isEqualTo(DefaultClusterAutoScalingService.IMPLICIT_DEFAULT_POLICY_NAME);
        assertThat(policy.getVmType()).isEqualTo(DEFAULT_VM_TYPE);
        assertThat(policy.getZone()).isEmpty();
        assertThat(policy.getMinNodes()).isZero();
        assertThat(policy.getMaxNodes()).isEqualTo(2);

        signal(ScaleSignal.up(null));
        assertThat(signal(ScaleSignal.up(null)).getReason()).contains(NoOpReason.AtMax);
        assertThat(policyStore.listByCluster(CLUSTER_ID, Optional.empty())).hasSize(1);
    }

    @Test
    public void testImplicitDefaultPolicyCreationIsPerCluster() throws Exception {
        clusterStore.storeCluster(cluster("cluster2")).await();
        CountDownLatch storeStarted = new CountDownLatch(1);
        CountDownLatch storeReleased = new CountDownLatch(1);
        InMemoryPolicyStore slowPolicyStore = new InMemoryPolicyStore() {
            @Override
            public Completable storePolicy(AutoScalerPolicy policy) {
                if (!policy.getClusterId().equals(CLUSTER_ID)) {
                    return super.storePolicy(policy);
                }
                return Completable.defer(() -> {
                    storeStarted.countDown();
                    try {
                        storeReleased.await();
                    } catch (InterruptedException e) {
                        return Completable.error(e);
                    }
                    return super.storePolicy(policy);
                });
            }
        };
        AutoScalerConfiguration configuration = Archaius2Ext.newConfiguration(AutoScalerConfiguration.class,
                "cloudman.autoScaler.implicitDefaultPolicyEnabled", "true"
        );
        ScaleExecutor executor = new ScaleExecutor(runtime, configuration, gateway, nodeInventory);
        DefaultClusterAutoScalingService slowService = new DefaultClusterAutoScalingService(runtime, configuration, clusterStore,
                slowPolicyStore, nodeInventory, new ScaleDecisionEngine(configuration), executor,
                new NodeInventoryAuditor(runtime, configuration, gateway, nodeInventory), new PolicyLocks(configuration), Schedulers.io());

        AssertableSubscriber<ScaleResult> first = slowService.decideAndExecute(CLUSTER_ID, ScaleSignal.up(null)).test();
        AssertableSubscriber<ScaleResult> second = slowService.decideAndExecute(CLUSTER_ID, ScaleSignal.up(null)).test();
        assertThat(storeStarted.await(5, TimeUnit.SECONDS)).isTrue();

        // Another cluster is not held up by the pending policy creation
        ScaleResult otherCluster = slowService.decideAndExecute("cluster2", ScaleSignal.up(null)).timeout(5, TimeUnit.SECONDS).toBlocking().first();
        assertThat(otherCluster.getAction()).isEqualTo(ScaleAction.Create);

        storeReleased.countDown();
        first.awaitTerminalEvent(5, TimeUnit.SECONDS);
        second.awaitTerminalEvent(5, TimeUnit.SECONDS);
        first.assertNoErrors();
        second.assertNoErrors();

        assertThat(slowPolicyStore.listByCluster(CLUSTER_ID, Optional.empty())).hasSize(1);
        assertThat(slowPolicyStore.listByCluster("cluster2", Optional.empty())).hasSize(1);
    }

    @Test
    public void testNoPolicyWithoutImplicitDefault() {
        ScaleResult result = signal(ScaleSignal.up(null));

        assertThat(result.getReason()).contains(NoOpReason.NoMatchingPolicy);
        assertThat(policyStore.listByCluster(CLUSTER_ID, Optional.empty())).isEmpty();
    }

    @Test
    public void testUnknownCluster() {
        AssertableSubscriber<ScaleResult> subscriber = service.decideAndExecute("unknown", ScaleSignal.up(null)).test();

        subscriber.assertError(AutoScalerException.class);
        assertThat(AutoScalerException.isThis(subscriber.getOnErrorEvents().get(0), AutoScalerException.ErrorCode.ClusterNotFound)).isTrue();
    }

    @Test
    public void testAutoScalingDisabledForCluster() {
        storePolicy(policy(CLUSTER_ID, "default", null, 0, 3, 0));

        service.updateAutoScalingEnabled(CLUSTER_ID, false).await();
        assertThat(signal(ScaleSignal.up(null)).getReason()).contains(NoOpReason.AutoScalingDisabled);

        service.updateAutoScalingEnabled(CLUSTER_ID, true).await();
        assertThat(signal(ScaleSignal.up(null)).getAction()).isEqualTo(ScaleAction.Create);
    }

    @Test
    public void testProvisioningFailureIsReported() {
        storePolicy(policy(CLUSTER_ID, "default", null, 0, 3, 0));
        gateway.failProvisioning(new RuntimeException("simulated error"));

        AssertableSubscriber<ScaleResult> subscriber = service.decideAndExecute(CLUSTER_ID, ScaleSignal.up(null)).test();

        subscriber.assertError(AutoScalerException.class);
        assertThat(nodeInventory.getNodes()).isEmpty();
        assertThat(runtime.getRegistry().counter(runtime.getRegistry().createId("cloudman.autoScaler.errors")
                .withTag("direction", "Up")
                .withTag("errorCode", "ProvisioningError")
        ).count()).isEqualTo(1);
    }

    @Test
    public void testAuditReportsUntrackedBackendNodes() {
        gateway.addBackendNode("backend-unknown");

        List<NodeDiscrepancy> discrepancies = service.audit().toBlocking().first();

        assertThat(discrepancies).containsExactly(NodeDiscrepancy.untracked("backend-unknown"));
    }

    private void createService(AutoScalerConfiguration configuration) {
        createService(configuration, Schedulers.immediate());
    }

    private void createService(AutoScalerConfiguration configuration, rx.Scheduler scheduler) {
        this.policyLocks = new PolicyLocks(configuration);
        ScaleExecutor executor = new ScaleExecutor(runtime, configuration, gateway, nodeInventory);
        NodeInventoryAuditor auditor = new NodeInventoryAuditor(runtime, configuration, gateway, nodeInventory);
        this.service = new DefaultClusterAutoScalingService(runtime, configuration, clusterStore, policyStore, nodeInventory,
                new ScaleDecisionEngine(configuration), executor, auditor, policyLocks, scheduler);
    }

    private AutoScalerPolicy storePolicy(AutoScalerPolicy policy) {
        policyStore.storePolicy(policy).await();
        return policy;
    }

    private ScaleResult signal(ScaleSignal signal) {
        return service.decideAndExecute(CLUSTER_ID, signal).toBlocking().first();
    }

    private void awaitLocked(AutoScalerPolicy policy) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!policyLocks.isLocked(CLUSTER_ID, policy.getId())) {
            assertThat(System.currentTimeMillis()).isLessThan(deadline);
            Thread.sleep(10);
        }
    }
}
