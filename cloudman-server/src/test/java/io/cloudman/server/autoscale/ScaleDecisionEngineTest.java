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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.cloudman.api.cluster.model.AutoScalerPolicy;
import io.cloudman.api.cluster.model.Cluster;
import io.cloudman.api.cluster.model.ClusterNode;
import io.cloudman.api.cluster.model.NodeLifecycleState;
import io.cloudman.api.cluster.model.ScaleSignal;
import io.cloudman.api.cluster.service.NoOpReason;
import io.cloudman.api.cluster.service.ScaleAction;
import org.junit.Before;
import org.junit.Test;

import static io.cloudman.testkit.model.cluster.ClusterGenerator.cluster;
import static io.cloudman.testkit.model.cluster.ClusterGenerator.manualNode;
import static io.cloudman.testkit.model.cluster.ClusterGenerator.ownedNode;
import static io.cloudman.testkit.model.cluster.ClusterGenerator.policy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ScaleDecisionEngineTest {

    private static final String CLUSTER_ID = "cluster1";

    private final AutoScalerConfiguration configuration = mock(AutoScalerConfiguration.class);

    private final ScaleDecisionEngine engine = new ScaleDecisionEngine(configuration);

    private final Cluster cluster = cluster(CLUSTER_ID);

    private final AutoScalerPolicy defaultPolicy = policy(CLUSTER_ID, "default", null, 0, 3, 1_000);
    private final AutoScalerPolicy zonePolicy = policy(CLUSTER_ID, "zone1c", "us-east-1c", 0, 3, 2_000);

    @Before
    public void setUp() {
        when(configuration.isAutoScalingEnabled()).thenReturn(true);
    }

    @Test
    public void testSignalWithoutZoneResolvesToDefaultPolicy() {
        ScaleDecision decision = engine.decide(snapshot(Arrays.asList(defaultPolicy, zonePolicy)), ScaleSignal.up(null));

        assertThat(decision.getAction()).isEqualTo(ScaleAction.Create);
        assertThat(decision.getPolicy()).contains(defaultPolicy);
        assertThat(decision.getMatch().getKind()).isEqualTo(PolicyMatch.Kind.DefaultZone);
    }

    @Test
    public void testSignalWithPolicyZoneResolvesToZonePolicy() {
        ScaleDecision decision = engine.decide(snapshot(Arrays.asList(defaultPolicy, zonePolicy)), ScaleSignal.up("us-east-1c"));

        assertThat(decision.getPolicy()).contains(zonePolicy);
        assertThat(decision.getMatch().getKind()).isEqualTo(PolicyMatch.Kind.ExactZone);
    }

    @Test
    public void testSignalWithUnknownZoneFallsBackToDefaultPolicy() {
        ScaleDecision decision = engine.decide(snapshot(Arrays.asList(defaultPolicy, zonePolicy)), ScaleSignal.up("us-east-1d"));

        assertThat(decision.getPolicy()).contains(defaultPolicy);
        assertThat(decision.getMatch().getKind()).isEqualTo(PolicyMatch.Kind.DefaultZone);
    }

    @Test
    public void testNoMatchingPolicy() {
        ScaleDecision decision = engine.decide(snapshot(Collections.singletonList(zonePolicy)), ScaleSignal.up("us-east-1d"));

        assertThat(decision.getAction()).isEqualTo(ScaleAction.None);
        assertThat(decision.getReason()).contains(NoOpReason.NoMatchingPolicy);
        assertThat(decision.getPolicy()).isEmpty();
    }

    @Test
    public void testOldestPolicyWinsAmongDuplicates() {
        AutoScalerPolicy newer = policy(CLUSTER_ID, "newer", null, 0, 3, 5_000);
        AutoScalerPolicy older = policy(CLUSTER_ID, "older", null, 0, 3, 500);

        ScaleDecision decision = engine.decide(snapshot(Arrays.asList(newer, older)), ScaleSignal.up(null));

        assertThat(decision.getPolicy()).contains(older);
    }

    @Test
    public void testScaleUpAtMaxIsNoOp() {
        List<ClusterNode> nodes = Arrays.asList(
                ownedNode(defaultPolicy, 1), ownedNode(defaultPolicy, 2), ownedNode(defaultPolicy, 3)
        );

        ScaleDecision decision = engine.decide(snapshot(Collections.singletonList(defaultPolicy), nodes), ScaleSignal.up(null));

        assertThat(decision.getReason()).contains(NoOpReason.AtMax);
        assertThat(decision.getOwnedNodes()).isEqualTo(3);
    }

    @Test
    public void testScaleDownAtMinIsNoOp() {
        AutoScalerPolicy minOne = policy(CLUSTER_ID, "minOne", null, 1, 3, 1_000);

        ScaleDecision decision = engine.decide(
                snapshot(Collections.singletonList(minOne), Collections.singletonList(ownedNode(minOne, 1))),
                ScaleSignal.down(null)
        );

        assertThat(decision.getReason()).contains(NoOpReason.AtMin);
    }

    @Test
    public void testScaleDownRemovesNewestNode() {
        ClusterNode oldest = ownedNode(defaultPolicy, 100);
        ClusterNode newest = ownedNode(defaultPolicy, 300);
        ClusterNode middle = ownedNode(defaultPolicy, 200);

        ScaleDecision decision = engine.decide(
                snapshot(Collections.singletonList(defaultPolicy), Arrays.asList(oldest, newest, middle)),
                ScaleSignal.down(null)
        );

        assertThat(decision.getAction()).isEqualTo(ScaleAction.Delete);
        assertThat(decision.getNode()).contains(newest);
    }

    @Test
    public void testScaleDownTieBreaksOnGreatestId() {
        ClusterNode first = ownedNode(defaultPolicy, 100).toBuilder().withId("node-a").build();
        ClusterNode second = ownedNode(defaultPolicy, 100).toBuilder().withId("node-b").build();

        ScaleDecision decision = engine.decide(
                snapshot(Collections.singletonList(defaultPolicy), Arrays.asList(first, second)),
                ScaleSignal.down(null)
        );

        assertThat(decision.getNode()).contains(second);
    }

    @Test
    public void testScaleDownSkipsNodesBeingDeleted() {
        ClusterNode older = ownedNode(defaultPolicy, 100);
        ClusterNode deleting = ownedNode(defaultPolicy, 200).toBuilder().withState(NodeLifecycleState.Deleting).build();

        ScaleDecision decision = engine.decide(
                snapshot(Collections.singletonList(defaultPolicy), Arrays.asList(older, deleting)),
                ScaleSignal.down(null)
        );

        assertThat(decision.getNode()).contains(older);
    }

    @Test
    public void testScaleDownWithOnlyNodesBeingDeleted() {
        ClusterNode deleting = ownedNode(defaultPolicy, 200).toBuilder().withState(NodeLifecycleState.Deleting).build();

        ScaleDecision decision = engine.decide(
                snapshot(Collections.singletonList(defaultPolicy), Collections.singletonList(deleting)),
                ScaleSignal.down(null)
        );

        assertThat(decision.getReason()).contains(NoOpReason.NoRemovableNode);
    }

    @Test
    public void testManualNodesAreNeitherCountedNorRemoved() {
        AutoScalerPolicy maxOne = policy(CLUSTER_ID, "maxOne", null, 0, 1, 1_000);
        List<ClusterNode> nodes = Arrays.asList(manualNode(CLUSTER_ID, 100), manualNode(CLUSTER_ID, 200));

        ScaleDecision up = engine.decide(snapshot(Collections.singletonList(maxOne), nodes), ScaleSignal.up(null));
        assertThat(up.getAction()).isEqualTo(ScaleAction.Create);
        assertThat(up.getOwnedNodes()).isZero();

        ScaleDecision down = engine.decide(snapshot(Collections.singletonList(maxOne), nodes), ScaleSignal.down(null));
        assertThat(down.getReason()).contains(NoOpReason.AtMin);
    }

    @Test
    public void testNodesOfOtherPoliciesAreNotCounted() {
        AutoScalerPolicy maxOne = policy(CLUSTER_ID, "maxOne", null, 0, 1, 1_000);
        List<ClusterNode> nodes = Collections.singletonList(ownedNode(zonePolicy, 100));

        ScaleDecision decision = engine.decide(snapshot(Arrays.asList(maxOne, zonePolicy), nodes), ScaleSignal.up(null));

        assertThat(decision.getAction()).isEqualTo(ScaleAction.Create);
        assertThat(decision.getPolicy()).contains(maxOne);
    }

    @Test
    public void testClusterAutoScalingDisabled() {
        Cluster disabled = cluster.toBuilder().withAutoScalingEnabled(false).build();

        ScaleDecision decision = engine.decide(
                ClusterSnapshot.of(disabled, Collections.singletonList(defaultPolicy), Collections.emptyList()),
                ScaleSignal.up(null)
        );

        assertThat(decision.getReason()).contains(NoOpReason.AutoScalingDisabled);
    }

    @Test
    public void testGlobalAutoScalingDisabled() {
        when(configuration.isAutoScalingEnabled()).thenReturn(false);

        ScaleDecision decision = engine.decide(snapshot(Collections.singletonList(defaultPolicy)), ScaleSignal.up(null));

        assertThat(decision.getReason()).contains(NoOpReason.AutoScalingDisabled);
    }

    @Test
    public void testDecisionsAreRepeatable() {
        List<ClusterNode> nodes = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            nodes.add(ownedNode(defaultPolicy, i));
        }
        ClusterSnapshot snapshot = snapshot(Arrays.asList(defaultPolicy, zonePolicy), nodes);

        ScaleDecision first = engine.decide(snapshot, ScaleSignal.down(null));
        ScaleDecision second = engine.decide(snapshot, ScaleSignal.down(null));

        assertThat(first.getNode()).isEqualTo(second.getNode());
        assertThat(first.getAction()).isEqualTo(second.getAction());
    }

    private ClusterSnapshot snapshot(List<AutoScalerPolicy> policies) {
        return snapshot(policies, Collections.emptyList());
    }

    private ClusterSnapshot snapshot(List<AutoScalerPolicy> policies, List<ClusterNode> nodes) {
        return ClusterSnapshot.of(cluster, policies, nodes);
    }
}
