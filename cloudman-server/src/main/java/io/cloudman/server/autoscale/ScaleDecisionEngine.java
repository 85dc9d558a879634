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
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.cloudman.api.cluster.model.AutoScalerPolicy;
import io.cloudman.api.cluster.model.ClusterNode;
import io.cloudman.api.cluster.model.ScaleSignal;
import io.cloudman.api.cluster.service.NoOpReason;

/**
 * Evaluates a scale signal against a cluster snapshot. Decisions depend only on the snapshot, the signal and
 * the global autoscaling switch, and the engine has no side effects.
 */
@Singleton
public class ScaleDecisionEngine {

    private final AutoScalerConfiguration configuration;

    @Inject
    public ScaleDecisionEngine(AutoScalerConfiguration configuration) {
        this.configuration = configuration;
    }

    public ScaleDecision decide(ClusterSnapshot snapshot, ScaleSignal signal) {
        if (!configuration.isAutoScalingEnabled() || !snapshot.getCluster().isAutoScalingEnabled()) {
            return ScaleDecision.noOp(NoOpReason.AutoScalingDisabled);
        }

        PolicyMatch match = AutoScalerFunctions.resolvePolicy(snapshot.getPolicies(), signal.getZone());
        Optional<AutoScalerPolicy> policyOpt = match.getPolicy();
        if (!policyOpt.isPresent()) {
            return ScaleDecision.noOp(NoOpReason.NoMatchingPolicy);
        }
        AutoScalerPolicy policy = policyOpt.get();

        List<ClusterNode> owned = snapshot.getNodes().stream()
                .filter(node -> node.isOwnedBy(policy.getId()))
                .collect(Collectors.toList());
        int ownedCount = owned.size();

        switch (signal.getDirection()) {
            case Up:
                if (ownedCount >= policy.getMaxNodes()) {
                    return ScaleDecision.noOp(NoOpReason.AtMax, match, ownedCount);
                }
                return ScaleDecision.create(match, ownedCount);
            case Down:
                if (ownedCount <= policy.getMinNodes()) {
                    return ScaleDecision.noOp(NoOpReason.AtMin, match, ownedCount);
                }
                return owned.stream()
                        .filter(node -> node.getState().isRemovable())
                        .min(ClusterNode.newestFirst())
                        .map(node -> ScaleDecision.delete(match, ownedCount, node))
                        .orElseGet(() -> ScaleDecision.noOp(NoOpReason.NoRemovableNode, match, ownedCount));
        }
        throw new IllegalStateException("Unknown scale direction " + signal.getDirection());
    }
}
