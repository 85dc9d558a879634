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

import java.util.Optional;

import com.google.common.base.Preconditions;
import io.cloudman.api.cluster.model.AutoScalerPolicy;
import io.cloudman.api.cluster.model.ClusterNode;
import io.cloudman.api.cluster.service.NoOpReason;
import io.cloudman.api.cluster.service.ScaleAction;

/**
 * Outcome of evaluating a scale signal against a {@link ClusterSnapshot}. A decision is either a no-op with
 * a reason, a node creation for a policy, or a removal of one node owned by a policy.
 */
public class ScaleDecision {

    private final ScaleAction action;
    private final NoOpReason reason;
    private final PolicyMatch match;
    private final int ownedNodes;
    private final ClusterNode node;

    private ScaleDecision(ScaleAction action, NoOpReason reason, PolicyMatch match, int ownedNodes, ClusterNode node) {
        this.action = action;
        this.reason = reason;
        this.match = match;
        this.ownedNodes = ownedNodes;
        this.node = node;
    }

    public ScaleAction getAction() {
        return action;
    }

    public Optional<NoOpReason> getReason() {
        return Optional.ofNullable(reason);
    }

    public PolicyMatch getMatch() {
        return match;
    }

    /**
     * Policy the decision applies to. Absent if the signal was rejected before a policy was resolved.
     */
    public Optional<AutoScalerPolicy> getPolicy() {
        return match.getPolicy();
    }

    /**
     * Number of nodes owned by the policy when the decision was made.
     */
    public int getOwnedNodes() {
        return ownedNodes;
    }

    /**
     * Node selected for removal, for {@link ScaleAction#Delete} decisions.
     */
    public Optional<ClusterNode> getNode() {
        return Optional.ofNullable(node);
    }

    @Override
    public String toString() {
        return "ScaleDecision{" +
                "action=" + action +
                ", reason=" + reason +
                ", match=" + match +
                ", ownedNodes=" + ownedNodes +
                ", node=" + node +
                '}';
    }

    public static ScaleDecision noOp(NoOpReason reason) {
        return new ScaleDecision(ScaleAction.None, reason, PolicyMatch.noMatch(), 0, null);
    }

    public static ScaleDecision noOp(NoOpReason reason, PolicyMatch match, int ownedNodes) {
        return new ScaleDecision(ScaleAction.None, reason, match, ownedNodes, null);
    }

    public static ScaleDecision create(PolicyMatch match, int ownedNodes) {
        Preconditions.checkArgument(match.getPolicy().isPresent(), "Node creation requires a policy");
        return new ScaleDecision(ScaleAction.Create, null, match, ownedNodes, null);
    }

    public static ScaleDecision delete(PolicyMatch match, int ownedNodes, ClusterNode node) {
        Preconditions.checkArgument(match.getPolicy().isPresent(), "Node removal requires a policy");
        return new ScaleDecision(ScaleAction.Delete, null, match, ownedNodes, node);
    }
}
