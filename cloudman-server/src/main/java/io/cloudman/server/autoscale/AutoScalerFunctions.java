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

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

import io.cloudman.api.cluster.model.AutoScalerPolicy;

public final class AutoScalerFunctions {

    private AutoScalerFunctions() {
    }

    /**
     * Resolve the policy handling signals from the given zone: the policy of that zone if there is one, otherwise
     * the unzoned policy of the cluster. If several policies qualify at the same step, the oldest one wins.
     *
     * @param zone signal zone, or {@link Optional#empty()} if the signal has none
     */
    public static PolicyMatch resolvePolicy(Collection<AutoScalerPolicy> policies, Optional<String> zone) {
        Comparator<AutoScalerPolicy> order = AutoScalerPolicy.creationOrder();
        if (zone.isPresent()) {
            Optional<AutoScalerPolicy> exact = policies.stream()
                    .filter(p -> p.getZone().equals(zone))
                    .min(order);
            if (exact.isPresent()) {
                return PolicyMatch.exactZone(exact.get());
            }
        }
        return policies.stream()
                .filter(p -> !p.getZone().isPresent())
                .min(order)
                .map(PolicyMatch::defaultZone)
                .orElse(PolicyMatch.noMatch());
    }

    /**
     * Lock key serializing scale operations of a single policy.
     */
    public static String policyLockKey(String clusterId, String policyId) {
        return clusterId + '/' + policyId;
    }
}
