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

import java.util.Objects;
import java.util.Optional;

import io.cloudman.api.cluster.model.AutoScalerPolicy;

/**
 * Result of resolving a signal zone to an autoscaler policy.
 */
public class PolicyMatch {

    public enum Kind {
        /**
         * The policy zone is the signal zone.
         */
        ExactZone,

        /**
         * The cluster default (unzoned) policy, used when no policy exists for the signal zone.
         */
        DefaultZone,

        NoMatch
    }

    private static final PolicyMatch NO_MATCH = new PolicyMatch(Kind.NoMatch, null);

    private final Kind kind;
    private final AutoScalerPolicy policy;

    private PolicyMatch(Kind kind, AutoScalerPolicy policy) {
        this.kind = kind;
        this.policy = policy;
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<AutoScalerPolicy> getPolicy() {
        return Optional.ofNullable(policy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PolicyMatch that = (PolicyMatch) o;
        return kind == that.kind && Objects.equals(policy, that.policy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, policy);
    }

    @Override
    public String toString() {
        return "PolicyMatch{" +
                "kind=" + kind +
                ", policy=" + policy +
                '}';
    }

    public static PolicyMatch exactZone(AutoScalerPolicy policy) {
        return new PolicyMatch(Kind.ExactZone, policy);
    }

    public static PolicyMatch defaultZone(AutoScalerPolicy policy) {
        return new PolicyMatch(Kind.DefaultZone, policy);
    }

    public static PolicyMatch noMatch() {
        return NO_MATCH;
    }
}
