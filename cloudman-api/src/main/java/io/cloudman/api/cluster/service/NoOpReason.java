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

package io.cloudman.api.cluster.service;

/**
 * Reasons for a scale signal not changing the cluster. None of them is an error; the signal is simply ignored.
 */
public enum NoOpReason {

    /**
     * Autoscaling is turned off for the cluster, or globally.
     */
    AutoScalingDisabled,

    /**
     * Neither a policy for the signal zone, nor the cluster default policy exists.
     */
    NoMatchingPolicy,

    AtMax,

    AtMin,

    /**
     * All nodes owned by the policy are already being removed.
     */
    NoRemovableNode
}
