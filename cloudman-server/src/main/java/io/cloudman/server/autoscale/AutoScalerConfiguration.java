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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "cloudman.autoScaler")
public interface AutoScalerConfiguration {

    /**
     * @return whether or not scale signals are acted upon at all. Cluster level settings apply only if this one is on.
     */
    @DefaultValue("true")
    boolean isAutoScalingEnabled();

    /**
     * @return the amount of time a node provisioning request may take. A timed out request is a failure, and no node
     * is recorded for it.
     */
    @DefaultValue("120000")
    long getProvisionTimeoutMs();

    /**
     * @return the amount of time a node drain request may take before the node removal proceeds anyway.
     */
    @DefaultValue("60000")
    long getDrainTimeoutMs();

    /**
     * @return the amount of time a node delete request may take. A timed out request leaves the node in the draining state.
     */
    @DefaultValue("60000")
    long getDeleteTimeoutMs();

    @DefaultValue("30000")
    long getListNodesTimeoutMs();

    /**
     * @return the maximum amount of time a scale signal waits for another signal processed for the same policy.
     */
    @DefaultValue("30000")
    long getLockTimeoutMs();

    /**
     * @return whether a cluster without any autoscaler policy gets a default one created on the first scale signal.
     */
    @DefaultValue("false")
    boolean isImplicitDefaultPolicyEnabled();

    /**
     * @return the maximum number of nodes of the implicitly created default policy.
     */
    @DefaultValue("5")
    int getImplicitDefaultPolicyMaxNodes();

    /**
     * @return the time after which a node still in the draining state is reported by the audit.
     */
    @DefaultValue("600000")
    long getDrainingStuckThresholdMs();

    /**
     * @return interval of the periodic node inventory audit. The periodic audit is off if the value is not positive.
     */
    @DefaultValue("300000")
    long getAuditIntervalMs();
}
