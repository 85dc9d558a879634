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

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.ConfigProxyFactory;
import io.cloudman.api.cluster.service.ClusterAutoScalingService;
import io.cloudman.api.cluster.service.ClusterNodeService;
import io.cloudman.api.cluster.service.PolicyManagementService;
import io.cloudman.api.cluster.store.ClusterStore;
import io.cloudman.api.cluster.store.NodeInventory;
import io.cloudman.api.cluster.store.PolicyStore;
import io.cloudman.api.connector.node.NodeLifecycleGateway;
import io.cloudman.common.runtime.CloudmanRuntime;
import io.cloudman.common.runtime.internal.DefaultCloudmanRuntime;
import io.cloudman.server.cluster.DefaultClusterNodeService;
import io.cloudman.server.cluster.DefaultPolicyManagementService;
import io.cloudman.server.cluster.store.InMemoryClusterStore;
import io.cloudman.server.cluster.store.InMemoryNodeInventory;
import io.cloudman.server.cluster.store.InMemoryPolicyStore;

/**
 * Autoscaler services with in-memory stores. The {@link NodeLifecycleGateway} implementation, the Spectator
 * {@link com.netflix.spectator.api.Registry} and the {@link ConfigProxyFactory} are provided by other modules.
 */
public class AutoScalerModule extends AbstractModule {
    @Override
    protected void configure() {
        bind(CloudmanRuntime.class).to(DefaultCloudmanRuntime.class);

        bind(ClusterStore.class).to(InMemoryClusterStore.class);
        bind(PolicyStore.class).to(InMemoryPolicyStore.class);
        bind(NodeInventory.class).to(InMemoryNodeInventory.class);

        bind(ClusterAutoScalingService.class).to(DefaultClusterAutoScalingService.class);
        bind(PolicyManagementService.class).to(DefaultPolicyManagementService.class);
        bind(ClusterNodeService.class).to(DefaultClusterNodeService.class);
    }

    @Provides
    @Singleton
    public AutoScalerConfiguration getAutoScalerConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(AutoScalerConfiguration.class);
    }

    @Provides
    @Singleton
    public NodeInventoryAuditor getNodeInventoryAuditor(CloudmanRuntime runtime,
                                                        AutoScalerConfiguration configuration,
                                                        NodeLifecycleGateway gateway,
                                                        NodeInventory nodeInventory) {
        NodeInventoryAuditor auditor = new NodeInventoryAuditor(runtime, configuration, gateway, nodeInventory);
        auditor.enterActiveMode();
        return auditor;
    }
}
