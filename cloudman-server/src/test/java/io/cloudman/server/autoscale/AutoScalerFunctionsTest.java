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

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import io.cloudman.api.cluster.model.AutoScalerPolicy;
import org.junit.Test;

import static io.cloudman.testkit.model.cluster.ClusterGenerator.policy;
import static org.assertj.core.api.Assertions.assertThat;

public class AutoScalerFunctionsTest {

    private static final String CLUSTER_ID = "cluster1";

    @Test
    public void testExactZoneWinsOverDefault() {
        AutoScalerPolicy defaultPolicy = policy(CLUSTER_ID, "default", null, 0, 1, 0);
        AutoScalerPolicy zonePolicy = policy(CLUSTER_ID, "zone", "us-east-1c", 0, 1, 1);

        PolicyMatch match = AutoScalerFunctions.resolvePolicy(Arrays.asList(defaultPolicy, zonePolicy), Optional.of("us-east-1c"));

        assertThat(match).isEqualTo(PolicyMatch.exactZone(zonePolicy));
    }

    @Test
    public void testOldestExactZonePolicyWins() {
        AutoScalerPolicy newer = policy(CLUSTER_ID, "newer", "us-east-1c", 0, 1, 10);
        AutoScalerPolicy older = policy(CLUSTER_ID, "older", "us-east-1c", 0, 1, 5);

        PolicyMatch match = AutoScalerFunctions.resolvePolicy(Arrays.asList(newer, older), Optional.of("us-east-1c"));

        assertThat(match.getPolicy()).contains(older);
    }

    @Test
    public void testSignalWithoutZoneIgnoresZonedPolicies() {
        AutoScalerPolicy zonePolicy = policy(CLUSTER_ID, "zone", "us-east-1c", 0, 1, 1);

        PolicyMatch match = AutoScalerFunctions.resolvePolicy(Collections.singletonList(zonePolicy), Optional.empty());

        assertThat(match.getKind()).isEqualTo(PolicyMatch.Kind.NoMatch);
        assertThat(match.getPolicy()).isEmpty();
    }

    @Test
    public void testNoPolicies() {
        assertThat(AutoScalerFunctions.resolvePolicy(Collections.emptyList(), Optional.of("us-east-1c"))).isEqualTo(PolicyMatch.noMatch());
    }
}
