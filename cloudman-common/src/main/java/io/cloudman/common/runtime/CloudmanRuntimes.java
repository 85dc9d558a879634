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

package io.cloudman.common.runtime;

import com.netflix.spectator.api.DefaultRegistry;
import io.cloudman.common.runtime.internal.DefaultCloudmanRuntime;
import io.cloudman.common.util.time.Clocks;
import io.cloudman.common.util.time.TestClock;
import rx.schedulers.TestScheduler;

public final class CloudmanRuntimes {

    private CloudmanRuntimes() {
    }

    public static CloudmanRuntime internal() {
        return new DefaultCloudmanRuntime(new DefaultRegistry(), Clocks.system());
    }

    public static CloudmanRuntime test() {
        return new DefaultCloudmanRuntime(new DefaultRegistry(), Clocks.test());
    }

    public static CloudmanRuntime test(TestClock clock) {
        return new DefaultCloudmanRuntime(new DefaultRegistry(), clock);
    }

    public static CloudmanRuntime test(TestScheduler testScheduler) {
        return new DefaultCloudmanRuntime(new DefaultRegistry(), Clocks.testScheduler(testScheduler));
    }
}
