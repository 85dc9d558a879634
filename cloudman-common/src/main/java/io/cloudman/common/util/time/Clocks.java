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

package io.cloudman.common.util.time;

import java.util.concurrent.TimeUnit;

import io.cloudman.common.util.time.internal.DefaultTestClock;
import io.cloudman.common.util.time.internal.SystemClock;
import rx.schedulers.TestScheduler;

public class Clocks {

    public static Clock system() {
        return SystemClock.INSTANCE;
    }

    public static TestClock test() {
        return new DefaultTestClock();
    }

    public static TestClock testScheduler(TestScheduler testScheduler) {
        return new TestClock() {
            @Override
            public long advanceTime(long interval, TimeUnit timeUnit) {
                testScheduler.advanceTimeBy(interval, timeUnit);
                return testScheduler.now();
            }

            @Override
            public long nanoTime() {
                return TimeUnit.MILLISECONDS.toNanos(testScheduler.now());
            }

            @Override
            public long wallTime() {
                return testScheduler.now();
            }
        };
    }
}
