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

import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.cloudman.api.cluster.service.AutoScalerException;
import io.cloudman.common.util.concurrency.KeyedLocks;
import rx.Completable;
import rx.Observable;
import rx.functions.Func0;

/**
 * Serializes node creation and removal per (cluster, policy) pair. Operations on different policies run in parallel.
 */
@Singleton
public class PolicyLocks {

    private final AutoScalerConfiguration configuration;
    private final KeyedLocks<String> locks = new KeyedLocks<>();

    @Inject
    public PolicyLocks(AutoScalerConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Run the action while holding the policy lock. Acquiring the lock blocks the subscribing thread.
     *
     * @return {@link AutoScalerException} with {@link AutoScalerException.ErrorCode#LockTimeout} if the lock is not
     * acquired within the configured time
     */
    public <T> Observable<T> withLock(String clusterId, String policyId, Func0<Observable<T>> action) {
        return Observable.<T, KeyedLocks<String>.LockHandle>using(
                () -> acquire(clusterId, policyId),
                lock -> Observable.defer(action),
                lock -> lock.release(),
                true
        );
    }

    public Completable withLock(String clusterId, String policyId, Completable action) {
        return withLock(clusterId, policyId, () -> action.<Void>toObservable()).toCompletable();
    }

    public boolean isLocked(String clusterId, String policyId) {
        return locks.isLocked(AutoScalerFunctions.policyLockKey(clusterId, policyId));
    }

    private KeyedLocks<String>.LockHandle acquire(String clusterId, String policyId) {
        long timeoutMs = configuration.getLockTimeoutMs();
        return locks.tryAcquire(AutoScalerFunctions.policyLockKey(clusterId, policyId), timeoutMs, TimeUnit.MILLISECONDS)
                .orElseThrow(() -> AutoScalerException.lockTimeout(clusterId, policyId, timeoutMs));
    }
}
