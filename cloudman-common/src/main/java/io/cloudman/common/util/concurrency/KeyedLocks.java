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

package io.cloudman.common.util.concurrency;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of exclusive locks, one per key. Lock entries are created on first use, and removed once there are
 * no holders or waiters left, so the registry does not grow with the number of keys ever seen.
 * A lock is not bound to a thread, and can be released from any thread (for example from an Rx callback).
 */
public class KeyedLocks<K> {

    private static final Logger logger = LoggerFactory.getLogger(KeyedLocks.class);

    private final Map<K, KeyLock> locks = new HashMap<>();

    /**
     * Acquire the lock associated with the given key, waiting at most the given amount of time.
     *
     * @return {@link Optional#empty()} if the lock could not be acquired in time
     */
    public Optional<LockHandle> tryAcquire(K key, long timeout, TimeUnit timeUnit) {
        Preconditions.checkNotNull(key, "Lock key is null");

        KeyLock keyLock;
        synchronized (locks) {
            keyLock = locks.computeIfAbsent(key, KeyLock::new);
            keyLock.waitCount++;
        }

        boolean acquired = false;
        try {
            acquired = keyLock.mutex.tryAcquire(timeout, timeUnit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!acquired) {
                keyLock.decWaitCount();
            }
        }
        if (!acquired) {
            logger.debug("Could not acquire lock for key {} within {}ms", key, timeUnit.toMillis(timeout));
            return Optional.empty();
        }
        logger.trace("Acquired lock for key {}", key);
        return Optional.of(new LockHandle(keyLock));
    }

    public boolean isLocked(K key) {
        synchronized (locks) {
            KeyLock keyLock = locks.get(key);
            return keyLock != null && keyLock.mutex.availablePermits() == 0;
        }
    }

    public Set<K> getKeys() {
        synchronized (locks) {
            return new HashSet<>(locks.keySet());
        }
    }

    public class LockHandle {

        private final KeyLock keyLock;
        private final AtomicBoolean released = new AtomicBoolean();

        private LockHandle(KeyLock keyLock) {
            this.keyLock = keyLock;
        }

        public K getKey() {
            return keyLock.key;
        }

        /**
         * Release the lock. Subsequent calls are ignored.
         */
        public void release() {
            if (released.compareAndSet(false, true)) {
                keyLock.mutex.release();
                keyLock.decWaitCount();
                logger.trace("Released lock for key {}", keyLock.key);
            }
        }
    }

    private class KeyLock {

        private final K key;
        private final Semaphore mutex = new Semaphore(1, true);

        // Guarded by locks
        private int waitCount;

        private KeyLock(K key) {
            this.key = key;
        }

        private void decWaitCount() {
            synchronized (locks) {
                waitCount--;
                if (waitCount == 0) {
                    locks.remove(key);
                }
            }
        }
    }
}
