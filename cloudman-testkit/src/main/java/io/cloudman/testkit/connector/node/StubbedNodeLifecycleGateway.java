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

package io.cloudman.testkit.connector.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import io.cloudman.api.connector.node.NodeLifecycleGateway;
import io.cloudman.api.connector.node.NodeLifecycleGatewayException;
import rx.Completable;
import rx.Observable;

/**
 * In-memory backend, with injectable failures and operations that never complete.
 */
public class StubbedNodeLifecycleGateway implements NodeLifecycleGateway {

    private final Set<String> backendNodes = Collections.synchronizedSet(new LinkedHashSet<>());
    private final List<String> provisionedVmTypes = Collections.synchronizedList(new ArrayList<>());
    private final List<String> drainedNodes = Collections.synchronizedList(new ArrayList<>());
    private final List<String> deletedNodes = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger nextId = new AtomicInteger();

    private volatile RuntimeException provisionError;
    private volatile RuntimeException drainError;
    private volatile RuntimeException deleteError;
    private volatile boolean provisionHanging;
    private volatile boolean deleteHanging;

    @Override
    public Observable<String> provision(String vmType, String zone) {
        return Observable.defer(() -> {
            if (provisionHanging) {
                return Observable.never();
            }
            if (provisionError != null) {
                return Observable.error(provisionError);
            }
            String backendNodeId = "backend-" + nextId.getAndIncrement();
            backendNodes.add(backendNodeId);
            provisionedVmTypes.add(vmType);
            return Observable.just(backendNodeId);
        });
    }

    @Override
    public Completable drain(String backendNodeId) {
        return Completable.defer(() -> {
            if (drainError != null) {
                return Completable.error(drainError);
            }
            if (!backendNodes.contains(backendNodeId)) {
                return Completable.error(NodeLifecycleGatewayException.nodeNotFound(backendNodeId));
            }
            drainedNodes.add(backendNodeId);
            return Completable.complete();
        });
    }

    @Override
    public Completable delete(String backendNodeId) {
        return Completable.defer(() -> {
            if (deleteHanging) {
                return Completable.never();
            }
            if (deleteError != null) {
                return Completable.error(deleteError);
            }
            backendNodes.remove(backendNodeId);
            deletedNodes.add(backendNodeId);
            return Completable.complete();
        });
    }

    @Override
    public Observable<List<String>> listNodes() {
        return Observable.fromCallable(this::getBackendNodes);
    }

    public List<String> getBackendNodes() {
        synchronized (backendNodes) {
            return new ArrayList<>(backendNodes);
        }
    }

    public List<String> getProvisionedVmTypes() {
        synchronized (provisionedVmTypes) {
            return new ArrayList<>(provisionedVmTypes);
        }
    }

    public List<String> getDrainedNodes() {
        synchronized (drainedNodes) {
            return new ArrayList<>(drainedNodes);
        }
    }

    public List<String> getDeletedNodes() {
        synchronized (deletedNodes) {
            return new ArrayList<>(deletedNodes);
        }
    }

    /**
     * Register a node in the backend directly, bypassing {@link #provision(String, String)}.
     */
    public void addBackendNode(String backendNodeId) {
        backendNodes.add(backendNodeId);
    }

    /**
     * Remove a node from the backend directly, as if it was terminated out of band.
     */
    public void removeBackendNode(String backendNodeId) {
        backendNodes.remove(backendNodeId);
    }

    public void failProvisioning(RuntimeException error) {
        this.provisionError = error;
    }

    public void failDrain(RuntimeException error) {
        this.drainError = error;
    }

    public void failDelete(RuntimeException error) {
        this.deleteError = error;
    }

    public void hangProvisioning(boolean hanging) {
        this.provisionHanging = hanging;
    }

    public void hangDelete(boolean hanging) {
        this.deleteHanging = hanging;
    }

    /**
     * Clear all injected failures.
     */
    public void recover() {
        this.provisionError = null;
        this.drainError = null;
        this.deleteError = null;
        this.provisionHanging = false;
        this.deleteHanging = false;
    }
}
