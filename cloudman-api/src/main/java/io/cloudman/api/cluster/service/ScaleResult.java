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

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of processing a single scale signal.
 */
public class ScaleResult {

    private final boolean applied;
    private final ScaleAction action;
    private final NoOpReason reason;
    private final String nodeId;

    private ScaleResult(boolean applied, ScaleAction action, NoOpReason reason, String nodeId) {
        this.applied = applied;
        this.action = action;
        this.reason = reason;
        this.nodeId = nodeId;
    }

    public boolean isApplied() {
        return applied;
    }

    public ScaleAction getAction() {
        return action;
    }

    public Optional<NoOpReason> getReason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Id of the created or removed node.
     */
    public Optional<String> getNodeId() {
        return Optional.ofNullable(nodeId);
    }

    /**
     * HTTP status the web tier returns for this result.
     */
    public int getHttpStatusHint() {
        switch (action) {
            case Create:
                return 201;
            case Delete:
                return 204;
            default:
                return 200;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ScaleResult that = (ScaleResult) o;
        return applied == that.applied &&
                action == that.action &&
                reason == that.reason &&
                Objects.equals(nodeId, that.nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(applied, action, reason, nodeId);
    }

    @Override
    public String toString() {
        return "ScaleResult{" +
                "applied=" + applied +
                ", action=" + action +
                ", reason=" + reason +
                ", nodeId='" + nodeId + '\'' +
                '}';
    }

    public static ScaleResult created(String nodeId) {
        return new ScaleResult(true, ScaleAction.Create, null, nodeId);
    }

    public static ScaleResult deleted(String nodeId) {
        return new ScaleResult(true, ScaleAction.Delete, null, nodeId);
    }

    public static ScaleResult noOp(NoOpReason reason) {
        return new ScaleResult(false, ScaleAction.None, reason, null);
    }
}
