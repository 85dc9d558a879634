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

package io.cloudman.api.cluster.model;

public enum NodeLifecycleState {

    /**
     * Backend node requested, not yet reported as ready.
     */
    Pending,

    Active,

    /**
     * Node is being drained ahead of its removal. A node stays in this state if its removal failed.
     */
    Draining,

    Deleting,

    Deleted;

    public boolean isRemovable() {
        return this == Pending || this == Active || this == Draining;
    }
}
