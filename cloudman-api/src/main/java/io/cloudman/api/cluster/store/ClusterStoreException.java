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

package io.cloudman.api.cluster.store;

public class ClusterStoreException extends RuntimeException {

    public enum ErrorCode {
        NotFound,
        ImmutablePolicyReference
    }

    private final ErrorCode errorCode;

    private ClusterStoreException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static ClusterStoreException nodeNotFound(String nodeId) {
        return new ClusterStoreException("Cluster node " + nodeId + " not found", ErrorCode.NotFound);
    }

    public static ClusterStoreException policyReferenceChanged(String nodeId, String currentPolicyId, String newPolicyId) {
        return new ClusterStoreException(
                String.format("Policy reference of node %s cannot change (%s -> %s)", nodeId, currentPolicyId, newPolicyId),
                ErrorCode.ImmutablePolicyReference
        );
    }
}
