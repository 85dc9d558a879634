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

public class AutoScalerException extends RuntimeException {

    public enum ErrorCode {
        ClusterNotFound,
        PolicyNotFound,
        NodeNotFound,
        InvalidArgument,
        ProvisioningError,
        DeletionError,
        LockTimeout,
        ConcurrentModification
    }

    private final ErrorCode errorCode;

    private AutoScalerException(ErrorCode errorCode, String message, Throwable cause, Object... args) {
        super(String.format(message, args), cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static boolean isThis(Throwable cause, ErrorCode errorCode) {
        return cause instanceof AutoScalerException && ((AutoScalerException) cause).getErrorCode() == errorCode;
    }

    public static AutoScalerException clusterNotFound(String clusterId) {
        return new AutoScalerException(ErrorCode.ClusterNotFound, "Cluster %s is not found", null, clusterId);
    }

    public static AutoScalerException policyNotFound(String policyId) {
        return new AutoScalerException(ErrorCode.PolicyNotFound, "Autoscaler policy %s is not found", null, policyId);
    }

    public static AutoScalerException nodeNotFound(String nodeId) {
        return new AutoScalerException(ErrorCode.NodeNotFound, "Cluster node %s is not found", null, nodeId);
    }

    public static AutoScalerException invalidArgument(String message, Object... args) {
        return new AutoScalerException(ErrorCode.InvalidArgument, message, null, args);
    }

    public static AutoScalerException provisioningError(String clusterId, String vmType, Throwable cause) {
        return new AutoScalerException(ErrorCode.ProvisioningError, "Cannot provision node of type %s in cluster %s: %s",
                cause, vmType, clusterId, cause.getMessage());
    }

    public static AutoScalerException deletionError(String nodeId, Throwable cause) {
        return new AutoScalerException(ErrorCode.DeletionError, "Cannot delete cluster node %s: %s", cause, nodeId, cause.getMessage());
    }

    public static AutoScalerException clusterTeardownError(String clusterId, Throwable cause) {
        return new AutoScalerException(ErrorCode.DeletionError, "Cannot remove all nodes of cluster %s: %s", cause, clusterId, cause.getMessage());
    }

    public static AutoScalerException policyChanged(String clusterId, String lockedPolicyId, String resolvedPolicyId) {
        return new AutoScalerException(ErrorCode.ConcurrentModification,
                "Autoscaler policies of cluster %s changed while the signal was processed (%s -> %s); retry the signal",
                null, clusterId, lockedPolicyId, resolvedPolicyId);
    }

    public static AutoScalerException lockTimeout(String clusterId, String policyId, long timeoutMs) {
        return new AutoScalerException(ErrorCode.LockTimeout,
                "Scale operation for cluster %s and policy %s already in progress; lock not acquired within %sms",
                null, clusterId, policyId, timeoutMs);
    }

    public static <T> T checkClusterFound(T cluster, String clusterId) {
        if (cluster == null) {
            throw clusterNotFound(clusterId);
        }
        return cluster;
    }

    public static void checkArgument(boolean condition, String message, Object... args) {
        if (!condition) {
            throw invalidArgument(message, args);
        }
    }
}
