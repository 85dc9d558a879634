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

package io.cloudman.api.connector.node;

public class NodeLifecycleGatewayException extends RuntimeException {

    public enum ErrorCode {
        Internal,
        NotFound,
        Timeout,
    }

    private final ErrorCode errorCode;

    private NodeLifecycleGatewayException(ErrorCode errorCode, String message, Object[] args) {
        super(String.format(message, args));
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static boolean isThis(Throwable cause, ErrorCode errorCode) {
        return cause instanceof NodeLifecycleGatewayException && ((NodeLifecycleGatewayException) cause).getErrorCode() == errorCode;
    }

    public static NodeLifecycleGatewayException internalError(String message, Object... args) {
        return new NodeLifecycleGatewayException(ErrorCode.Internal, message, args);
    }

    public static NodeLifecycleGatewayException nodeNotFound(String backendNodeId) {
        return new NodeLifecycleGatewayException(ErrorCode.NotFound, "Backend node %s not found", new Object[]{backendNodeId});
    }

    public static NodeLifecycleGatewayException timeout(String operation, long timeoutMs) {
        return new NodeLifecycleGatewayException(ErrorCode.Timeout, "Operation %s did not complete within %sms", new Object[]{operation, timeoutMs});
    }
}
