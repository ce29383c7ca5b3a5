package org.fractalx.callscope.model;

import io.grpc.MethodDescriptor;

/**
 * Shape of an intercepted call.
 */
public enum RpcType {
    UNARY_SERVER,
    STREAM_SERVER,
    UNARY_CLIENT,
    STREAM_CLIENT;

    public boolean isServer() {
        return this == UNARY_SERVER || this == STREAM_SERVER;
    }

    public boolean isClient() {
        return !isServer();
    }

    public static RpcType forServer(MethodDescriptor.MethodType methodType) {
        return methodType == MethodDescriptor.MethodType.UNARY ? UNARY_SERVER : STREAM_SERVER;
    }

    public static RpcType forClient(MethodDescriptor.MethodType methodType) {
        return methodType == MethodDescriptor.MethodType.UNARY ? UNARY_CLIENT : STREAM_CLIENT;
    }
}
