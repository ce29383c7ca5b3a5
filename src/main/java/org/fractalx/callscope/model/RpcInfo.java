package org.fractalx.callscope.model;

import io.grpc.Status;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resolved facts about one intercepted call.
 *
 * <p>Everything except the terminal status is fixed when the chain builds the
 * object, before any hook runs. The terminal status is written exactly once by
 * {@link #complete(Status)} when the call finishes or a before-hook aborts it.
 */
public class RpcInfo {

    private final String grpcService;
    private final String grpcMethod;
    private final String gwMethod;
    private final String gwPath;
    private final String gwScheme;
    private final String gwUserAgent;
    private final RpcType type;
    private final String remoteIp;
    private final String remotePort;

    private final AtomicBoolean completed = new AtomicBoolean();
    private volatile Status error;

    private RpcInfo(Builder b) {
        this.grpcService = nullToEmpty(b.grpcService);
        this.grpcMethod  = nullToEmpty(b.grpcMethod);
        this.gwMethod    = nullToEmpty(b.gwMethod);
        this.gwPath      = nullToEmpty(b.gwPath);
        this.gwScheme    = nullToEmpty(b.gwScheme);
        this.gwUserAgent = nullToEmpty(b.gwUserAgent);
        this.type        = b.type;
        this.remoteIp    = nullToEmpty(b.remoteIp);
        this.remotePort  = nullToEmpty(b.remotePort);
    }

    public static Builder builder(RpcType type) {
        return new Builder(type);
    }

    /**
     * Records the terminal status of the call. An OK status leaves {@link #getError()} empty.
     *
     * @return {@code false} if the call was already completed, in which case nothing changes
     */
    public boolean complete(Status status) {
        if (!completed.compareAndSet(false, true)) {
            return false;
        }
        if (status != null && !status.isOk()) {
            this.error = status;
        }
        return true;
    }

    public boolean isCompleted() { return completed.get(); }

    public Optional<Status> getError() { return Optional.ofNullable(error); }

    public String getGrpcService() { return grpcService; }
    public String getGrpcMethod() { return grpcMethod; }
    public String getGwMethod() { return gwMethod; }
    public String getGwPath() { return gwPath; }
    public String getGwScheme() { return gwScheme; }
    public String getGwUserAgent() { return gwUserAgent; }
    public RpcType getType() { return type; }
    public String getRemoteIp() { return remoteIp; }
    public String getRemotePort() { return remotePort; }

    @Override
    public String toString() {
        return "RpcInfo{" + type + " " + grpcService + "/" + grpcMethod
                + ", remote=" + remoteIp + ":" + remotePort
                + (error != null ? ", error=" + error.getCode() : "") + "}";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public static class Builder {
        private final RpcType type;
        private String grpcService;
        private String grpcMethod;
        private String gwMethod;
        private String gwPath;
        private String gwScheme;
        private String gwUserAgent;
        private String remoteIp;
        private String remotePort;

        private Builder(RpcType type) {
            if (type == null) {
                throw new IllegalArgumentException("RpcType must not be null");
            }
            this.type = type;
        }

        public Builder grpcService(String v) { this.grpcService = v; return this; }
        public Builder grpcMethod(String v) { this.grpcMethod = v; return this; }
        public Builder gwMethod(String v) { this.gwMethod = v; return this; }
        public Builder gwPath(String v) { this.gwPath = v; return this; }
        public Builder gwScheme(String v) { this.gwScheme = v; return this; }
        public Builder gwUserAgent(String v) { this.gwUserAgent = v; return this; }
        public Builder remoteIp(String v) { this.remoteIp = v; return this; }
        public Builder remotePort(String v) { this.remotePort = v; return this; }

        public RpcInfo build() {
            return new RpcInfo(this);
        }
    }
}
