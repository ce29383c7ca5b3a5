package org.fractalx.callscope.grpc;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.Status;
import org.fractalx.callscope.core.CallMetadata;
import org.fractalx.callscope.core.CallPayload;
import org.fractalx.callscope.model.RpcInfo;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server call carrying the payload and the enriched {@link Context} of one call for
 * as long as the call (or stream) lives.
 *
 * <p>Messages, flow control and ordering pass through untouched. Only two points are
 * intercepted: response headers get the payload's outgoing metadata, and {@code close}
 * records the terminal status and runs the after-hooks. When the call closes without
 * having sent headers, the outgoing metadata goes into the trailers instead. A handler
 * that throws is closed here too, see {@link #closeOnHandlerFailure}.
 */
public class ScopedServerCall<ReqT, RespT>
        extends ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT> {

    private final CallPayload payload;
    private final Context context;
    private final HookChain hooks;
    private final AtomicBoolean headersSent = new AtomicBoolean();

    ScopedServerCall(ServerCall<ReqT, RespT> delegate, CallPayload payload,
                     Context context, HookChain hooks) {
        super(delegate);
        this.payload = payload;
        this.context = context;
        this.hooks   = hooks;
    }

    public CallPayload getPayload() { return payload; }

    public Context getContext() { return context; }

    @Override
    public void sendHeaders(Metadata headers) {
        headersSent.set(true);
        CallMetadata.writeTo(payload.getOutgoingMetadata(), headers);
        super.sendHeaders(headers);
    }

    @Override
    public void close(Status status, Metadata trailers) {
        if (!headersSent.get()) {
            CallMetadata.writeTo(payload.getOutgoingMetadata(), trailers);
        }
        hooks.complete(payload, status);
        super.close(status, trailers);
    }

    /**
     * Closes the call with {@code Status.fromThrowable(e)} after the handler threw.
     * Left alone the server would close the raw stream itself, bypassing this call, so the
     * status would go unrecorded and the trailers would miss the outgoing metadata.
     * If the call is already complete the exception is rethrown to the server.
     */
    void closeOnHandlerFailure(RuntimeException e) {
        if (payload.getRpcInfo().map(RpcInfo::isCompleted).orElse(false)) {
            throw e;
        }
        payload.getLogger().error("Handler of {} failed", getMethodDescriptor().getFullMethodName(), e);
        close(Status.fromThrowable(e), new Metadata());
    }

    /**
     * Wraps the application listener so a cancelled call completes as well, with the
     * cancellation status of the call's context, and so a handler throwing from a
     * callback closes the call through {@link #closeOnHandlerFailure}.
     */
    ServerCall.Listener<ReqT> wrapListener(ServerCall.Listener<ReqT> listener) {
        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(listener) {
            @Override
            public void onMessage(ReqT message) {
                try {
                    super.onMessage(message);
                } catch (RuntimeException e) {
                    closeOnHandlerFailure(e);
                }
            }

            @Override
            public void onHalfClose() {
                try {
                    super.onHalfClose();
                } catch (RuntimeException e) {
                    closeOnHandlerFailure(e);
                }
            }

            @Override
            public void onReady() {
                try {
                    super.onReady();
                } catch (RuntimeException e) {
                    closeOnHandlerFailure(e);
                }
            }

            @Override
            public void onCancel() {
                try {
                    super.onCancel();
                } finally {
                    Status status = Contexts.statusFromCancelled(context);
                    hooks.complete(payload, status != null ? status : Status.CANCELLED);
                }
            }
        };
    }
}
