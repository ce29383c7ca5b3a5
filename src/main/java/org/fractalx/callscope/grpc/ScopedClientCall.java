package org.fractalx.callscope.grpc;

import io.grpc.ClientCall;
import io.grpc.ClientInterceptors;
import io.grpc.Context;
import io.grpc.ForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.fractalx.callscope.core.CallMetadata;
import org.fractalx.callscope.core.CallPayload;

/**
 * Client call carrying the payload of one outgoing call.
 *
 * <p>On start the before-hooks run; a failing hook closes the call towards the response
 * listener without reaching the transport. Otherwise the payload's outgoing metadata is
 * added to the request headers (headers set explicitly on the call win), response
 * headers are appended to the payload's incoming metadata, and the terminal status is
 * recorded on close.
 */
public class ScopedClientCall<ReqT, RespT>
        extends ClientInterceptors.CheckedForwardingClientCall<ReqT, RespT> {

    private final CallPayload payload;
    private final Context context;
    private final HookChain hooks;

    ScopedClientCall(ClientCall<ReqT, RespT> delegate, CallPayload payload,
                     Context context, HookChain hooks) {
        super(delegate);
        this.payload = payload;
        this.context = context;
        this.hooks   = hooks;
    }

    public CallPayload getPayload() { return payload; }

    public Context getContext() { return context; }

    @Override
    protected void checkedStart(Listener<RespT> responseListener, Metadata headers) {
        try {
            hooks.runBefore(payload, context);
        } catch (StatusRuntimeException e) {
            hooks.abort(payload, e.getStatus());
            throw e;
        }

        CallMetadata.mergeAbsent(payload.getOutgoingMetadata(), headers);

        delegate().start(
                new ForwardingClientCallListener.SimpleForwardingClientCallListener<RespT>(responseListener) {
                    @Override
                    public void onHeaders(Metadata responseHeaders) {
                        payload.getIncomingMetadata().putAll(CallMetadata.readIncoming(responseHeaders));
                        super.onHeaders(responseHeaders);
                    }

                    @Override
                    public void onClose(Status status, Metadata trailers) {
                        hooks.complete(payload, status);
                        super.onClose(status, trailers);
                    }
                },
                headers);
    }
}
