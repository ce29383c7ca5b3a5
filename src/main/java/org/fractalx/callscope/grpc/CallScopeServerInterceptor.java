package org.fractalx.callscope.grpc;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.fractalx.callscope.config.CallScopeOptions;
import org.fractalx.callscope.core.CallContexts;
import org.fractalx.callscope.core.CallHook;
import org.fractalx.callscope.core.CallMetadata;
import org.fractalx.callscope.core.CallPayload;
import org.fractalx.callscope.core.DefaultEntryResources;
import org.fractalx.callscope.core.EntryResources;
import org.fractalx.callscope.core.RpcInfoResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * gRPC server interceptor that gives every call (unary or streaming) its own
 * {@link CallPayload} and runs the installed hooks around it.
 *
 * <p>Per call:
 * <ol>
 *   <li>build the payload: entry name, logger and event, request headers, {@code RpcInfo},
 *       a fresh {@code x-request-id} in the outgoing metadata;</li>
 *   <li>run the before-hooks in order; the first failure closes the call with its status;</li>
 *   <li>hand the call to the next handler inside the enriched {@link Context};</li>
 *   <li>on close or cancel, record the terminal status and run the after-hooks.</li>
 * </ol>
 *
 * Application code reads the payload with {@link CallContexts#current()}.
 */
public class CallScopeServerInterceptor implements ServerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(CallScopeServerInterceptor.class);

    private final CallScopeOptions options;
    private final EntryResources resources;
    private final HookChain hooks;

    public CallScopeServerInterceptor(CallScopeOptions options, EntryResources resources,
                                      List<? extends CallHook> hooks) {
        this.options   = options != null ? options : CallScopeOptions.defaults();
        this.resources = resources != null ? resources : new DefaultEntryResources();
        this.hooks     = new HookChain(hooks);
        logger.info("CallScope server interceptor installed: entry={} enabled={} hooks={}",
                this.options.getEntryName(), this.options.isEnabled(), this.hooks.getHooks().size());
    }

    public CallScopeServerInterceptor(CallScopeOptions options, List<? extends CallHook> hooks) {
        this(options, null, hooks);
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call,
            Metadata headers,
            ServerCallHandler<ReqT, RespT> next) {

        if (!options.isEnabled()) {
            return next.startCall(call, headers);
        }

        CallPayload payload = newPayload(call, headers);
        Context context = CallContexts.attach(Context.current(), payload);

        try {
            hooks.runBefore(payload, context);
        } catch (StatusRuntimeException e) {
            Status status = e.getStatus();
            hooks.abort(payload, status);

            Metadata trailers = e.getTrailers() != null ? e.getTrailers() : new Metadata();
            CallMetadata.writeTo(payload.getOutgoingMetadata(), trailers);
            call.close(status, trailers);
            return new ServerCall.Listener<ReqT>() {};
        }

        ScopedServerCall<ReqT, RespT> scoped = new ScopedServerCall<>(call, payload, context, hooks);
        ServerCall.Listener<ReqT> listener;
        try {
            listener = Contexts.interceptCall(context, scoped, headers, next);
        } catch (RuntimeException e) {
            scoped.closeOnHandlerFailure(e);
            return new ServerCall.Listener<ReqT>() {};
        }
        return scoped.wrapListener(listener);
    }

    private CallPayload newPayload(ServerCall<?, ?> call, Metadata headers) {
        String entryName = options.getEntryName();

        CallPayload payload = new CallPayload();
        payload.setEntryName(entryName);
        payload.setLogger(resources.getLogger(entryName));
        payload.setEvent(resources.newEvent(entryName));
        payload.setIncomingMetadata(CallMetadata.readIncoming(headers));
        payload.setRpcInfo(RpcInfoResolver.forServer(call, payload.getIncomingMetadata()));
        String requestId = CallMetadata.setRequestId(payload);

        if (logger.isDebugEnabled()) {
            logger.debug("Call {} → {} [{}]", requestId, call.getMethodDescriptor().getFullMethodName(),
                    payload.getRpcInfo().map(i -> i.getType().name()).orElse(""));
        }
        return payload;
    }
}
