package org.fractalx.callscope.grpc;

import com.google.common.collect.ListMultimap;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.Context;
import io.grpc.MethodDescriptor;
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
 * gRPC client interceptor building a {@link CallPayload} for every outgoing call
 * (unary or streaming) before the call is created.
 *
 * <p>When the call is made from inside a server call that carries a payload, the new
 * payload inherits its metadata: the server call's incoming headers are forwarded,
 * overridden per key by the server call's outgoing headers (see
 * {@link CallMetadata#inherit(CallPayload)}).
 *
 * <p>The new payload is attached to the {@link Context} that is current while the
 * call is created, so interceptors registered closer to the transport and the
 * response listener see it through {@link CallContexts#current()}.
 */
public class CallScopeClientInterceptor implements ClientInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(CallScopeClientInterceptor.class);

    private final CallScopeOptions options;
    private final EntryResources resources;
    private final HookChain hooks;

    public CallScopeClientInterceptor(CallScopeOptions options, EntryResources resources,
                                      List<? extends CallHook> hooks) {
        this.options   = options != null ? options : CallScopeOptions.defaults();
        this.resources = resources != null ? resources : new DefaultEntryResources();
        this.hooks     = new HookChain(hooks);
        logger.info("CallScope client interceptor installed: entry={} enabled={} hooks={}",
                this.options.getEntryName(), this.options.isEnabled(), this.hooks.getHooks().size());
    }

    public CallScopeClientInterceptor(CallScopeOptions options, List<? extends CallHook> hooks) {
        this(options, null, hooks);
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method,
            CallOptions callOptions,
            Channel next) {

        if (!options.isEnabled()) {
            return next.newCall(method, callOptions);
        }

        CallPayload payload = newPayload(method, next.authority());
        Context context = CallContexts.attach(Context.current(), payload);

        Context previous = context.attach();
        try {
            return new ScopedClientCall<>(next.newCall(method, callOptions), payload, context, hooks);
        } finally {
            context.detach(previous);
        }
    }

    private CallPayload newPayload(MethodDescriptor<?, ?> method, String authority) {
        ListMultimap<String, String> incoming;
        ListMultimap<String, String> outgoing;

        Context current = Context.current();
        if (CallContexts.containsPayload(current)) {
            CallPayload parent = CallContexts.resolve(current);
            incoming = CallMetadata.copyOf(parent.getIncomingMetadata());
            outgoing = CallMetadata.inherit(parent);
        } else {
            incoming = CallMetadata.newMetadata();
            outgoing = CallMetadata.newMetadata();
        }

        String entryName = options.getEntryName();

        CallPayload payload = new CallPayload();
        payload.setEntryName(entryName);
        payload.setLogger(resources.getLogger(entryName));
        payload.setEvent(resources.newEvent(entryName));
        payload.setIncomingMetadata(incoming);
        payload.setOutgoingMetadata(outgoing);
        payload.setRpcInfo(RpcInfoResolver.forClient(method, authority, incoming));

        logger.debug("Client call → {} via {}", method.getFullMethodName(), authority);
        return payload;
    }
}
