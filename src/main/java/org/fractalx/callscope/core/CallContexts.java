package org.fractalx.callscope.core;

import com.google.common.collect.ListMultimap;
import io.grpc.Context;
import org.fractalx.callscope.model.RpcInfo;
import org.slf4j.Logger;

import java.util.Optional;

/**
 * Typed access to the {@link CallPayload} carried by an {@link io.grpc.Context}.
 *
 * <p>Every read tolerates a {@code null} context and a context without payload,
 * answering with the same defaults as an empty {@link CallPayload}.
 *
 * <pre>
 * Logger log = CallContexts.getLogger(Context.current());
 * String user = CallMetadata.getIncomingValues(Context.current(), "x-user").get(0);
 * </pre>
 */
public final class CallContexts {

    static final Context.Key<CallPayload> PAYLOAD_KEY = Context.key("callscope.payload");

    private CallContexts() {
    }

    // ── Attach / resolve ──────────────────────────────────────────────────────

    /** Returns a child of {@code base} (or of the current context) carrying {@code payload}. */
    public static Context attach(Context base, CallPayload payload) {
        Context parent = base != null ? base : Context.current();
        return parent.withValue(PAYLOAD_KEY, payload != null ? payload : new CallPayload());
    }

    /** Returns the attached payload, or a fresh detached one when none is attached. */
    public static CallPayload resolve(Context ctx) {
        CallPayload payload = ctx != null ? PAYLOAD_KEY.get(ctx) : null;
        return payload != null ? payload : new CallPayload();
    }

    public static CallPayload current() {
        return resolve(Context.current());
    }

    public static boolean containsPayload(Context ctx) {
        return ctx != null && PAYLOAD_KEY.get(ctx) != null;
    }

    /** A root context carrying a fresh payload. Handy outside of a call, e.g. in batch jobs. */
    public static Context newContext() {
        return attach(Context.ROOT, new CallPayload());
    }

    // ── Field getters ─────────────────────────────────────────────────────────

    public static Logger getLogger(Context ctx) {
        return resolve(ctx).getLogger();
    }

    public static CallEvent getEvent(Context ctx) {
        return resolve(ctx).getEvent();
    }

    public static String getEntryName(Context ctx) {
        return resolve(ctx).getEntryName();
    }

    public static ListMultimap<String, String> getIncomingMetadata(Context ctx) {
        return resolve(ctx).getIncomingMetadata();
    }

    public static ListMultimap<String, String> getOutgoingMetadata(Context ctx) {
        return resolve(ctx).getOutgoingMetadata();
    }

    public static Optional<RpcInfo> getRpcInfo(Context ctx) {
        return resolve(ctx).getRpcInfo();
    }

    // ── Field setters (no-op without an attached payload) ─────────────────────

    public static void setLogger(Context ctx, Logger logger) {
        if (containsPayload(ctx)) {
            PAYLOAD_KEY.get(ctx).setLogger(logger);
        }
    }

    public static void setEvent(Context ctx, CallEvent event) {
        if (containsPayload(ctx)) {
            PAYLOAD_KEY.get(ctx).setEvent(event);
        }
    }
}
