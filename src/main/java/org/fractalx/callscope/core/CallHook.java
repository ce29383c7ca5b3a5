package org.fractalx.callscope.core;

import org.fractalx.callscope.model.RpcType;

/**
 * Stage of the interceptor chain.
 *
 * <p>{@link #before} runs after the payload and its {@code RpcInfo} are built and before
 * the call is handed to the application (server) or the transport (client). Throwing an
 * {@link io.grpc.StatusRuntimeException} aborts the call with that status; the handler and
 * the after-stages of the call are then skipped.
 *
 * <p>{@link #after} runs once the terminal status is recorded in {@code RpcInfo}.
 * Exceptions thrown from it are logged and ignored.
 *
 * <p>Hooks are shared by every call of an interceptor and must keep per-call state in
 * the payload only.
 */
public interface CallHook {

    default boolean appliesTo(RpcType type) {
        return true;
    }

    default void before(CallPayload payload) {
    }

    default void after(CallPayload payload) {
    }
}
