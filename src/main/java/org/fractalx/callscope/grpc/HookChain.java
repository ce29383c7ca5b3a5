package org.fractalx.callscope.grpc;

import io.grpc.Context;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.fractalx.callscope.core.CallHook;
import org.fractalx.callscope.core.CallPayload;
import org.fractalx.callscope.model.RpcInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered hooks of one interceptor and the completion bookkeeping shared by the
 * server and client paths.
 */
final class HookChain {

    private static final Logger logger = LoggerFactory.getLogger(HookChain.class);

    private final List<CallHook> hooks;

    HookChain(List<? extends CallHook> hooks) {
        if (hooks == null) {
            this.hooks = List.of();
        } else {
            for (CallHook hook : hooks) {
                if (hook == null) {
                    throw new IllegalArgumentException("Hook list must not contain null");
                }
            }
            this.hooks = List.copyOf(hooks);
        }
    }

    List<CallHook> getHooks() {
        return hooks;
    }

    /**
     * Runs the before-stage of every applicable hook in installation order with
     * {@code context} attached.
     *
     * @throws StatusRuntimeException carrying the abort status of the first failing hook
     */
    void runBefore(CallPayload payload, Context context) {
        RpcInfo info = payload.getRpcInfo().orElseThrow();
        Context previous = context.attach();
        try {
            for (CallHook hook : hooks) {
                if (!hook.appliesTo(info.getType())) continue;
                try {
                    hook.before(payload);
                } catch (StatusRuntimeException e) {
                    throw e;
                } catch (RuntimeException e) {
                    logger.error("Before-hook {} failed on {}/{}", hook.getClass().getName(),
                            info.getGrpcService(), info.getGrpcMethod(), e);
                    throw Status.fromThrowable(e).asRuntimeException();
                }
            }
        } finally {
            context.detach(previous);
        }
    }

    /**
     * Records the terminal status and runs the after-stage of every applicable hook.
     * Only the first completion of a call has any effect.
     */
    void complete(CallPayload payload, Status status) {
        RpcInfo info = payload.getRpcInfo().orElseThrow();
        if (!info.complete(status)) return;

        for (CallHook hook : hooks) {
            if (!hook.appliesTo(info.getType())) continue;
            try {
                hook.after(payload);
            } catch (RuntimeException e) {
                logger.warn("After-hook {} failed on {}/{}", hook.getClass().getName(),
                        info.getGrpcService(), info.getGrpcMethod(), e);
            }
        }
        finishEvent(payload, status);
    }

    /** Records a before-stage abort. After-stages are skipped. */
    void abort(CallPayload payload, Status status) {
        RpcInfo info = payload.getRpcInfo().orElseThrow();
        if (!info.complete(status)) return;
        payload.getLogger().debug("{}/{} aborted before invoke: {}",
                info.getGrpcService(), info.getGrpcMethod(), status);
        finishEvent(payload, status);
    }

    private static void finishEvent(CallPayload payload, Status status) {
        if (!status.isOk()) {
            payload.getEvent().addError(status);
        }
        payload.getEvent().finish();
    }
}
