package org.fractalx.callscope.core;

import com.google.common.collect.ListMultimap;
import org.fractalx.callscope.model.RpcInfo;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.util.Optional;

/**
 * Mutable state of one in-flight call, shared by every hook of that call.
 *
 * <p>Getters never return {@code null}: unset fields read as the default entry name,
 * the no-op logger, the no-op event or an empty metadata map. An empty map handed out
 * this way is stored, so writes through it stick.
 *
 * <p>Not thread-safe. The chain touches a payload from one stage at a time.
 */
public class CallPayload {

    public static final String DEFAULT_ENTRY_NAME = "grpc-entry";

    private String entryName;
    private Logger logger;
    private CallEvent event;
    private ListMultimap<String, String> incomingMetadata;
    private ListMultimap<String, String> outgoingMetadata;
    private RpcInfo rpcInfo;

    public String getEntryName() {
        return entryName == null || entryName.isBlank() ? DEFAULT_ENTRY_NAME : entryName;
    }

    public void setEntryName(String entryName) { this.entryName = entryName; }

    public Logger getLogger() {
        return logger != null ? logger : NOPLogger.NOP_LOGGER;
    }

    public void setLogger(Logger logger) { this.logger = logger; }

    public CallEvent getEvent() {
        return event != null ? event : NoopCallEvent.INSTANCE;
    }

    public void setEvent(CallEvent event) { this.event = event; }

    public ListMultimap<String, String> getIncomingMetadata() {
        if (incomingMetadata == null) {
            incomingMetadata = CallMetadata.newMetadata();
        }
        return incomingMetadata;
    }

    public void setIncomingMetadata(ListMultimap<String, String> md) { this.incomingMetadata = md; }

    public ListMultimap<String, String> getOutgoingMetadata() {
        if (outgoingMetadata == null) {
            outgoingMetadata = CallMetadata.newMetadata();
        }
        return outgoingMetadata;
    }

    public void setOutgoingMetadata(ListMultimap<String, String> md) { this.outgoingMetadata = md; }

    public Optional<RpcInfo> getRpcInfo() { return Optional.ofNullable(rpcInfo); }

    public void setRpcInfo(RpcInfo rpcInfo) { this.rpcInfo = rpcInfo; }
}
