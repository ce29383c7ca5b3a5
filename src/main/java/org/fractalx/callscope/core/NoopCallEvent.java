package org.fractalx.callscope.core;

import io.grpc.Status;

/**
 * Event that records nothing. Used whenever no event sink is configured.
 */
public enum NoopCallEvent implements CallEvent {
    INSTANCE;

    @Override
    public String getEventId() {
        return "";
    }

    @Override
    public void addPair(String key, String value) {
    }

    @Override
    public void addError(Status status) {
    }

    @Override
    public void finish() {
    }
}
