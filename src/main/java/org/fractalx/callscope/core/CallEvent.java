package org.fractalx.callscope.core;

import io.grpc.Status;

/**
 * Correlation recorder attached to a call.
 *
 * <p>Implementations are supplied by the event sink of the hosting application
 * through {@link EntryResources}. How an event is rendered or shipped is up to them.
 */
public interface CallEvent {

    String getEventId();

    void addPair(String key, String value);

    void addError(Status status);

    void finish();
}
