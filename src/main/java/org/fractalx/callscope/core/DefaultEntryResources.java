package org.fractalx.callscope.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J logger named {@code callscope.<entryName>} and a no-op event.
 */
public class DefaultEntryResources implements EntryResources {

    static final String LOGGER_PREFIX = "callscope.";

    @Override
    public Logger getLogger(String entryName) {
        return LoggerFactory.getLogger(LOGGER_PREFIX + entryName);
    }

    @Override
    public CallEvent newEvent(String entryName) {
        return NoopCallEvent.INSTANCE;
    }
}
