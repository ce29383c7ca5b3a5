package org.fractalx.callscope.core;

import org.slf4j.Logger;

/**
 * Source of the per-call logger and event for a named entry.
 * Provided by the logging/event collaborators of the hosting application.
 */
public interface EntryResources {

    Logger getLogger(String entryName);

    CallEvent newEvent(String entryName);
}
