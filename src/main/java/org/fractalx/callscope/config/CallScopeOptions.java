package org.fractalx.callscope.config;

import org.fractalx.callscope.core.CallPayload;

/**
 * Immutable settings of one installed interceptor, shared by all of its calls.
 */
public final class CallScopeOptions {

    private final String entryName;
    private final boolean enabled;

    private CallScopeOptions(String entryName, boolean enabled) {
        this.entryName = entryName;
        this.enabled   = enabled;
    }

    public static CallScopeOptions defaults() {
        return new CallScopeOptions(CallPayload.DEFAULT_ENTRY_NAME, true);
    }

    /**
     * @throws IllegalArgumentException if {@code entryName} is null or blank
     */
    public static CallScopeOptions of(String entryName, boolean enabled) {
        if (entryName == null || entryName.isBlank()) {
            throw new IllegalArgumentException("entryName must not be blank");
        }
        return new CallScopeOptions(entryName.trim(), enabled);
    }

    public String getEntryName() { return entryName; }
    public boolean isEnabled() { return enabled; }

    @Override
    public String toString() {
        return "CallScopeOptions{entryName=" + entryName + ", enabled=" + enabled + "}";
    }
}
