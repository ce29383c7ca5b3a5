package org.fractalx.callscope.config;

import org.fractalx.callscope.core.CallPayload;

import java.util.ArrayList;
import java.util.List;

/**
 * CallScope configuration. Plain POJO, no Spring annotations on the class.
 * Bound via @Bean + @ConfigurationProperties in CallScopeAutoConfiguration.
 */
public class CallScopeConfig {

    private boolean enabled = true;
    private String entryName = CallPayload.DEFAULT_ENTRY_NAME;

    private final SideConfig server = new SideConfig();
    private final SideConfig client = new SideConfig();
    private final BasicAuthConfig basicAuth = new BasicAuthConfig();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean v) { this.enabled = v; }
    public String getEntryName() { return entryName; }
    public void setEntryName(String v) { this.entryName = v; }
    public SideConfig getServer() { return server; }
    public SideConfig getClient() { return client; }
    public BasicAuthConfig getBasicAuth() { return basicAuth; }

    /** Options of the server or client interceptor, combining the global switch with the side's own. */
    public CallScopeOptions toOptions(SideConfig side) {
        return CallScopeOptions.of(entryName, enabled && side.isEnabled());
    }

    // ── Interceptor sides ─────────────────────────────────────────────────────

    public static class SideConfig {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }
    }

    // ── Basic auth ────────────────────────────────────────────────────────────

    public static class BasicAuthConfig {
        private boolean enabled = false;
        /** Entries of the form user:pass */
        private List<String> credentials = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }
        public List<String> getCredentials() { return credentials; }
        public void setCredentials(List<String> v) { this.credentials = v; }
    }
}
