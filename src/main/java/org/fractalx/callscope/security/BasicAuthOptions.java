package org.fractalx.callscope.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credential table of the basic-auth hook. Immutable once built.
 *
 * <pre>
 * BasicAuthOptions.builder()
 *         .credential("alice", "secret")
 *         .credentials(List.of("bob:hunter2"))
 *         .build();
 * </pre>
 */
public final class BasicAuthOptions {

    private static final Logger logger = LoggerFactory.getLogger(BasicAuthOptions.class);

    private final boolean enabled;
    private final Map<String, String> credentials;

    private BasicAuthOptions(Builder b) {
        this.enabled     = b.enabled;
        this.credentials = Collections.unmodifiableMap(new LinkedHashMap<>(b.credentials));

        if (enabled && credentials.isEmpty()) {
            logger.warn("CallScope: basic auth enabled without credentials, every call will be rejected");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEnabled() { return enabled; }

    /** Usernames mapped to passwords. */
    public Map<String, String> getCredentials() { return credentials; }

    /** Exact match of the pair against the table. */
    public boolean isAuthorized(String username, String password) {
        if (username == null || password == null) return false;
        String expected = credentials.get(username);
        if (expected == null) return false;
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                password.getBytes(StandardCharsets.UTF_8));
    }

    public static final class Builder {
        private boolean enabled = true;
        private final Map<String, String> credentials = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder enabled(boolean v) { this.enabled = v; return this; }

        /**
         * @throws IllegalArgumentException on a blank username or a null password
         */
        public Builder credential(String username, String password) {
            if (username == null || username.isBlank()) {
                throw new IllegalArgumentException("Basic auth username must not be blank");
            }
            if (password == null) {
                throw new IllegalArgumentException("Basic auth password of '" + username + "' must not be null");
            }
            credentials.put(username, password);
            return this;
        }

        /**
         * Adds {@code user:pass} entries, split on the first colon.
         *
         * @throws IllegalArgumentException on an entry without colon or with a blank username
         */
        public Builder credentials(Collection<String> pairs) {
            if (pairs == null) return this;
            for (String pair : pairs) {
                int idx = pair == null ? -1 : pair.indexOf(':');
                if (idx < 0) {
                    throw new IllegalArgumentException(
                            "Basic auth credential must look like 'user:pass', got '" + pair + "'");
                }
                credential(pair.substring(0, idx), pair.substring(idx + 1));
            }
            return this;
        }

        public BasicAuthOptions build() {
            return new BasicAuthOptions(this);
        }
    }
}
