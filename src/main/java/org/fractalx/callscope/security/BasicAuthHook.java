package org.fractalx.callscope.security;

import com.google.common.io.BaseEncoding;
import io.grpc.Status;
import org.fractalx.callscope.core.CallHook;
import org.fractalx.callscope.core.CallPayload;
import org.fractalx.callscope.model.RpcType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Server hook checking {@code authorization: Bearer <base64(user:pass)>} against
 * {@link BasicAuthOptions}. Any failure aborts the call with {@code UNAUTHENTICATED}.
 *
 * <p>The accepted scheme token is {@code "Bearer "} while the prefix error reads
 * {@code "Basic "}; both are kept as clients already depend on them.
 */
public class BasicAuthHook implements CallHook {

    private static final Logger logger = LoggerFactory.getLogger(BasicAuthHook.class);

    public static final String AUTHORIZATION_KEY = "authorization";
    public static final String SCHEME_PREFIX = "Bearer ";
    public static final String AUTH_USER_EVENT_KEY = "authUser";

    static final String MISSING_HEADER   = "Missing auth header";
    static final String MISSING_PREFIX   = "Missing \"Basic \" prefix in \"Authorization\" header";
    static final String INVALID_BASE64   = "Invalid base64 in header";
    static final String INVALID_FORMAT   = "Invalid basic auth format";
    static final String INVALID_PASSWORD = "Invalid username or password";

    private final BasicAuthOptions options;

    public BasicAuthHook(BasicAuthOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("BasicAuthOptions must not be null");
        }
        this.options = options;
        logger.info("CallScope: basic auth hook {} ({} credential(s))",
                options.isEnabled() ? "ENABLED" : "DISABLED", options.getCredentials().size());
    }

    @Override
    public boolean appliesTo(RpcType type) {
        return type.isServer();
    }

    @Override
    public void before(CallPayload payload) {
        if (!options.isEnabled()) return;

        List<String> values = payload.getIncomingMetadata().get(AUTHORIZATION_KEY);
        if (values.isEmpty()) {
            throw unauthenticated(MISSING_HEADER);
        }

        String credRaw = values.get(0);
        if (!credRaw.startsWith(SCHEME_PREFIX)) {
            throw unauthenticated(MISSING_PREFIX);
        }

        String encoded = credRaw.substring(SCHEME_PREFIX.length());
        if (!isPadded(encoded)) {
            throw unauthenticated(INVALID_BASE64);
        }

        byte[] credBytes;
        try {
            credBytes = BaseEncoding.base64().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw unauthenticated(INVALID_BASE64);
        }

        String cred = new String(credBytes, StandardCharsets.UTF_8);
        int idx = cred.indexOf(':');
        if (idx < 0) {
            throw unauthenticated(INVALID_FORMAT);
        }

        String username = cred.substring(0, idx);
        if (!options.isAuthorized(username, cred.substring(idx + 1))) {
            payload.getLogger().debug("Basic auth rejected user '{}'", username);
            throw unauthenticated(INVALID_PASSWORD);
        }

        payload.getEvent().addPair(AUTH_USER_EVENT_KEY, username);
        payload.getLogger().debug("Basic auth accepted user '{}'", username);
    }

    /**
     * Standard padded form only: whole 4-char groups and at most two trailing {@code '='}.
     * {@link BaseEncoding#decode} alone also accepts unpadded and over-padded input.
     */
    static boolean isPadded(String encoded) {
        if (encoded.length() % 4 != 0) return false;
        int pad = 0;
        for (int i = encoded.length() - 1; i >= 0 && encoded.charAt(i) == '='; i--) {
            pad++;
        }
        return pad <= 2;
    }

    private static RuntimeException unauthenticated(String description) {
        return Status.UNAUTHENTICATED.withDescription(description).asRuntimeException();
    }
}
