package org.fractalx.callscope.security;

import com.google.common.io.BaseEncoding;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.fractalx.callscope.core.CallEvent;
import org.fractalx.callscope.core.CallPayload;
import org.fractalx.callscope.model.RpcInfo;
import org.fractalx.callscope.model.RpcType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("BasicAuthHook")
class BasicAuthHookTest {

    @Mock
    private CallEvent event;

    private BasicAuthHook hook;
    private CallPayload payload;

    @BeforeEach
    void setUp() {
        hook = new BasicAuthHook(BasicAuthOptions.builder().credential("alice", "secret").build());
        payload = new CallPayload();
        payload.setEvent(event);
        payload.setRpcInfo(RpcInfo.builder(RpcType.UNARY_SERVER).build());
    }

    @Nested
    @DisplayName("accepts")
    class Accepts {

        @Test
        @DisplayName("matching credentials")
        void matchingCredentials() {
            authorize("Bearer " + encode("alice:secret"));

            assertDoesNotThrow(() -> hook.before(payload));
            verify(event).addPair(BasicAuthHook.AUTH_USER_EVENT_KEY, "alice");
        }

        @Test
        @DisplayName("passwords containing a colon")
        void passwordWithColon() {
            hook = new BasicAuthHook(BasicAuthOptions.builder().credential("bob", "a:b").build());
            authorize("Bearer " + encode("bob:a:b"));

            assertDoesNotThrow(() -> hook.before(payload));
        }

        @Test
        @DisplayName("anything when disabled")
        void anythingWhenDisabled() {
            hook = new BasicAuthHook(BasicAuthOptions.builder().enabled(false).build());

            assertDoesNotThrow(() -> hook.before(payload));
        }
    }

    @Nested
    @DisplayName("rejects")
    class Rejects {

        @Test
        @DisplayName("a missing header before any other check")
        void missingHeader() {
            assertRejected(BasicAuthHook.MISSING_HEADER);
        }

        @Test
        @DisplayName("the Basic scheme with a prefix error, not a decoding error")
        void wrongScheme() {
            authorize("Basic " + encode("alice:secret"));

            assertRejected(BasicAuthHook.MISSING_PREFIX);
        }

        @Test
        @DisplayName("invalid base64")
        void invalidBase64() {
            authorize("Bearer not*base64");

            assertRejected(BasicAuthHook.INVALID_BASE64);
        }

        @Test
        @DisplayName("base64 without its padding")
        void unpaddedBase64() {
            hook = new BasicAuthHook(BasicAuthOptions.builder().credential("alice", "secre").build());
            // "alice:secre" encodes to "YWxpY2U6c2VjcmU="
            authorize("Bearer YWxpY2U6c2VjcmU");

            assertRejected(BasicAuthHook.INVALID_BASE64);
        }

        @Test
        @DisplayName("base64 with surplus padding")
        void overpaddedBase64() {
            authorize("Bearer " + encode("alice:secret") + "====");

            assertRejected(BasicAuthHook.INVALID_BASE64);
        }

        @Test
        @DisplayName("credentials without colon")
        void noColon() {
            authorize("Bearer " + encode("alicesecret"));

            assertRejected(BasicAuthHook.INVALID_FORMAT);
        }

        @Test
        @DisplayName("a wrong password")
        void wrongPassword() {
            hook = new BasicAuthHook(BasicAuthOptions.builder().credential("alice", "wrong").build());
            authorize("Bearer " + encode("alice:secret"));

            assertRejected(BasicAuthHook.INVALID_PASSWORD);
        }

        @Test
        @DisplayName("an unknown user")
        void unknownUser() {
            authorize("Bearer " + encode("mallory:secret"));

            assertRejected(BasicAuthHook.INVALID_PASSWORD);
        }

        @Test
        @DisplayName("only the first header value")
        void firstValueOnly() {
            authorize("Basic x");
            authorize("Bearer " + encode("alice:secret"));

            assertRejected(BasicAuthHook.MISSING_PREFIX);
        }

        private void assertRejected(String description) {
            StatusRuntimeException e = assertThrows(StatusRuntimeException.class, () -> hook.before(payload));
            assertEquals(Status.Code.UNAUTHENTICATED, e.getStatus().getCode());
            assertEquals(description, e.getStatus().getDescription());
            verify(event, never()).addPair(anyString(), anyString());
        }
    }

    @Test
    @DisplayName("never touches RpcInfo")
    void leavesRpcInfoAlone() {
        authorize("Bearer " + encode("alice:wrong"));

        assertThrows(StatusRuntimeException.class, () -> hook.before(payload));
        assertFalse(payload.getRpcInfo().orElseThrow().isCompleted());
    }

    @Test
    @DisplayName("accepts only the standard padded base64 form")
    void paddedForm() {
        assertTrue(BasicAuthHook.isPadded(""));
        assertTrue(BasicAuthHook.isPadded("YWE="));
        assertTrue(BasicAuthHook.isPadded("YQ=="));
        assertTrue(BasicAuthHook.isPadded("YWJj"));
        assertFalse(BasicAuthHook.isPadded("YQ"));
        assertFalse(BasicAuthHook.isPadded("YQ==="));
        assertFalse(BasicAuthHook.isPadded("Y==="));
    }

    @Test
    @DisplayName("applies to server calls only")
    void serverOnly() {
        assertTrue(hook.appliesTo(RpcType.UNARY_SERVER));
        assertTrue(hook.appliesTo(RpcType.STREAM_SERVER));
        assertFalse(hook.appliesTo(RpcType.UNARY_CLIENT));
        assertFalse(hook.appliesTo(RpcType.STREAM_CLIENT));
    }

    private void authorize(String value) {
        payload.getIncomingMetadata().put(BasicAuthHook.AUTHORIZATION_KEY, value);
    }

    static String encode(String raw) {
        return BaseEncoding.base64().encode(raw.getBytes(StandardCharsets.UTF_8));
    }
}
