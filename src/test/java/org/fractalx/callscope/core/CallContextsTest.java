package org.fractalx.callscope.core;

import io.grpc.Context;
import org.fractalx.callscope.model.RpcInfo;
import org.fractalx.callscope.model.RpcType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("CallContexts")
class CallContextsTest {

    @Nested
    @DisplayName("without attached payload")
    class WithoutPayload {

        @Test
        @DisplayName("null context yields defaults")
        void nullContextYieldsDefaults() {
            assertNotNull(CallContexts.resolve(null));
            assertSame(NOPLogger.NOP_LOGGER, CallContexts.getLogger(null));
            assertSame(NoopCallEvent.INSTANCE, CallContexts.getEvent(null));
            assertEquals(CallPayload.DEFAULT_ENTRY_NAME, CallContexts.getEntryName(null));
            assertNotNull(CallContexts.getIncomingMetadata(null));
            assertNotNull(CallContexts.getOutgoingMetadata(null));
            assertTrue(CallContexts.getRpcInfo(null).isEmpty());
        }

        @Test
        @DisplayName("root context yields defaults")
        void rootContextYieldsDefaults() {
            Context ctx = Context.ROOT;

            assertFalse(CallContexts.containsPayload(ctx));
            assertNotNull(CallContexts.getLogger(ctx));
            assertNotNull(CallContexts.getEvent(ctx));
            assertFalse(CallContexts.getEntryName(ctx).isEmpty());
            assertTrue(CallContexts.getIncomingMetadata(ctx).isEmpty());
            assertTrue(CallContexts.getOutgoingMetadata(ctx).isEmpty());
        }

        @Test
        @DisplayName("setters are ignored")
        void settersAreIgnored() {
            Logger logger = LoggerFactory.getLogger("ut");
            CallContexts.setLogger(Context.ROOT, logger);
            CallContexts.setEvent(null, mock(CallEvent.class));

            assertSame(NOPLogger.NOP_LOGGER, CallContexts.getLogger(Context.ROOT));
            assertSame(NoopCallEvent.INSTANCE, CallContexts.getEvent(Context.ROOT));
        }
    }

    @Nested
    @DisplayName("with attached payload")
    class WithPayload {

        @Test
        @DisplayName("resolve returns the attached instance")
        void resolveReturnsAttached() {
            CallPayload payload = new CallPayload();
            Context ctx = CallContexts.attach(Context.ROOT, payload);

            assertTrue(CallContexts.containsPayload(ctx));
            assertSame(payload, CallContexts.resolve(ctx));
        }

        @Test
        @DisplayName("attach does not change the base context")
        void attachReturnsChild() {
            Context base = Context.ROOT;
            CallContexts.attach(base, new CallPayload());

            assertFalse(CallContexts.containsPayload(base));
        }

        @Test
        @DisplayName("null base attaches to the current context")
        void nullBaseUsesCurrent() {
            Context ctx = CallContexts.attach(null, null);

            assertTrue(CallContexts.containsPayload(ctx));
        }

        @Test
        @DisplayName("current() sees the payload while the context is attached")
        void currentSeesAttachedPayload() throws Exception {
            CallPayload payload = new CallPayload();
            payload.setEntryName("ut-entry");

            String name = CallContexts.attach(Context.ROOT, payload)
                    .call(() -> CallContexts.current().getEntryName());

            assertEquals("ut-entry", name);
        }

        @Test
        @DisplayName("unset fields still read as defaults")
        void unsetFieldsReadAsDefaults() {
            Context ctx = CallContexts.newContext();

            assertSame(NOPLogger.NOP_LOGGER, CallContexts.getLogger(ctx));
            assertSame(NoopCallEvent.INSTANCE, CallContexts.getEvent(ctx));
            assertEquals(CallPayload.DEFAULT_ENTRY_NAME, CallContexts.getEntryName(ctx));
            assertNotNull(CallContexts.getIncomingMetadata(ctx));
            assertNotNull(CallContexts.getOutgoingMetadata(ctx));
            assertTrue(CallContexts.getRpcInfo(ctx).isEmpty());
        }

        @Test
        @DisplayName("null fields fall back to defaults")
        void nullFieldsFallBack() {
            CallPayload payload = new CallPayload();
            payload.setLogger(null);
            payload.setEvent(null);
            payload.setEntryName(" ");
            payload.setIncomingMetadata(null);
            payload.setOutgoingMetadata(null);
            Context ctx = CallContexts.attach(Context.ROOT, payload);

            assertNotNull(CallContexts.getLogger(ctx));
            assertNotNull(CallContexts.getEvent(ctx));
            assertEquals(CallPayload.DEFAULT_ENTRY_NAME, CallContexts.getEntryName(ctx));
            assertNotNull(CallContexts.getIncomingMetadata(ctx));
            assertNotNull(CallContexts.getOutgoingMetadata(ctx));
        }

        @Test
        @DisplayName("setters mutate the shared payload in place")
        void settersMutateInPlace() {
            CallPayload payload = new CallPayload();
            Context ctx = CallContexts.attach(Context.ROOT, payload);
            Logger logger = LoggerFactory.getLogger("ut");
            CallEvent event = mock(CallEvent.class);

            CallContexts.setLogger(ctx, logger);
            CallContexts.setEvent(ctx, event);

            assertSame(logger, payload.getLogger());
            assertSame(event, CallContexts.getEvent(ctx));
        }

        @Test
        @DisplayName("metadata written through a default map sticks")
        void defaultMetadataMapIsStored() {
            Context ctx = CallContexts.newContext();
            CallContexts.getIncomingMetadata(ctx).put("k", "v");

            assertEquals("v", CallContexts.getIncomingMetadata(ctx).get("k").get(0));
        }

        @Test
        @DisplayName("rpc info is returned once set")
        void rpcInfoReturned() {
            RpcInfo info = RpcInfo.builder(RpcType.UNARY_SERVER).build();
            CallPayload payload = new CallPayload();
            payload.setRpcInfo(info);

            assertSame(info, CallContexts.getRpcInfo(CallContexts.attach(Context.ROOT, payload)).orElseThrow());
        }
    }
}
