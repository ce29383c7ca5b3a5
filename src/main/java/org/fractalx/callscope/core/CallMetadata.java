package org.fractalx.callscope.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.io.BaseEncoding;
import io.grpc.Context;
import io.grpc.Metadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Bridge between gRPC {@link Metadata} and the string multimaps cached in a {@link CallPayload}.
 *
 * <p>Binary ({@code -bin}) headers are kept base64-encoded in the multimaps and decoded
 * again when written back to the transport.
 */
public final class CallMetadata {

    private static final Logger logger = LoggerFactory.getLogger(CallMetadata.class);

    public static final String REQUEST_ID_KEY = "x-request-id";

    private static final BaseEncoding BASE64 = BaseEncoding.base64();

    private CallMetadata() {
    }

    public static ListMultimap<String, String> newMetadata() {
        return MultimapBuilder.linkedHashKeys().arrayListValues().build();
    }

    public static ListMultimap<String, String> copyOf(ListMultimap<String, String> source) {
        ListMultimap<String, String> copy = newMetadata();
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }

    // ── Transport → payload ───────────────────────────────────────────────────

    /** Copies every header of {@code headers}; {@code null} yields an empty map. */
    public static ListMultimap<String, String> readIncoming(Metadata headers) {
        ListMultimap<String, String> md = newMetadata();
        if (headers == null) {
            return md;
        }
        for (String name : headers.keys()) {
            if (name.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                Iterable<byte[]> values =
                        headers.getAll(Metadata.Key.of(name, Metadata.BINARY_BYTE_MARSHALLER));
                if (values != null) {
                    for (byte[] v : values) md.put(name, BASE64.encode(v));
                }
            } else {
                Iterable<String> values =
                        headers.getAll(Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER));
                if (values != null) {
                    for (String v : values) md.put(name, v);
                }
            }
        }
        return md;
    }

    // ── Payload → transport ───────────────────────────────────────────────────

    /** Appends every entry of {@code source} onto {@code target}, skipping transport-reserved names. */
    public static void writeTo(ListMultimap<String, String> source, Metadata target) {
        if (source == null || target == null) return;
        for (Map.Entry<String, String> e : source.entries()) {
            put(target, e.getKey(), e.getValue());
        }
    }

    /** Like {@link #writeTo} but leaves alone every key {@code target} already carries. */
    public static void mergeAbsent(ListMultimap<String, String> source, Metadata target) {
        if (source == null || target == null) return;
        Set<String> explicit = target.keys();
        for (Map.Entry<String, String> e : source.entries()) {
            if (!explicit.contains(e.getKey())) {
                put(target, e.getKey(), e.getValue());
            }
        }
    }

    static boolean isReserved(String name) {
        return name.startsWith(":")
                || name.startsWith("grpc-")
                || name.equals("content-type")
                || name.equals("te")
                || name.equals("user-agent");
    }

    private static void put(Metadata target, String name, String value) {
        if (isReserved(name) || value == null) return;
        try {
            if (name.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                target.put(Metadata.Key.of(name, Metadata.BINARY_BYTE_MARSHALLER), BASE64.decode(value));
            } else {
                target.put(Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER), value);
            }
        } catch (IllegalArgumentException e) {
            logger.warn("Dropping header '{}' that cannot be sent over gRPC: {}", name, e.getMessage());
        }
    }

    // ── Context-level access ──────────────────────────────────────────────────

    /** Appends {@code value} under {@code key}; earlier values of the key are kept. */
    public static void addToOutgoing(Context ctx, String key, String value) {
        if (!CallContexts.containsPayload(ctx) || key == null || value == null) return;
        CallContexts.resolve(ctx).getOutgoingMetadata().put(normalize(key), value);
    }

    public static List<String> getIncomingValues(Context ctx, String key) {
        if (key == null) return ImmutableList.of();
        return ImmutableList.copyOf(CallContexts.getIncomingMetadata(ctx).get(normalize(key)));
    }

    public static List<String> getOutgoingValues(Context ctx, String key) {
        if (key == null) return ImmutableList.of();
        return ImmutableList.copyOf(CallContexts.getOutgoingMetadata(ctx).get(normalize(key)));
    }

    /**
     * Replaces the request id in the outgoing metadata with a fresh one and returns it.
     * Returns an empty string when {@code ctx} carries no payload.
     */
    public static String setRequestId(Context ctx) {
        if (!CallContexts.containsPayload(ctx)) {
            return "";
        }
        return setRequestId(CallContexts.resolve(ctx));
    }

    public static String setRequestId(CallPayload payload) {
        String requestId = UUID.randomUUID().toString();
        payload.getOutgoingMetadata().replaceValues(REQUEST_ID_KEY, ImmutableList.of(requestId));
        return requestId;
    }

    /** The request id of the call, or an empty string. */
    public static String getRequestId(Context ctx) {
        List<String> ids = getOutgoingValues(ctx, REQUEST_ID_KEY);
        return ids.isEmpty() ? "" : ids.get(0);
    }

    // ── Nested client calls ───────────────────────────────────────────────────

    /**
     * Outgoing metadata of a client call made from within {@code parent}: the parent's
     * incoming headers, where every key of the parent's outgoing headers replaces the
     * inherited values of that key.
     */
    public static ListMultimap<String, String> inherit(CallPayload parent) {
        ListMultimap<String, String> md = copyOf(parent.getIncomingMetadata());
        ListMultimap<String, String> overrides = parent.getOutgoingMetadata();
        for (String key : overrides.keySet()) {
            md.replaceValues(key, overrides.get(key));
        }
        return md;
    }

    static String normalize(String key) {
        return key.toLowerCase(Locale.ROOT);
    }
}
