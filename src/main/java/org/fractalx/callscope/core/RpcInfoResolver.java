package org.fractalx.callscope.core;

import com.google.common.collect.ListMultimap;
import io.grpc.Grpc;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import org.fractalx.callscope.model.RpcInfo;
import org.fractalx.callscope.model.RpcType;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;

/**
 * Derives {@link RpcInfo} from what the transport knows about a call.
 * Nothing here fails on missing data; unknown facts resolve to empty strings.
 */
public final class RpcInfoResolver {

    // Headers set by grpc-gateway style reverse proxies
    public static final String GW_METHOD_KEY     = "x-forwarded-method";
    public static final String GW_PATH_KEY       = "x-forwarded-path";
    public static final String GW_SCHEME_KEY     = "x-forwarded-scheme";
    public static final String GW_USER_AGENT_KEY = "x-forwarded-user-agent";
    public static final String FORWARDED_FOR_KEY = "x-forwarded-for";

    private RpcInfoResolver() {
    }

    public static RpcInfo forServer(ServerCall<?, ?> call, ListMultimap<String, String> incoming) {
        MethodDescriptor<?, ?> method = call.getMethodDescriptor();
        String[] grpc = splitFullMethodName(method.getFullMethodName());

        SocketAddress peer = call.getAttributes() != null
                ? call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR)
                : null;
        String[] remote = splitPeer(peer);

        String forwardedFor = first(incoming, FORWARDED_FOR_KEY);
        if (!forwardedFor.isEmpty()) {
            // the transport port belongs to the proxy, not the client
            remote[0] = forwardedFor.split(",")[0].trim();
            remote[1] = "";
        }

        return gatewayFields(RpcInfo.builder(RpcType.forServer(method.getType())), incoming)
                .grpcService(grpc[0])
                .grpcMethod(grpc[1])
                .remoteIp(remote[0])
                .remotePort(remote[1])
                .build();
    }

    public static RpcInfo forClient(MethodDescriptor<?, ?> method, String authority,
                                    ListMultimap<String, String> incoming) {
        String[] grpc = splitFullMethodName(method.getFullMethodName());
        String[] remote = splitHostPort(authority);

        return gatewayFields(RpcInfo.builder(RpcType.forClient(method.getType())), incoming)
                .grpcService(grpc[0])
                .grpcMethod(grpc[1])
                .remoteIp(remote[0])
                .remotePort(remote[1])
                .build();
    }

    // ── Parsing helpers ───────────────────────────────────────────────────────

    /**
     * Splits {@code package.Service/Method} (optionally with a leading slash) on the last
     * slash into {@code [service, method]}.
     */
    public static String[] splitFullMethodName(String fullMethodName) {
        if (fullMethodName == null || fullMethodName.isEmpty()) {
            return new String[] {"", ""};
        }
        String name = fullMethodName.startsWith("/") ? fullMethodName.substring(1) : fullMethodName;
        int idx = name.lastIndexOf('/');
        if (idx < 0) {
            return new String[] {"", name};
        }
        return new String[] {name.substring(0, idx), name.substring(idx + 1)};
    }

    /**
     * Splits {@code host:port} on the last colon into {@code [host, port]}. Bracketed IPv6
     * literals lose their brackets; an address without a port yields an empty port.
     */
    public static String[] splitHostPort(String address) {
        if (address == null || address.isEmpty()) {
            return new String[] {"", ""};
        }
        String addr = address.startsWith("/") ? address.substring(1) : address;

        if (addr.startsWith("[")) {
            int close = addr.indexOf(']');
            if (close > 0) {
                String host = addr.substring(1, close);
                String rest = addr.substring(close + 1);
                return new String[] {host, rest.startsWith(":") ? rest.substring(1) : ""};
            }
        }

        int idx = addr.lastIndexOf(':');
        // bare IPv6 literal without port
        if (idx < 0 || addr.indexOf(':') != idx) {
            return new String[] {addr, ""};
        }
        return new String[] {addr.substring(0, idx), addr.substring(idx + 1)};
    }

    private static String[] splitPeer(SocketAddress peer) {
        if (peer instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) peer;
            return new String[] {inet.getHostString(), String.valueOf(inet.getPort())};
        }
        return splitHostPort(peer != null ? peer.toString() : null);
    }

    private static RpcInfo.Builder gatewayFields(RpcInfo.Builder builder,
                                                 ListMultimap<String, String> incoming) {
        return builder
                .gwMethod(first(incoming, GW_METHOD_KEY))
                .gwPath(first(incoming, GW_PATH_KEY))
                .gwScheme(first(incoming, GW_SCHEME_KEY))
                .gwUserAgent(first(incoming, GW_USER_AGENT_KEY));
    }

    private static String first(ListMultimap<String, String> md, String key) {
        if (md == null) return "";
        List<String> values = md.get(key);
        return values.isEmpty() ? "" : values.get(0);
    }
}
