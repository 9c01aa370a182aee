package com.sunny.procurehub.platform.security;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * 客户端IP解析组件
 * 仅当直连地址属于可信代理时才读取 X-Forwarded-For，取最右侧的非可信地址
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Component
public class ClientIpResolver {

    public static final String UNKNOWN = "unknown";

    private static final Pattern IP_LITERAL = Pattern.compile("^[0-9a-fA-F:.]+$");

    private final List<TrustedRange> trustedRanges;

    public ClientIpResolver(PlatformSecurityProperties securityProperties) {
        this.trustedRanges = securityProperties.getTrustedProxies().stream()
                .map(TrustedRange::parse)
                .filter(range -> range != null)
                .toList();
    }

    public String resolve(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        InetAddress remote = parse(request.getRemoteAddr());
        if (remote == null) {
            return UNKNOWN;
        }
        if (!isTrusted(remote)) {
            return remote.getHostAddress();
        }

        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String[] hops = forwarded.split(",");
            for (int i = hops.length - 1; i >= 0; i--) {
                InetAddress hop = parse(hops[i]);
                if (hop != null && !isTrusted(hop)) {
                    return hop.getHostAddress();
                }
            }
        }
        return remote.getHostAddress();
    }

    private boolean isTrusted(InetAddress address) {
        for (TrustedRange range : trustedRanges) {
            if (range.contains(address)) {
                return true;
            }
        }
        return false;
    }

    static InetAddress parse(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.startsWith("[") && value.indexOf(']') > 0) {
            value = value.substring(1, value.indexOf(']'));
        } else if (value.indexOf(':') == value.lastIndexOf(':') && value.indexOf(':') > 0 && value.contains(".")) {
            // IPv4 带端口
            value = value.substring(0, value.indexOf(':'));
        }
        int zone = value.indexOf('%');
        if (zone > 0) {
            value = value.substring(0, zone);
        }
        if (value.isEmpty() || !IP_LITERAL.matcher(value).matches()) {
            return null;
        }
        try {
            return InetAddress.getByName(value);
        } catch (UnknownHostException ex) {
            return null;
        }
    }

    private record TrustedRange(byte[] network, int prefixBits) {

        static TrustedRange parse(String rule) {
            if (rule == null || rule.isBlank()) {
                return null;
            }
            String[] parts = rule.trim().split("/", 2);
            InetAddress base = ClientIpResolver.parse(parts[0]);
            if (base == null) {
                return null;
            }
            int maxBits = base.getAddress().length * 8;
            int prefix = maxBits;
            if (parts.length == 2) {
                try {
                    prefix = Integer.parseInt(parts[1].trim());
                } catch (NumberFormatException ex) {
                    return null;
                }
            }
            if (prefix < 0 || prefix > maxBits) {
                return null;
            }
            return new TrustedRange(base.getAddress(), prefix);
        }

        boolean contains(InetAddress address) {
            byte[] candidate = address.getAddress();
            if (candidate.length != network.length) {
                return false;
            }
            int fullBytes = prefixBits / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (candidate[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefixBits % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }
}
