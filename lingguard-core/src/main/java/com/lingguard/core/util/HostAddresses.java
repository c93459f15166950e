package com.lingguard.core.util;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 主机名分类工具
 * <p>
 * 只对字面量做判断，不做 DNS 解析。IPv4 网段只匹配点分十进制字面量，
 * 形如 {@code 10.example.com} 的域名不算私有地址。
 * </p>
 */
public final class HostAddresses {

    private static final Set<String> LOOPBACK_NAMES = Set.of("localhost", "127.0.0.1", "0.0.0.0", "::1");

    private static final Pattern IPV4_LITERAL = Pattern.compile(
            "^(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}$");

    private static final List<Pattern> PRIVATE_IPV4_RANGES = List.of(
            Pattern.compile("^127\\."),
            Pattern.compile("^10\\."),
            Pattern.compile("^172\\.(1[6-9]|2[0-9]|3[0-1])\\."),
            Pattern.compile("^192\\.168\\."),
            Pattern.compile("^169\\.254\\."));

    // fe80::/10 链路本地，fc00::/7 唯一本地
    private static final List<Pattern> PRIVATE_IPV6_RANGES = List.of(
            Pattern.compile("^fe[89ab][0-9a-f]?:"),
            Pattern.compile("^f[cd][0-9a-f]{0,2}:"),
            Pattern.compile("^::1$"));

    private HostAddresses() {
    }

    /**
     * 去掉 IPv6 方括号并转小写
     */
    public static String normalize(String host) {
        if (host == null) {
            return "";
        }
        String h = host.trim().toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) {
            h = h.substring(1, h.length() - 1);
        }
        return h;
    }

    public static boolean isLoopback(String host) {
        String h = normalize(host);
        return LOOPBACK_NAMES.contains(h) || (isIpv4Literal(h) && h.startsWith("127."));
    }

    public static boolean isPrivate(String host) {
        String h = normalize(host);
        if (isIpv4Literal(h)) {
            return PRIVATE_IPV4_RANGES.stream().anyMatch(range -> range.matcher(h).find());
        }
        if (h.indexOf(':') >= 0) {
            return PRIVATE_IPV6_RANGES.stream().anyMatch(range -> range.matcher(h).find());
        }
        return false;
    }

    public static boolean isIpv4Literal(String host) {
        return IPV4_LITERAL.matcher(normalize(host)).matches();
    }
}
