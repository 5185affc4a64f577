package com.example.webhookpipeline.utils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * SSRF 校验：出站端点不得指向内网、回环或元数据地址。
 * 域名解析出的所有 IP 只要有一个命中黑名单即拒绝。
 */
@Component
@Slf4j
public class UrlValidator {

    private final List<String> blockedEntries;

    public UrlValidator(
            @Value("${app.security.ssrf.blocked-ips:127.0.0.1,localhost,10.0.0.0/8,172.16.0.0/12,192.168.0.0/16,169.254.169.254}") String blockedIpsConfig) {
        this.blockedEntries = Arrays.stream(blockedIpsConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    /**
     * 校验端点 URL。
     *
     * @param url 端点地址
     * @return 规范化后的 URI
     * @throws IllegalArgumentException URL 不安全或无法解析
     */
    public URI validate(String url) {
        URI uri;
        try {
            uri = URI.create(url).normalize();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw reject(url, "Malformed URL");
        }

        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw reject(url, "Blocked protocol: " + scheme);
        }

        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw reject(url, "Host cannot be empty");
        }
        String normalizedHost = host.toLowerCase(Locale.ROOT);
        if (normalizedHost.equals("0.0.0.0") || normalizedHost.equals("::") || normalizedHost.equals("[::]")) {
            throw reject(url, "Blocked wildcard address: " + host);
        }
        if (blockedEntries.contains(normalizedHost)) {
            throw reject(url, "Blocked host: " + host);
        }

        InetAddress[] addresses;
        try {
            addresses = InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            throw reject(url, "Could not resolve host: " + host);
        }
        for (InetAddress address : addresses) {
            if (isBlockedAddress(address)) {
                throw reject(url, "Blocked IP detected: " + address.getHostAddress());
            }
        }
        return uri;
    }

    public boolean isSafeUrl(String url) {
        try {
            validate(url);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private IllegalArgumentException reject(String url, String reason) {
        log.warn("[SSRF] Rejected {}: {}", url, reason);
        return new IllegalArgumentException(reason);
    }

    private boolean isBlockedAddress(InetAddress address) {
        if (address.isLoopbackAddress() || address.isSiteLocalAddress() || address.isLinkLocalAddress()
                || address.isMulticastAddress() || address.isAnyLocalAddress()) {
            return true;
        }

        byte[] bytes = address.getAddress();
        // IPv6 ULA fc00::/7
        if (bytes.length == 16 && (bytes[0] & 0xFE) == 0xFC) {
            return true;
        }

        String ip = address.getHostAddress();
        for (String blocked : blockedEntries) {
            if (blocked.contains("/") ? inCidr(bytes, blocked) : ip.equals(blocked)) {
                return true;
            }
        }
        return false;
    }

    private boolean inCidr(byte[] addressBytes, String cidr) {
        String[] parts = cidr.split("/");
        byte[] subnet;
        int bits;
        try {
            subnet = InetAddress.getByName(parts[0]).getAddress();
            bits = Integer.parseInt(parts[1]);
        } catch (UnknownHostException | NumberFormatException e) {
            log.warn("[SSRF] Ignoring malformed CIDR entry {}", cidr);
            return false;
        }
        if (subnet.length != addressBytes.length) {
            return false;
        }

        int fullBytes = bits / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (addressBytes[i] != subnet[i])
                return false;
        }
        int remainingBits = bits % 8;
        if (remainingBits > 0) {
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (addressBytes[fullBytes] & mask) == (subnet[fullBytes] & mask);
        }
        return true;
    }
}
