package me.kestrel.agent.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.kestrel.agent.domain.model.UrlValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Guards outbound HTTP requests against server-side request forgery.
 *
 * <p>
 * A URL is accepted only if all of the following hold:
 * <ul>
 * <li>the scheme is http or https</li>
 * <li>it has a hostname that is not on the static block list (localhost and
 * cloud metadata endpoints)</li>
 * <li>the hostname resolves to at least one address</li>
 * <li>none of the resolved addresses falls into a private, loopback,
 * link-local or carrier-grade NAT range</li>
 * </ul>
 *
 * <p>
 * The fetch pipeline calls this before every request, including each redirect
 * hop, and resolves through {@link #resolvePublic(String)} when it connects.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UrlValidator {

    static final Set<String> BLOCKED_HOSTNAMES = Set.of(
            "localhost",
            "metadata.google.internal",
            "169.254.169.254");

    private static final List<Cidr> PRIVATE_RANGES = List.of(
            Cidr.parse("0.0.0.0/8"),
            Cidr.parse("127.0.0.0/8"),
            Cidr.parse("10.0.0.0/8"),
            Cidr.parse("100.64.0.0/10"),
            Cidr.parse("172.16.0.0/12"),
            Cidr.parse("192.168.0.0/16"),
            Cidr.parse("169.254.0.0/16"),
            Cidr.parse("::/128"),
            Cidr.parse("::1/128"),
            Cidr.parse("fc00::/7"),
            Cidr.parse("fe80::/10"));

    private static final Pattern IPV4_LITERAL = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    private final HostResolver hostResolver;

    public UrlValidationResult validate(String url) {
        URI uri;
        try {
            uri = new URI(url == null ? "" : url.trim());
        } catch (URISyntaxException e) {
            return UrlValidationResult.rejected("Invalid URL: " + e.getReason());
        }

        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : null;
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return UrlValidationResult.rejected(
                    "Only http/https allowed, got '" + (scheme != null ? scheme : "none") + "'");
        }
        if (uri.getRawAuthority() == null || uri.getRawAuthority().isBlank()) {
            return UrlValidationResult.rejected("Missing domain");
        }

        String host = normalizeHost(uri.getHost());
        if (host == null) {
            return UrlValidationResult.rejected("Missing hostname");
        }
        if (BLOCKED_HOSTNAMES.contains(host)) {
            return UrlValidationResult.rejected("Access to " + host + " is blocked");
        }

        List<InetAddress> addresses;
        try {
            addresses = resolve(host);
        } catch (UnknownHostException e) {
            log.debug("[WebFetch] Could not resolve {}: {}", host, e.getMessage());
            return UrlValidationResult.rejected("Could not resolve hostname");
        }
        if (addresses.isEmpty()) {
            return UrlValidationResult.rejected("Could not resolve hostname");
        }

        for (InetAddress address : addresses) {
            if (isPrivate(address)) {
                log.warn("[WebFetch] Blocked {} resolving to internal address {}", host, address.getHostAddress());
                return UrlValidationResult.rejected("Access to private/internal addresses is blocked");
            }
        }
        return UrlValidationResult.ok();
    }

    /**
     * Resolves {@code host} for a connection that is about to be opened and
     * fails if any answer is internal. The HTTP client uses this as its DNS, so
     * the addresses it connects to are the ones checked here even when a second
     * lookup answers differently from the one {@link #validate(String)} saw.
     *
     * @throws UnknownHostException
     *             if the host does not resolve or resolves to an internal
     *             address
     */
    public List<InetAddress> resolvePublic(String hostname) throws UnknownHostException {
        String host = normalizeHost(hostname);
        if (host == null || BLOCKED_HOSTNAMES.contains(host)) {
            throw new UnknownHostException("Access to " + hostname + " is blocked");
        }
        List<InetAddress> addresses = resolve(host);
        if (addresses.isEmpty()) {
            throw new UnknownHostException("Could not resolve " + host);
        }
        for (InetAddress address : addresses) {
            if (isPrivate(address)) {
                log.warn("[WebFetch] Blocked connection to {} at internal address {}", host,
                        address.getHostAddress());
                throw new UnknownHostException("Access to private/internal addresses is blocked: " + host);
            }
        }
        return addresses;
    }

    /**
     * Checks an address against the private, loopback, link-local and CGNAT
     * ranges. IPv4-mapped IPv6 addresses are checked as IPv4.
     */
    public static boolean isPrivate(InetAddress address) {
        byte[] bytes = unmapIpv4(address.getAddress());
        for (Cidr range : PRIVATE_RANGES) {
            if (range.contains(bytes)) {
                return true;
            }
        }
        return false;
    }

    private List<InetAddress> resolve(String host) throws UnknownHostException {
        if (IPV4_LITERAL.matcher(host).matches() || host.indexOf(':') >= 0) {
            // Literal addresses are parsed, not looked up
            return List.of(InetAddress.getByName(host));
        }
        return hostResolver.resolve(host);
    }

    private static String normalizeHost(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("[") && normalized.endsWith("]")) {
            normalized = normalized.substring(1, normalized.length() - 1);
        }
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.isEmpty() ? null : normalized;
    }

    private static byte[] unmapIpv4(byte[] bytes) {
        if (bytes.length != 16) {
            return bytes;
        }
        for (int i = 0; i < 10; i++) {
            if (bytes[i] != 0) {
                return bytes;
            }
        }
        if ((bytes[10] & 0xff) == 0xff && (bytes[11] & 0xff) == 0xff) {
            return Arrays.copyOfRange(bytes, 12, 16);
        }
        return bytes;
    }

    /**
     * An address range in CIDR notation, IPv4 or IPv6.
     */
    record Cidr(byte[] network, int prefixLength) {

        static Cidr parse(String notation) {
            int slash = notation.indexOf('/');
            String address = notation.substring(0, slash);
            try {
                byte[] network = address.indexOf(':') >= 0
                        ? Inet6Address.getByName(address).getAddress()
                        : InetAddress.getByName(address).getAddress();
                return new Cidr(network, Integer.parseInt(notation.substring(slash + 1)));
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("Invalid CIDR: " + notation, e);
            }
        }

        boolean contains(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xff << (8 - remainingBits)) & 0xff;
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }
}
