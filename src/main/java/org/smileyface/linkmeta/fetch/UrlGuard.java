package org.smileyface.linkmeta.fetch;

import org.smileyface.linkmeta.fetch.MetadataFetchException.Reason;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.Set;

/**
 * Rejects URLs that must not be fetched on behalf of users: non-http(s) schemes and, unless
 * explicitly allowed, hosts that resolve to loopback, private, link-local or unspecified addresses.
 */
public class UrlGuard {

    private static final Set<String> BLOCKED_HOSTNAMES = Set.of("localhost", "metadata.google.internal");

    private final boolean allowPrivateHosts;

    public UrlGuard(boolean allowPrivateHosts) {
        this.allowPrivateHosts = allowPrivateHosts;
    }

    public URI validate(String rawUrl) throws MetadataFetchException {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new MetadataFetchException(Reason.INVALID_URL, "missing url");
        }
        URI uri;
        try {
            uri = new URI(rawUrl.trim());
        } catch (Exception e) {
            throw new MetadataFetchException(Reason.INVALID_URL, "parse url: " + rawUrl, e);
        }
        validate(uri);
        return uri;
    }

    public void validate(URI uri) throws MetadataFetchException {
        String scheme = uri.getScheme();
        if (scheme == null) {
            throw new MetadataFetchException(Reason.INVALID_URL, "missing url scheme");
        }
        scheme = scheme.toLowerCase();
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new MetadataFetchException(Reason.INVALID_URL, "unsupported url scheme: " + scheme);
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new MetadataFetchException(Reason.INVALID_URL, "missing url host");
        }
        if (allowPrivateHosts) {
            return;
        }
        host = host.toLowerCase();
        if (host.endsWith(".")) host = host.substring(0, host.length() - 1);
        if (BLOCKED_HOSTNAMES.contains(host) || host.endsWith(".localhost")) {
            throw new MetadataFetchException(Reason.BLOCKED, "blocked host: " + host);
        }
        InetAddress[] addresses;
        try {
            addresses = InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            throw new MetadataFetchException(Reason.DNS, "resolve host: " + host, e);
        }
        if (addresses.length == 0) {
            throw new MetadataFetchException(Reason.DNS, "resolve host: no addresses for " + host);
        }
        for (InetAddress address : addresses) {
            if (isBlocked(address)) {
                throw new MetadataFetchException(Reason.BLOCKED, "blocked ip: " + address.getHostAddress());
            }
        }
    }

    static boolean isBlocked(InetAddress address) {
        if (address == null) return true;
        if (address.isLoopbackAddress() || address.isAnyLocalAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isMCLinkLocal()) {
            return true;
        }
        // IPv6 unique local addresses (fc00::/7)
        return address instanceof Inet6Address && (address.getAddress()[0] & 0xfe) == 0xfc;
    }
}
