package com.whereq.launcher.model;

import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import lombok.Value;

/**
 * Network address of a Spark standalone cluster master.
 */
@Value
public class ClusterEndpoint {

    public static final String SCHEME = "spark";

    private static final String SCHEME_SEPARATOR = "://";
    private static final String SCHEME_PREFIX = SCHEME + SCHEME_SEPARATOR;

    String host;
    int port;

    /**
     * Parse a master address given as {@code host:port} or {@code spark://host:port}.
     *
     * @param address the address to parse
     * @return the validated endpoint
     * @throws LaunchException with {@link ErrorKind#INVALID_ENDPOINT} if the address is not a
     *                         well-formed host and port
     */
    public static ClusterEndpoint parse(String address) {
        if (address == null || address.isBlank()) {
            throw new LaunchException(ErrorKind.INVALID_ENDPOINT, "Cluster endpoint must not be empty", address);
        }

        String authority = address;
        if (address.contains(SCHEME_SEPARATOR)) {
            if (!address.startsWith(SCHEME_PREFIX)) {
                throw new LaunchException(ErrorKind.INVALID_ENDPOINT,
                        "Unsupported cluster endpoint scheme, expected " + SCHEME_PREFIX + "host:port", address);
            }
            authority = address.substring(SCHEME_PREFIX.length());
        }

        HostAndPort hostAndPort;
        try {
            hostAndPort = HostAndPort.fromString(authority);
        } catch (IllegalArgumentException e) {
            throw new LaunchException(ErrorKind.INVALID_ENDPOINT,
                    "Malformed cluster endpoint: " + e.getMessage(), address, e);
        }

        if (!hostAndPort.hasPort()) {
            throw new LaunchException(ErrorKind.INVALID_ENDPOINT, "Cluster endpoint must include a port", address);
        }
        if (hostAndPort.getPort() < 1) {
            throw new LaunchException(ErrorKind.INVALID_ENDPOINT, "Cluster port must be between 1 and 65535", address);
        }

        String host = hostAndPort.getHost();
        if (!isValidHost(host)) {
            throw new LaunchException(ErrorKind.INVALID_ENDPOINT, "Invalid cluster host '" + host + "'", address);
        }

        return new ClusterEndpoint(host, hostAndPort.getPort());
    }

    private static boolean isValidHost(String host) {
        return !host.isEmpty() && (InetAddresses.isInetAddress(host) || InternetDomainName.isValid(host));
    }

    /**
     * Master URL in the form spark-submit expects
     */
    public String toMasterUrl() {
        return SCHEME_PREFIX + HostAndPort.fromParts(host, port);
    }

    @Override
    public String toString() {
        return toMasterUrl();
    }
}
