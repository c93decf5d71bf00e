package io.cleanapi.http;

import io.cleanapi.core.spi.ConnectivityProbe;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Enumeration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports the host as online when at least one non-loopback network interface is up. This is
 * the closest JVM equivalent of a browser's online flag; it says nothing about whether the
 * server itself is reachable.
 */
public final class NetworkInterfaceConnectivityProbe implements ConnectivityProbe {

    private static final Logger LOG = LoggerFactory.getLogger(NetworkInterfaceConnectivityProbe.class);

    @Override
    public boolean isOnline() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            if (interfaces == null) {
                return false;
            }
            while (interfaces.hasMoreElements()) {
                NetworkInterface candidate = interfaces.nextElement();
                if (candidate.isUp() && !candidate.isLoopback()) {
                    return true;
                }
            }
            return false;
        } catch (SocketException e) {
            // unknown state: report online so the failure surfaces as no_server_response
            LOG.warn("Could not enumerate network interfaces, assuming online", e);
            return true;
        }
    }
}
