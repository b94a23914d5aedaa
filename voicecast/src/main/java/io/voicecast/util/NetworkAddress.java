package io.voicecast.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * Finds the address other hosts on the LAN can use to reach this process.
 */
public final class NetworkAddress {
    private static final Logger log = LoggerFactory.getLogger(NetworkAddress.class);

    // Never contacted: connecting a UDP socket only selects the outbound interface.
    private static final InetSocketAddress PROBE = new InetSocketAddress("8.8.8.8", 1);

    /**
     * @return the local address of the default route, or an empty string when it cannot be found
     */
    public static String detectLocalAddress() {
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.connect(PROBE);
            InetAddress local = socket.getLocalAddress();
            if (local == null || local.isAnyLocalAddress()) {
                return "";
            }
            log.debug("[NetworkAddress] Local address is {}", local.getHostAddress());
            return local.getHostAddress();
        } catch (IOException | RuntimeException e) {
            log.debug("[NetworkAddress] Could not detect local address: {}", e.getMessage());
            return "";
        }
    }

    private NetworkAddress() {}
}
