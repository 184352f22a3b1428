package io.leanweb.server.javalin;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Discovers the addresses the server listens on.
 */
public final class LocalAddresses {
    private LocalAddresses() {}

    /**
     * IPv4 addresses of every network interface that is up, loopback excluded.
     */
    public static List<InetAddress> interfaceIpv4() throws SocketException {
        List<InetAddress> out = new ArrayList<>();
        for (NetworkInterface nif : Collections.list(NetworkInterface.getNetworkInterfaces())) {
            if (!nif.isUp() || nif.isLoopback()) continue;
            for (InetAddress address : Collections.list(nif.getInetAddresses())) {
                if (address instanceof Inet4Address && !address.isLoopbackAddress()) {
                    out.add(address);
                }
            }
        }
        return out;
    }

    /**
     * {@code localhost}, followed by the interface addresses when {@code includeInterfaces} is set.
     */
    public static List<InetAddress> bindAddresses(boolean includeInterfaces) throws SocketException {
        Set<InetAddress> out = new LinkedHashSet<>();
        out.add(InetAddress.getLoopbackAddress());
        if (includeInterfaces) {
            out.addAll(interfaceIpv4());
        }
        return List.copyOf(out);
    }
}
