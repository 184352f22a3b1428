package io.leanweb.server.javalin;

import org.junit.jupiter.api.Test;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocalAddressesTest {

    @Test
    void loopbackOnlyWhenInterfacesExcluded() throws Exception {
        assertThat(LocalAddresses.bindAddresses(false)).containsExactly(InetAddress.getLoopbackAddress());
    }

    @Test
    void interfaceAddressesFollowLoopbackWithoutDuplicates() throws Exception {
        List<InetAddress> addresses = LocalAddresses.bindAddresses(true);

        assertThat(addresses.get(0)).isEqualTo(InetAddress.getLoopbackAddress());
        assertThat(addresses).doesNotHaveDuplicates();
        assertThat(addresses.subList(1, addresses.size()))
                .allMatch(a -> a instanceof Inet4Address && !a.isLoopbackAddress());
    }
}
