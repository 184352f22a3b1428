package io.leanweb.server.javalin;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JavalinInboundConnectionTest {

    @Test
    void ipv4HostIsUsedAsIs() {
        assertThat(JavalinInboundConnection.hostPort("192.168.1.5", 8080)).isEqualTo("192.168.1.5:8080");
    }

    @Test
    void ipv6HostIsBracketed() {
        assertThat(JavalinInboundConnection.hostPort("0:0:0:0:0:0:0:1", 80)).isEqualTo("[0:0:0:0:0:0:0:1]:80");
        assertThat(JavalinInboundConnection.hostPort("[::1]", 80)).isEqualTo("[::1]:80");
    }
}
