package io.leanweb.server.core;

import io.leanweb.core.ErrorKind;
import io.leanweb.core.Http;
import io.leanweb.server.spi.ResponseDescriptor;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseWriterTest {

    @Test
    void redirectUsesRequestHostWhenNoPublicAddress() {
        ServerResponse resp = new ResponseWriter("").render(ResponseDescriptor.redirect("/login"), "192.168.1.5");

        assertThat(resp.status()).isEqualTo(302);
        assertThat(resp.firstHeader(Http.H_LOCATION)).contains("http://192.168.1.5/login");
        assertThat(resp.body()).isInstanceOf(ResponseBody.Empty.class);
    }

    @Test
    void publicAddressTakesPrecedence() {
        ServerResponse resp = new ResponseWriter("1.2.3.4").render(ResponseDescriptor.redirect("/login"), "192.168.1.5");
        assertThat(resp.firstHeader(Http.H_LOCATION)).contains("http://1.2.3.4/login");
    }

    @Test
    void nullPublicAddressMeansRequestHost() {
        assertThat(new ResponseWriter(null).location("/x", "host:8080")).isEqualTo("http://host:8080/x");
    }

    @Test
    void contentIsWrittenVerbatimWithTypeLengthAndCharset() {
        byte[] data = "<p>héllo</p>".getBytes(StandardCharsets.UTF_8);
        ServerResponse resp = new ResponseWriter("").render(
                ResponseDescriptor.content(data, "text/html", StandardCharsets.UTF_8), "h");

        assertThat(resp.status()).isEqualTo(200);
        assertThat(resp.firstHeader(Http.H_CONTENT_TYPE)).contains("text/html; charset=utf-8");
        assertThat(resp.firstHeader(Http.H_CONTENT_LENGTH)).contains(Integer.toString(data.length));
        assertThat(((ResponseBody.Bytes) resp.body()).bytes()).isEqualTo(data);
    }

    @Test
    void binaryContentKeepsTypeAsGiven() {
        ServerResponse resp = new ResponseWriter("").render(
                ResponseDescriptor.content(new byte[] {1, 2, 3}, "image/png", null), "h");
        assertThat(resp.firstHeader(Http.H_CONTENT_TYPE)).contains("image/png");
    }

    @Test
    void existingCharsetParameterIsNotDuplicated() {
        ServerResponse resp = new ResponseWriter("").render(
                ResponseDescriptor.content(new byte[0], "text/plain; charset=ISO-8859-1", StandardCharsets.UTF_8), "h");
        assertThat(resp.firstHeader(Http.H_CONTENT_TYPE)).contains("text/plain; charset=ISO-8859-1");
    }

    @Test
    void unresolvedFailureCannotBeWritten() {
        assertThatThrownBy(() -> new ResponseWriter("").render(ResponseDescriptor.failure(ErrorKind.SERVER_ERROR), "h"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
