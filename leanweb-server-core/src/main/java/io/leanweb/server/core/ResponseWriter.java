package io.leanweb.server.core;

import io.leanweb.core.Headers;
import io.leanweb.core.Http;
import io.leanweb.server.spi.ResponseDescriptor;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a {@link ResponseDescriptor} as a 302 redirect or a 200 content response.
 *
 * <p>Redirect locations are absolute: {@code http://} followed by the configured public address,
 * or by the host the client addressed when no public address is set, and then the target path.
 */
public final class ResponseWriter {

    private final String publicAddress;

    public ResponseWriter(String publicAddress) {
        this.publicAddress = publicAddress == null ? "" : publicAddress;
    }

    public void write(InboundConnection connection, ResponseDescriptor descriptor) throws IOException {
        connection.send(render(descriptor, connection.hostAddress()));
    }

    public ServerResponse render(ResponseDescriptor descriptor, String requestHost) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (descriptor instanceof ResponseDescriptor.Redirect redirect) {
            return new ServerResponse(Http.STATUS_FOUND, new ResponseBody.Empty())
                    .header(Http.H_LOCATION, location(redirect.target(), requestHost));
        }
        if (descriptor instanceof ResponseDescriptor.Content content) {
            return new ServerResponse(Http.STATUS_OK, new ResponseBody.Bytes(content.data()))
                    .header(Http.H_CONTENT_TYPE, contentType(content))
                    .header(Http.H_CONTENT_LENGTH, Integer.toString(content.data().length));
        }
        throw new IllegalArgumentException("unresolved failure cannot be written: " + descriptor);
    }

    public String location(String target, String requestHost) {
        String host = publicAddress.isEmpty() ? requestHost : publicAddress;
        return Http.SCHEME_PREFIX + host + target;
    }

    private static String contentType(ResponseDescriptor.Content content) {
        String type = content.contentType();
        if (content.encoding() == null || Headers.charset(type).isPresent()) {
            return type;
        }
        return type + "; " + Http.CHARSET_PARAM + content.encoding().name().toLowerCase(Locale.ROOT);
    }
}
