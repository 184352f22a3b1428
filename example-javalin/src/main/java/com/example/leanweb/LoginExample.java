package com.example.leanweb;

import io.leanweb.server.core.InMemorySessionStore;
import io.leanweb.server.core.ServerConfig;
import io.leanweb.server.core.ServerConfigLoader;
import io.leanweb.server.javalin.LeanWebServer;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Runs the demo. Reads {@code leanweb.json} from the path given as first argument, or from the
 * classpath.
 */
public final class LoginExample {
    private LoginExample() {}

    public static void main(String[] args) throws Exception {
        ServerConfig config;
        if (args.length > 0) {
            config = ServerConfigLoader.load(Path.of(args[0]), DemoDispatcher::errorPath).build();
        } else {
            try (InputStream in = LoginExample.class.getResourceAsStream("/leanweb.json")) {
                config = in == null
                        ? ServerConfig.builder(DemoDispatcher::errorPath).port(8080).build()
                        : ServerConfigLoader.load(in, DemoDispatcher::errorPath).build();
            }
        }

        InMemorySessionStore sessions = new InMemorySessionStore(config.clock());
        DemoDispatcher dispatcher = new DemoDispatcher(sessions, config.sessionExpiration(),
                config.validationTokenFieldName(), config.validationTokenPlaceholder());
        try (LeanWebServer server = LeanWebServer.start(config, dispatcher, sessions)) {
            Runtime.getRuntime().addShutdownHook(new Thread(server::close, "leanweb-shutdown"));
            server.termination().join();
        }
    }
}
