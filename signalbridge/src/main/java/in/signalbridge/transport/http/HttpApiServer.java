package in.signalbridge.transport.http;

import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Undertow server for the trade API, /metrics and /health.
 */
public final class HttpApiServer {
    private static final Logger log = LoggerFactory.getLogger(HttpApiServer.class);

    private final Undertow server;
    private final String host;
    private final int port;

    public HttpApiServer(String host, int port, HttpHandler routes) {
        this.host = host;
        this.port = port;
        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(routes)
            .build();
    }

    public void start() {
        server.start();
        log.info("[HTTP] Listening on http://{}:{}", host, port);
    }

    public void stop() {
        server.stop();
        log.info("[HTTP] Stopped");
    }
}
