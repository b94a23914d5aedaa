package io.voicecast.transport.http;

import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undertow listener for the trigger API and /metrics.
 */
public final class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final HttpHandler handler;
    private Undertow server;

    public ApiServer(HttpHandler handler) {
        this.handler = handler;
    }

    public synchronized void start(int port, String bindHost) {
        if (server != null) {
            log.warn("[ApiServer] Already running");
            return;
        }
        server = Undertow.builder()
            .addHttpListener(port, bindHost)
            .setHandler(handler)
            .build();
        server.start();
        log.info("[ApiServer] Trigger API on http://{}:{}/api/notify", bindHost, port);
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("[ApiServer] Stopped");
        }
    }
}
