package io.voicecast.infrastructure.media;

import io.undertow.Undertow;
import io.voicecast.infrastructure.metrics.NotificationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * HTTP server the targets fetch notification audio from.
 *
 * Usage:
 * <pre>
 * MediaServer media = new MediaServer(assetDir, metrics);
 * media.start(15555, "0.0.0.0");
 * ...
 * media.stop();
 * </pre>
 */
public final class MediaServer {
    private static final Logger log = LoggerFactory.getLogger(MediaServer.class);

    private final MediaFileHandler handler;
    private Undertow server;

    public MediaServer(Path assetDir, NotificationMetrics metrics) {
        this.handler = new MediaFileHandler(assetDir, metrics);
    }

    public synchronized void start(int port, String bindHost) {
        if (server != null) {
            log.warn("[MediaServer] Already running");
            return;
        }
        server = Undertow.builder()
            .addHttpListener(port, bindHost)
            .setHandler(handler)
            .build();
        server.start();
        log.info("[MediaServer] Serving audio on http://{}:{}/", bindHost, port);
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("[MediaServer] Stopped");
        }
    }
}
