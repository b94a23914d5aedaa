package io.voicecast.infrastructure.media;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderMap;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import io.voicecast.infrastructure.metrics.NotificationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.OptionalLong;

/**
 * Serves audio assets from one directory with single byte-range support.
 *
 * Receivers stream notification audio with a series of range requests, so every response
 * advertises {@code Accept-Ranges} and disables caching; the same file name is reused for the
 * next notification to that target.
 */
public final class MediaFileHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(MediaFileHandler.class);

    /** Bytes sent for a range request without an explicit end. */
    public static final int CHUNK_SIZE = 16 * 1024;

    static final String CONTENT_TYPE = "audio/mpeg";

    private final Path assetDir;
    private final NotificationMetrics metrics;

    public MediaFileHandler(Path assetDir, NotificationMetrics metrics) {
        this.assetDir = assetDir.toAbsolutePath().normalize();
        this.metrics = metrics;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        setCommonHeaders(exchange.getResponseHeaders());
        try {
            if (!Methods.GET.equals(exchange.getRequestMethod())) {
                throw new MediaRequestException(StatusCodes.METHOD_NOT_ALLOWED,
                    "only GET requests allowed (" + exchange.getRequestMethod() + ")");
            }

            Path file = resolve(exchange.getRelativePath());
            long fileSize = Files.size(file);
            String rangeHeader = exchange.getRequestHeaders().getFirst(Headers.RANGE);

            if (rangeHeader == null) {
                sendFull(exchange, file, fileSize);
            } else {
                sendRange(exchange, file, ByteRange.parse(rangeHeader, fileSize, CHUNK_SIZE));
            }

        } catch (MediaRequestException e) {
            log.warn("[MediaServer] {} invalid request '{}': {}",
                exchange.getSourceAddress(), exchange.getRequestURI(), e.getMessage());
            sendError(exchange, e.getStatusCode());
        } catch (Exception e) {
            log.error("[MediaServer] {} request '{}' failed: {}",
                exchange.getSourceAddress(), exchange.getRequestURI(), e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR);
        } finally {
            exchange.endExchange();
        }
    }

    /**
     * Map a request path onto a regular file inside the asset directory.
     */
    Path resolve(String relativePath) throws MediaRequestException {
        String name = relativePath == null ? "" : relativePath;
        while (name.startsWith("/")) {
            name = name.substring(1);
        }
        if (name.isBlank()) {
            throw new MediaRequestException(StatusCodes.BAD_REQUEST, "no asset path present");
        }

        Path candidate;
        try {
            candidate = assetDir.resolve(name).normalize();
        } catch (InvalidPathException e) {
            throw new MediaRequestException(StatusCodes.NOT_FOUND, "invalid path '" + name + "'");
        }
        if (!candidate.startsWith(assetDir) || !Files.isRegularFile(candidate)) {
            throw new MediaRequestException(StatusCodes.NOT_FOUND, "file '" + name + "' does not exist");
        }
        return candidate;
    }

    private void sendFull(HttpServerExchange exchange, Path file, long fileSize) throws IOException {
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, fileSize);
        exchange.startBlocking();

        long sent;
        try (OutputStream out = exchange.getOutputStream()) {
            sent = Files.copy(file, out);
        }
        log.debug("[MediaServer] {} GET '{}' full, {} bytes", exchange.getSourceAddress(), file.getFileName(), sent);
        metrics.recordMediaRequest(StatusCodes.OK, sent);
    }

    private void sendRange(HttpServerExchange exchange, Path file, ByteRange range) throws IOException {
        exchange.setStatusCode(StatusCodes.PARTIAL_CONTENT);
        exchange.getResponseHeaders().put(Headers.CONTENT_RANGE, range.contentRange());
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, range.length());
        exchange.startBlocking();

        long sent = 0;
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ);
             OutputStream out = exchange.getOutputStream()) {
            channel.position(range.start());
            ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(CHUNK_SIZE, range.length()));
            while (sent < range.length()) {
                buffer.clear();
                buffer.limit((int) Math.min(buffer.capacity(), range.length() - sent));
                int read = channel.read(buffer);
                if (read < 0) {
                    break;
                }
                out.write(buffer.array(), 0, read);
                sent += read;
            }
        }
        log.debug("[MediaServer] {} GET '{}' range {}, {} bytes",
            exchange.getSourceAddress(), file.getFileName(), range.contentRange(), sent);
        metrics.recordMediaRequest(StatusCodes.PARTIAL_CONTENT, sent);
    }

    private void sendError(HttpServerExchange exchange, int statusCode) {
        metrics.recordMediaRequest(statusCode, 0);
        if (exchange.isResponseStarted()) {
            return;
        }
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, 0);
        if (statusCode == StatusCodes.REQUEST_RANGE_NOT_SATISFIABLE) {
            sizeOf(exchange).ifPresent(size -> exchange.getResponseHeaders().put(Headers.CONTENT_RANGE, "bytes */" + size));
        }
    }

    private OptionalLong sizeOf(HttpServerExchange exchange) {
        try {
            return OptionalLong.of(Files.size(resolve(exchange.getRelativePath())));
        } catch (MediaRequestException | IOException e) {
            return OptionalLong.empty();
        }
    }

    private static void setCommonHeaders(HeaderMap headers) {
        headers.put(Headers.CONTENT_TYPE, CONTENT_TYPE);
        headers.put(Headers.ACCEPT_RANGES, "bytes");
        headers.put(Headers.CACHE_CONTROL, "no-store, no-cache, must-revalidate");
        headers.put(Headers.PRAGMA, "no-cache");
        headers.put(Headers.EXPIRES, "0");
    }
}
