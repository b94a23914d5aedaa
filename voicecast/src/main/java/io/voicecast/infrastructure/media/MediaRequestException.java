package io.voicecast.infrastructure.media;

/**
 * A media request the server refuses, carrying the HTTP status to answer with.
 */
public class MediaRequestException extends Exception {

    private final int statusCode;

    public MediaRequestException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
