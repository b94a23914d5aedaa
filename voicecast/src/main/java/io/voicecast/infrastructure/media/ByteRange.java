package io.voicecast.infrastructure.media;

import io.undertow.util.StatusCodes;

import java.util.Locale;

/**
 * Inclusive byte range resolved against a file size.
 */
public record ByteRange(long start, long end, long fileSize) {

    public long length() {
        return end - start + 1;
    }

    /** {@code Content-Range} header value. */
    public String contentRange() {
        return "bytes " + start + "-" + end + "/" + fileSize;
    }

    /**
     * Parse a {@code Range: bytes=<start>-<end>} header.
     *
     * A missing start means 0. A missing end means {@code start + chunkSize - 1}. The end is
     * clamped to the last byte of the file. Only the first range of a multi-range header is served.
     *
     * @throws MediaRequestException 400 when the header is malformed, 416 when the range lies
     *                               outside the file
     */
    public static ByteRange parse(String header, long fileSize, int chunkSize) throws MediaRequestException {
        String value = header.trim();
        int eq = value.indexOf('=');
        if (eq < 0 || !value.substring(0, eq).trim().toLowerCase(Locale.ROOT).equals("bytes")) {
            throw new MediaRequestException(StatusCodes.BAD_REQUEST, "unsupported range unit in '" + header + "'");
        }

        String rangeSet = value.substring(eq + 1);
        int comma = rangeSet.indexOf(',');
        if (comma >= 0) {
            rangeSet = rangeSet.substring(0, comma);
        }
        String[] parts = rangeSet.trim().split("-", 2);
        if (parts.length != 2) {
            throw new MediaRequestException(StatusCodes.BAD_REQUEST, "malformed range '" + header + "'");
        }

        long start;
        long end;
        try {
            start = parts[0].isBlank() ? 0 : Long.parseLong(parts[0].trim());
            end = parts[1].isBlank() ? openEnd(start, chunkSize) : Long.parseLong(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new MediaRequestException(StatusCodes.BAD_REQUEST, "malformed range '" + header + "'");
        }
        if (start < 0 || end < 0) {
            throw new MediaRequestException(StatusCodes.BAD_REQUEST, "malformed range '" + header + "'");
        }

        end = Math.min(end, fileSize - 1);
        if (start >= fileSize || start > end) {
            throw new MediaRequestException(StatusCodes.REQUEST_RANGE_NOT_SATISFIABLE,
                "range " + rangeSet.trim() + " outside file of " + fileSize + " bytes");
        }
        return new ByteRange(start, end, fileSize);
    }

    /** Last byte of a default-sized chunk from {@code start}, saturating at {@link Long#MAX_VALUE}. */
    private static long openEnd(long start, int chunkSize) {
        return start > Long.MAX_VALUE - chunkSize ? Long.MAX_VALUE : start + chunkSize - 1;
    }
}
