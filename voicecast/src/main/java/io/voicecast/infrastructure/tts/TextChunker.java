package io.voicecast.infrastructure.tts;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into pieces short enough for a single synthesis request.
 *
 * A piece ends at the last punctuation mark that fits, otherwise at the last whitespace,
 * otherwise it is cut at the limit.
 */
public final class TextChunker {

    private static final String PUNCTUATION = ".,;:!?";

    private final int maxLength;

    public TextChunker(int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public List<String> split(String text) {
        List<String> chunks = new ArrayList<>();
        if (text == null) {
            return chunks;
        }

        String remaining = text.strip();
        while (remaining.length() > maxLength) {
            int cut = lastBreak(remaining);
            addIfPresent(chunks, remaining.substring(0, cut));
            remaining = remaining.substring(cut).strip();
        }
        addIfPresent(chunks, remaining);
        return chunks;
    }

    private int lastBreak(String text) {
        String window = text.substring(0, maxLength);
        for (int i = window.length() - 1; i > 0; i--) {
            if (PUNCTUATION.indexOf(window.charAt(i)) >= 0) {
                return i + 1;
            }
        }
        for (int i = window.length() - 1; i > 0; i--) {
            if (Character.isWhitespace(window.charAt(i))) {
                return i;
            }
        }
        return maxLength;
    }

    private static void addIfPresent(List<String> chunks, String chunk) {
        String trimmed = chunk.strip();
        if (!trimmed.isEmpty()) {
            chunks.add(trimmed);
        }
    }
}
