package io.voicecast.infrastructure.tts;

import io.voicecast.application.port.output.SpeechSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Speech synthesis through the Google Translate TTS endpoint.
 *
 * The endpoint only accepts short texts, so the input is split with {@link TextChunker} and the
 * MP3 responses are appended to one file. Players handle concatenated MPEG frames fine.
 */
public final class GoogleTranslateSpeechSynthesizer implements SpeechSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(GoogleTranslateSpeechSynthesizer.class);

    public static final String DEFAULT_ENDPOINT = "https://translate.google.com/translate_tts";
    static final int MAX_CHUNK_LENGTH = 100;
    private static final Duration TIMEOUT = Duration.ofSeconds(15);
    private static final String USER_AGENT = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36";

    private final HttpClient httpClient;
    private final String endpoint;
    private final TextChunker chunker = new TextChunker(MAX_CHUNK_LENGTH);

    public GoogleTranslateSpeechSynthesizer() {
        this(DEFAULT_ENDPOINT);
    }

    public GoogleTranslateSpeechSynthesizer(String endpoint) {
        this.endpoint = endpoint;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public void synthesize(String text, String language, Path output) throws IOException {
        List<String> chunks = chunker.split(text);
        if (chunks.isEmpty()) {
            throw new IOException("nothing to synthesize");
        }

        try (OutputStream out = Files.newOutputStream(output)) {
            for (int i = 0; i < chunks.size(); i++) {
                byte[] audio = fetch(chunks.get(i), language, i, chunks.size());
                out.write(audio);
            }
        }
        log.debug("[GoogleTTS] {} chunk(s) written to '{}'", chunks.size(), output);
    }

    private byte[] fetch(String chunk, String language, int index, int total) throws IOException {
        URI uri = URI.create(endpoint
            + "?ie=UTF-8"
            + "&q=" + URLEncoder.encode(chunk, StandardCharsets.UTF_8)
            + "&tl=" + URLEncoder.encode(language, StandardCharsets.UTF_8)
            + "&total=" + total
            + "&idx=" + index
            + "&textlen=" + chunk.length()
            + "&client=tw-ob");

        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(TIMEOUT)
            .header("User-Agent", USER_AGENT)
            .GET()
            .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while fetching speech", e);
        }

        if (response.statusCode() != 200) {
            throw new IOException("TTS endpoint returned HTTP " + response.statusCode()
                + " for chunk " + (index + 1) + "/" + total);
        }
        if (response.body().length == 0) {
            throw new IOException("TTS endpoint returned no audio for chunk " + (index + 1) + "/" + total);
        }
        return response.body();
    }

    @Override
    public String name() {
        return "google";
    }
}
