package io.voicecast.application.port.output;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Text-to-speech engine producing MP3 audio.
 */
public interface SpeechSynthesizer {

    /**
     * Synthesize {@code text} and write the MP3 result to {@code output}, replacing any
     * existing file.
     *
     * @param text     text to speak
     * @param language language code, e.g. {@code fr} or {@code en}
     * @param output   destination file
     * @throws IOException when the engine fails or produces no audio
     */
    void synthesize(String text, String language, Path output) throws IOException;

    /** Short engine name for logs. */
    String name();
}
