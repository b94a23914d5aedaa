package io.voicecast.infrastructure.tts;

import io.voicecast.application.port.output.SpeechSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Creates the configured speech engine.
 */
public final class SpeechSynthesizerFactory {
    private static final Logger log = LoggerFactory.getLogger(SpeechSynthesizerFactory.class);

    public static final String GOOGLE = "google";
    public static final String COMMAND = "command";

    /**
     * @param engine          {@code google} or {@code command}
     * @param commandTemplate template for the {@code command} engine, ignored otherwise
     * @throws IllegalArgumentException for an unknown engine or a missing template
     */
    public static SpeechSynthesizer create(String engine, String commandTemplate) {
        String name = engine == null ? GOOGLE : engine.trim().toLowerCase(Locale.ROOT);
        switch (name) {
            case GOOGLE:
                log.info("[SpeechSynthesizerFactory] Using Google Translate speech engine");
                return new GoogleTranslateSpeechSynthesizer();
            case COMMAND:
                if (commandTemplate == null || commandTemplate.isBlank()) {
                    throw new IllegalArgumentException("command speech engine needs a command template");
                }
                log.info("[SpeechSynthesizerFactory] Using external speech command");
                return new CommandSpeechSynthesizer(commandTemplate);
            default:
                throw new IllegalArgumentException("unknown speech engine '" + engine + "'");
        }
    }

    private SpeechSynthesizerFactory() {}
}
