package io.voicecast.infrastructure.tts;

import io.voicecast.application.port.output.SpeechSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Speech synthesis through an external program.
 *
 * The command template is split into arguments like a shell would (single and double quotes
 * group words), then the placeholders {@code {text}}, {@code {lang}} and {@code {output}} are
 * substituted in each argument. No shell is involved unless the template invokes one.
 *
 * Usage:
 * <pre>
 * new CommandSpeechSynthesizer("espeak-ng -v {lang} -w {output} {text}");
 * </pre>
 */
public final class CommandSpeechSynthesizer implements SpeechSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(CommandSpeechSynthesizer.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final List<String> template;
    private final Duration timeout;

    public CommandSpeechSynthesizer(String commandTemplate) {
        this(commandTemplate, DEFAULT_TIMEOUT);
    }

    public CommandSpeechSynthesizer(String commandTemplate, Duration timeout) {
        this.template = tokenize(commandTemplate);
        if (template.isEmpty()) {
            throw new IllegalArgumentException("empty speech command template");
        }
        this.timeout = timeout;
    }

    @Override
    public void synthesize(String text, String language, Path output) throws IOException {
        Files.deleteIfExists(output);
        List<String> command = command(text, language, output);
        log.debug("[CommandTTS] Running {}", command.get(0));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        Process process = pb.start();

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while waiting for speech command", e);
        }
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("speech command timed out after " + timeout.toSeconds() + "s");
        }
        if (process.exitValue() != 0) {
            throw new IOException("speech command exited with code " + process.exitValue());
        }
        if (!Files.isRegularFile(output) || Files.size(output) == 0) {
            throw new IOException("speech command produced no audio output");
        }
    }

    List<String> command(String text, String language, Path output) {
        List<String> command = new ArrayList<>(template.size());
        for (String arg : template) {
            command.add(arg
                .replace("{text}", text)
                .replace("{lang}", language)
                .replace("{output}", output.toString()));
        }
        return command;
    }

    static List<String> tokenize(String template) {
        List<String> tokens = new ArrayList<>();
        if (template == null) {
            return tokens;
        }

        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("unbalanced quote in speech command template");
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    @Override
    public String name() {
        return "command";
    }
}
