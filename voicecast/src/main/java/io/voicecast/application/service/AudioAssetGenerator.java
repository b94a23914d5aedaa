package io.voicecast.application.service;

import io.voicecast.application.exception.AssetMissingException;
import io.voicecast.application.exception.SynthesisException;
import io.voicecast.application.port.output.SpeechSynthesizer;
import io.voicecast.domain.model.AudioAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Turns notification text into an MP3 file in the private asset directory.
 *
 * Files are named after the target identifier, so a target has at most one asset on disk and a
 * new notification overwrites a stale one. This is only safe while a single worker processes
 * requests in order; concurrent workers would race on the same path.
 */
public final class AudioAssetGenerator {
    private static final Logger log = LoggerFactory.getLogger(AudioAssetGenerator.class);

    private final SpeechSynthesizer synthesizer;
    private final Path assetDir;
    private final String language;
    private final Map<String, String> languageOverrides;
    private final int estimateBitrateBps;

    public AudioAssetGenerator(SpeechSynthesizer synthesizer, Path assetDir, String language,
                               Map<String, String> languageOverrides, int estimateBitrateBps) {
        this.synthesizer = synthesizer;
        this.assetDir = assetDir.toAbsolutePath().normalize();
        this.language = language;
        this.languageOverrides = Map.copyOf(languageOverrides);
        this.estimateBitrateBps = estimateBitrateBps;
    }

    /**
     * Synthesize {@code text} for the target with id {@code targetId}.
     *
     * @throws SynthesisException    when the engine fails or writes an empty file
     * @throws AssetMissingException when the engine returns without writing the file
     */
    public AudioAsset generate(String targetName, String targetId, String text) {
        Path output = assetPath(targetId);
        String lang = resolveLanguage();
        log.debug("[AudioAssetGenerator] '{}' to '{}', language '{}', engine {}",
            text, targetName, lang, synthesizer.name());

        try {
            Files.createDirectories(assetDir);
            synthesizer.synthesize(text, lang, output);
        } catch (IOException e) {
            throw new SynthesisException(targetName, "speech synthesis failed: " + e.getMessage(), e);
        }

        if (!Files.exists(output)) {
            throw new AssetMissingException(targetName, output);
        }

        long size;
        try {
            size = Files.size(output);
        } catch (IOException e) {
            throw new SynthesisException(targetName, "cannot read asset size: " + e.getMessage(), e);
        }
        if (size == 0) {
            deleteQuietly(output);
            throw new SynthesisException(targetName, "speech engine produced an empty file");
        }

        AudioAsset asset = new AudioAsset(output, size, AudioAsset.estimateSeconds(size, estimateBitrateBps));
        log.debug("[AudioAssetGenerator] '{}' created, {} bytes", output, size);
        return asset;
    }

    /**
     * Delete an asset once its session is over.
     *
     * @return true if the file was removed
     */
    public boolean delete(AudioAsset asset) {
        try {
            return Files.deleteIfExists(asset.path());
        } catch (IOException e) {
            log.warn("[AudioAssetGenerator] Failed to delete '{}': {}", asset.path(), e.getMessage());
            return false;
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("[AudioAssetGenerator] Failed to delete '{}': {}", path, e.getMessage());
        }
    }

    public Path assetPath(String targetId) {
        return assetDir.resolve(fileNameFor(targetId));
    }

    public Path assetDir() {
        return assetDir;
    }

    public String resolveLanguage() {
        return languageOverrides.getOrDefault(language, language);
    }

    /**
     * File name for a target's asset. Characters outside {@code [A-Za-z0-9._-]} become {@code _}
     * so the name is safe both on disk and in a URL path.
     */
    static String fileNameFor(String targetId) {
        return targetId.replaceAll("[^A-Za-z0-9._-]", "_") + ".mp3";
    }
}
