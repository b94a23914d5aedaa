package io.voicecast.application.service;

import io.voicecast.application.port.input.DiscoveryListener;
import io.voicecast.application.port.output.Endpoint;
import io.voicecast.application.port.output.TargetListener;
import io.voicecast.domain.model.TargetInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owned map of audio targets, keyed by stable identifier.
 *
 * Fed by a discovery feed. Video-capable receivers are ignored; a rediscovered identifier
 * replaces the previous handle, which is disconnected first.
 */
public final class TargetRegistry implements DiscoveryListener, TargetDirectory {
    private static final Logger log = LoggerFactory.getLogger(TargetRegistry.class);

    static final List<String> AUDIO_MODELS = List.of(
        "Google Home", "Google Home Mini", "Google Nest Mini", "Google Nest Hub",
        "Google Nest Audio", "Nest Audio", "Home Mini", "Google Cast Group",
        "Lenovo Smart Clock");

    private final ConcurrentMap<String, Endpoint> targets = new ConcurrentHashMap<>();
    private final List<TargetListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(TargetListener listener) {
        listeners.add(listener);
    }

    @Override
    public void onEndpointFound(Endpoint endpoint) {
        if (!isAudioModel(endpoint.model())) {
            log.debug("[TargetRegistry] Ignoring non-audio device: '{}' (model: '{}')",
                endpoint.name(), endpoint.model());
            return;
        }

        Endpoint previous = targets.put(endpoint.id(), endpoint);
        if (previous != null && previous != endpoint) {
            disconnectQuietly(previous);
            log.info("[TargetRegistry] Target '{}' rediscovered, handle replaced", endpoint.name());
            for (TargetListener listener : listeners) {
                notifyListener(() -> listener.deviceUpdated(endpoint));
            }
        } else if (previous == null) {
            log.info("[TargetRegistry] Target found: '{}', model '{}', id '{}'",
                endpoint.name(), endpoint.model(), endpoint.id());
            for (TargetListener listener : listeners) {
                notifyListener(() -> listener.deviceCreated(endpoint));
            }
        }
    }

    @Override
    public void onEndpointLost(String id) {
        Endpoint removed = targets.remove(id);
        if (removed == null) {
            return;
        }
        log.info("[TargetRegistry] Target lost: '{}'", removed.name());
        disconnectQuietly(removed);
        for (TargetListener listener : listeners) {
            notifyListener(() -> listener.deviceRemoved(id));
        }
    }

    public Optional<Endpoint> find(String id) {
        return Optional.ofNullable(targets.get(id));
    }

    @Override
    public Optional<Endpoint> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return targets.values().stream()
            .filter(e -> name.equals(e.name()))
            .findFirst();
    }

    public List<TargetInfo> describe() {
        List<TargetInfo> infos = new ArrayList<>();
        for (Endpoint e : targets.values()) {
            infos.add(new TargetInfo(e.id(), e.name(), e.model(), e.isReady()));
        }
        infos.sort((a, b) -> a.name().compareToIgnoreCase(b.name()));
        return infos;
    }

    public int size() {
        return targets.size();
    }

    /**
     * Disconnect and forget every target. Used at shutdown.
     */
    public void disconnectAll() {
        for (String id : List.copyOf(targets.keySet())) {
            Endpoint endpoint = targets.remove(id);
            if (endpoint != null) {
                log.info("[TargetRegistry] {} Disconnecting...", endpoint.name());
                disconnectQuietly(endpoint);
            }
        }
    }

    /**
     * Case-insensitive substring match against the known audio-only models.
     */
    public static boolean isAudioModel(String model) {
        if (model == null) {
            return false;
        }
        String lower = model.toLowerCase(Locale.ROOT);
        for (String audioModel : AUDIO_MODELS) {
            if (lower.contains(audioModel.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static void disconnectQuietly(Endpoint endpoint) {
        try {
            endpoint.disconnect();
        } catch (RuntimeException e) {
            log.error("[TargetRegistry] Failed to disconnect '{}': {}", endpoint.name(), e.getMessage());
        }
    }

    private static void notifyListener(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.error("[TargetRegistry] Target listener threw exception", e);
        }
    }
}
