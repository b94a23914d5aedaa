package io.voicecast.bootstrap;

import io.undertow.server.HttpHandler;
import io.voicecast.application.port.input.DiscoveryFeed;
import io.voicecast.application.port.output.Endpoint;
import io.voicecast.application.port.output.SpeechSynthesizer;
import io.voicecast.application.port.output.TargetListener;
import io.voicecast.application.service.AudioAssetGenerator;
import io.voicecast.application.service.NotificationQueue;
import io.voicecast.application.service.NotificationService;
import io.voicecast.application.service.NotificationWorker;
import io.voicecast.application.service.PlaybackCompletionDetector;
import io.voicecast.application.service.ShutdownCoordinator;
import io.voicecast.application.service.ShutdownSignal;
import io.voicecast.application.service.TargetRegistry;
import io.voicecast.application.service.TargetStateManager;
import io.voicecast.infrastructure.media.MediaServer;
import io.voicecast.infrastructure.metrics.PrometheusMetricsHandler;
import io.voicecast.infrastructure.metrics.PrometheusNotificationMetrics;
import io.voicecast.infrastructure.tts.SpeechSynthesizerFactory;
import io.voicecast.transport.http.ApiServer;
import io.voicecast.transport.http.NotificationApiHandlers;
import io.voicecast.util.NetworkAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        VoiceCastConfig config = VoiceCastConfig.fromEnv();
        StartupConfigValidator.validate(config);

        String mediaHost = config.mediaHost().isBlank() ? NetworkAddress.detectLocalAddress() : config.mediaHost();
        if (mediaHost.isBlank()) {
            log.warn("Could not detect a local address, media URLs will use 127.0.0.1 (set VOICECAST_MEDIA_HOST)");
            mediaHost = "127.0.0.1";
        }
        String mediaBaseUrl = "http://" + mediaHost + ":" + config.mediaPort();

        Files.createDirectories(config.assetDir());
        log.info("✓ Asset directory: {}", config.assetDir().toAbsolutePath());

        PrometheusNotificationMetrics metrics = new PrometheusNotificationMetrics();

        // ═══════════════════════════════════════════════════════════════
        // Pipeline
        // ═══════════════════════════════════════════════════════════════
        ShutdownSignal signal = new ShutdownSignal();
        NotificationQueue queue = new NotificationQueue();
        TargetRegistry registry = new TargetRegistry();
        registry.addListener(new DefaultTargetWatcher(config.defaultTarget()));

        SpeechSynthesizer synthesizer = SpeechSynthesizerFactory.create(config.ttsEngine(), config.ttsCommand());
        AudioAssetGenerator assets = new AudioAssetGenerator(synthesizer, config.assetDir(), config.language(),
            config.languageOverrides(), config.estimateBitrateBps());
        TargetStateManager stateManager = new TargetStateManager(config.notificationVolume());
        PlaybackCompletionDetector detector = new PlaybackCompletionDetector(config.detectorSettings());

        NotificationWorker worker = new NotificationWorker(queue, registry, assets, stateManager, detector,
            signal, mediaBaseUrl, metrics);
        ShutdownCoordinator coordinator = new ShutdownCoordinator(signal, queue, config.shutdownTimeout());
        NotificationService service = new NotificationService(queue, worker, coordinator, metrics, config.defaultTarget());

        // ═══════════════════════════════════════════════════════════════
        // Media server and trigger API
        // ═══════════════════════════════════════════════════════════════
        MediaServer mediaServer = new MediaServer(config.assetDir(), metrics);
        mediaServer.start(config.mediaPort(), "0.0.0.0");
        log.info("✓ Media server advertised as {}", mediaBaseUrl);

        ApiServer apiServer = null;
        if (config.apiEnabled()) {
            NotificationApiHandlers api = new NotificationApiHandlers(service, registry);
            HttpHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());
            apiServer = new ApiServer(api.routes(metricsHandler));
            apiServer.start(config.apiPort(), "0.0.0.0");
        } else {
            log.info("⏭️ Trigger API disabled (VOICECAST_API_PORT=0)");
        }

        // ═══════════════════════════════════════════════════════════════
        // Discovery
        // ═══════════════════════════════════════════════════════════════
        List<DiscoveryFeed> feeds = new ArrayList<>();
        for (DiscoveryFeed feed : ServiceLoader.load(DiscoveryFeed.class)) {
            feed.start(registry);
            feeds.add(feed);
            log.info("✓ Discovery feed started: {}", feed.getClass().getSimpleName());
        }
        if (feeds.isEmpty()) {
            log.warn("⚠️  No DiscoveryFeed on the classpath: no targets will be found");
        }

        // Stop order: discovery, servers, then target connections.
        coordinator.register("discovery", () -> feeds.forEach(DiscoveryFeed::stop));
        coordinator.register("media server", mediaServer::stop);
        if (apiServer != null) {
            coordinator.register("trigger API", apiServer::stop);
        }
        coordinator.register("target connections", registry::disconnectAll);

        service.start();
        Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "voicecast-shutdown"));
        log.info("VoiceCast started (default target: '{}')", service.defaultTarget());
    }

    /**
     * Reports when the configured default target comes and goes.
     */
    private static final class DefaultTargetWatcher implements TargetListener {
        private final String defaultTarget;

        DefaultTargetWatcher(String defaultTarget) {
            this.defaultTarget = defaultTarget.trim();
        }

        @Override
        public void deviceCreated(Endpoint endpoint) {
            if (defaultTarget.equals(endpoint.name())) {
                log.info("✓ Default target '{}' is online", endpoint.name());
            }
        }

        @Override
        public void deviceUpdated(Endpoint endpoint) {
            if (defaultTarget.equals(endpoint.name())) {
                log.info("✓ Default target '{}' reconnected", endpoint.name());
            }
        }
    }

    private App() {}
}
