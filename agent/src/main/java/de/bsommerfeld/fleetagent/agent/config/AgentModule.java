package de.bsommerfeld.fleetagent.agent.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.fleetagent.agent.offline.OfflineVersionSource;
import de.bsommerfeld.fleetagent.agent.policy.ConfigPolicyProvider;
import de.bsommerfeld.fleetagent.agent.runtime.AgentVersion;
import de.bsommerfeld.fleetagent.agent.runtime.PlatformInfo;
import de.bsommerfeld.fleetagent.agent.runtime.ProcessRestartTrigger;
import de.bsommerfeld.fleetagent.agent.runtime.SelfHealthProbe;
import de.bsommerfeld.fleetagent.agent.server.BinaryInstaller;
import de.bsommerfeld.fleetagent.agent.server.HttpProgressChannel;
import de.bsommerfeld.fleetagent.agent.server.HttpServerConnection;
import de.bsommerfeld.fleetagent.agent.server.HttpTelemetrySink;
import de.bsommerfeld.fleetagent.agent.server.HttpVersionSource;
import de.bsommerfeld.fleetagent.agent.server.ServerConnection;
import de.bsommerfeld.fleetagent.core.config.AgentConfig;
import de.bsommerfeld.fleetagent.core.config.ApplicationMode;
import de.bsommerfeld.fleetagent.core.config.AutoUpdateConfig;
import de.bsommerfeld.fleetagent.core.config.ConfigLoader;
import de.bsommerfeld.fleetagent.core.config.ServerConfig;
import de.bsommerfeld.fleetagent.updater.marker.RollbackMarkerStore;
import de.bsommerfeld.fleetagent.updater.policy.PolicyProvider;
import de.bsommerfeld.fleetagent.updater.progress.ProgressPublisher;
import de.bsommerfeld.fleetagent.updater.progress.ProgressSink;
import de.bsommerfeld.fleetagent.updater.progress.RemoteProgressChannel;
import de.bsommerfeld.fleetagent.updater.progress.RemoteProgressForwarder;
import de.bsommerfeld.fleetagent.updater.source.RestartTrigger;
import de.bsommerfeld.fleetagent.updater.source.VersionSource;
import de.bsommerfeld.fleetagent.updater.telemetry.TelemetryReporter;
import de.bsommerfeld.fleetagent.updater.telemetry.TelemetrySink;
import de.bsommerfeld.fleetagent.updater.update.UpdaterSettings;
import de.bsommerfeld.fleetagent.updater.validation.FailedVersionRegistry;
import de.bsommerfeld.fleetagent.updater.validation.HealthProbe;
import de.bsommerfeld.fleetagent.updater.validation.PostUpdateValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.time.Clock;
import java.time.Duration;

/**
 * Guice module wiring the agent's update control plane.
 */
public class AgentModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AgentModule.class);

    public static final String APP_NAME = "fleet-agent";

    private final Path dataDir;
    private final ApplicationMode mode;

    public AgentModule(Path dataDir, ApplicationMode mode) {
        this.dataDir = dataDir;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        Path configPath = dataDir.resolve("config.toml");
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());

        // A broken config must not keep the agent from starting; the health probe reports it instead
        AgentConfig config;
        boolean configLoaded;
        try {
            config = ConfigLoader.load(configPath);
            configLoaded = true;
        } catch (IOException e) {
            LOG.error("Failed to load configuration, continuing with defaults", e);
            config = new AgentConfig();
            configLoaded = false;
        }

        bind(AgentConfig.class).toInstance(config);
        bind(ServerConfig.class).toInstance(config.getServer());
        bind(AutoUpdateConfig.class).toInstance(config.getAutoUpdate());
        bind(ApplicationMode.class).toInstance(mode);

        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(PolicyProvider.class).to(ConfigPolicyProvider.class);
        bind(ProgressSink.class).to(ProgressPublisher.class);

        UpdaterSettings settings = settings(config);
        bind(UpdaterSettings.class).toInstance(settings);
        bind(HealthProbe.class).toInstance(new SelfHealthProbe(settings.workDir(), configLoaded));

        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            // TEST MODE: no server, binary is never replaced
            bind(VersionSource.class).toInstance(new OfflineVersionSource(settings.currentVersion(),
                    settings.downloadDir()));
            bind(RestartTrigger.class).toInstance(() -> {
                LOG.info("TEST mode: restart skipped");
                return false;
            });
            bind(TelemetrySink.class).toInstance(payload -> LOG.info("TEST mode telemetry: {} {}",
                    payload.status(), payload.targetVersion()));
            bind(RemoteProgressChannel.class).toInstance(event -> LOG.debug("TEST mode progress: {}", event));
        } else {
            ServerConnection connection = new HttpServerConnection(config.getServer().getUrl(), settings.agentId(),
                    Duration.ofSeconds(Math.max(1, config.getServer().getTimeoutSeconds())));
            AutoUpdateConfig autoUpdate = config.getAutoUpdate();
            BinaryInstaller installer = new BinaryInstaller(binaryPath(autoUpdate),
                    settings.workDir().resolve("backups"));

            bind(ServerConnection.class).toInstance(connection);
            bind(VersionSource.class).toInstance(new HttpVersionSource(connection, settings.downloadDir(),
                    installer));
            bind(RestartTrigger.class).toInstance(new ProcessRestartTrigger(autoUpdate.getRestartCommand(),
                    Duration.ofSeconds(2)));
            bind(TelemetrySink.class).toInstance(new HttpTelemetrySink(connection));
            bind(RemoteProgressChannel.class).toInstance(new HttpProgressChannel(connection));
        }
    }

    @Provides
    @Singleton
    RollbackMarkerStore rollbackMarkerStore(UpdaterSettings settings) {
        return new RollbackMarkerStore(settings.workDir().resolve("rollback-marker.json"));
    }

    @Provides
    @Singleton
    FailedVersionRegistry failedVersionRegistry(UpdaterSettings settings, AutoUpdateConfig config, Clock clock) {
        Duration cooldown = Duration.ofHours(Math.max(1, config.getFailedVersionCooldownHours()));
        return new FailedVersionRegistry(settings.workDir().resolve("failed-versions.json"), cooldown, clock);
    }

    @Provides
    @Singleton
    PostUpdateValidator postUpdateValidator(RollbackMarkerStore markerStore, FailedVersionRegistry registry,
            HealthProbe probe) {
        return new PostUpdateValidator(markerStore, registry, probe);
    }

    @Provides
    @Singleton
    TelemetryReporter telemetryReporter(TelemetrySink sink) {
        return new TelemetryReporter(sink);
    }

    @Provides
    @Singleton
    RemoteProgressForwarder remoteProgressForwarder(RemoteProgressChannel channel) {
        return new RemoteProgressForwarder(channel, RemoteProgressForwarder.DEFAULT_CAPACITY);
    }

    private UpdaterSettings settings(AgentConfig config) {
        AutoUpdateConfig autoUpdate = config.getAutoUpdate();
        return new UpdaterSettings(
                agentId(config.getServer()),
                AgentVersion.current(),
                autoUpdate.getChannel(),
                PlatformInfo.os(),
                PlatformInfo.arch(),
                dataDir.resolve("autoupdate"),
                autoUpdate.getMinDiskSpaceMb(),
                Duration.ofMinutes(autoUpdate.getPolicyRecheckMinutes()),
                Duration.ofSeconds(autoUpdate.getShutdownGraceSeconds()));
    }

    static String agentId(ServerConfig server) {
        String configured = server.getAgentId();
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOG.warn("Cannot resolve host name for agent id: {}", e.getMessage());
            return "unknown-agent";
        }
    }

    /**
     * The configured binary path, or the jar this class was loaded from.
     */
    private static Path binaryPath(AutoUpdateConfig config) {
        String configured = config.getBinaryPath();
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured.trim()).toAbsolutePath();
        }
        CodeSource source = AgentModule.class.getProtectionDomain().getCodeSource();
        if (source != null && source.getLocation() != null) {
            try {
                return Paths.get(source.getLocation().toURI());
            } catch (URISyntaxException e) {
                LOG.warn("Cannot resolve agent binary location {}: {}", source.getLocation(), e.getMessage());
            }
        }
        LOG.warn("Cannot locate agent binary, self-install will fail until binary-path is set");
        return Paths.get(APP_NAME).toAbsolutePath();
    }
}
