package de.bsommerfeld.fleetagent.agent;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.fleetagent.agent.command.CommandDispatcher;
import de.bsommerfeld.fleetagent.agent.config.AgentModule;
import de.bsommerfeld.fleetagent.agent.server.CommandPoller;
import de.bsommerfeld.fleetagent.core.config.ApplicationMode;
import de.bsommerfeld.fleetagent.core.util.StorageUtils;
import de.bsommerfeld.fleetagent.updater.progress.RemoteProgressForwarder;
import de.bsommerfeld.fleetagent.updater.update.UpdateManager;
import de.bsommerfeld.fleetagent.updater.update.UpdaterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;

/**
 * Agent entry point. Wires the update control plane, validates a pending
 * update, starts the check loop and, outside TEST mode, the command poller.
 * Runs until the process is terminated.
 */
public final class AgentMain {

    static {
        // Must run before the first logger is created so logback.xml picks it up
        Path logDir = StorageUtils.getLogsDir(AgentModule.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AgentMain.class);

    private AgentMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        ApplicationMode mode = Arrays.asList(args).contains("--test") ? ApplicationMode.TEST : ApplicationMode.get();
        Path dataDir = StorageUtils.getAppDataDir(AgentModule.APP_NAME);

        Injector injector = Guice.createInjector(new AgentModule(dataDir, mode));
        UpdaterSettings settings = injector.getInstance(UpdaterSettings.class);
        UpdateManager manager = injector.getInstance(UpdateManager.class);
        CommandDispatcher dispatcher = injector.getInstance(CommandDispatcher.class);
        RemoteProgressForwarder forwarder = injector.getInstance(RemoteProgressForwarder.class);
        CommandPoller poller = mode.isTest() ? null : injector.getInstance(CommandPoller.class);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down fleet agent");
            if (poller != null) {
                poller.close();
            }
            dispatcher.close();
            manager.stop();
            forwarder.close();
            stopped.countDown();
        }, "agent-shutdown"));

        LOG.info("Fleet agent {} starting (agent id {}, data dir {})", settings.currentVersion(), settings.agentId(),
                dataDir);
        manager.start();
        if (poller != null) {
            poller.start();
        }

        stopped.await();
    }
}
