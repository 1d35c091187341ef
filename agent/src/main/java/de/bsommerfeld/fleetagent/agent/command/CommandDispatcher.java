package de.bsommerfeld.fleetagent.agent.command;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.fleetagent.agent.command.UpdateCommand.CancelUpdate;
import de.bsommerfeld.fleetagent.agent.command.UpdateCommand.CheckUpdate;
import de.bsommerfeld.fleetagent.agent.command.UpdateCommand.ForceUpdate;
import de.bsommerfeld.fleetagent.updater.progress.ProgressEvent;
import de.bsommerfeld.fleetagent.updater.progress.ProgressSink;
import de.bsommerfeld.fleetagent.updater.update.UpdateBusyException;
import de.bsommerfeld.fleetagent.updater.update.UpdateDisabledException;
import de.bsommerfeld.fleetagent.updater.update.UpdateException;
import de.bsommerfeld.fleetagent.updater.update.UpdateManager;
import de.bsommerfeld.fleetagent.updater.update.UpdateStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs server commands against the update manager.
 *
 * <p>
 * Commands are fire-and-forget: each runs on its own task and its outcome is
 * only visible through progress events. Requests the manager refuses (busy,
 * nothing to cancel) are reported as a {@link UpdateStatus#FAILED} event
 * with the reason. A disabled manager reports its refusal itself.
 */
@Singleton
public class CommandDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CommandDispatcher.class);

    private final UpdateManager manager;
    private final ProgressSink progressSink;
    private final Clock clock;
    private final ExecutorService executor;

    @Inject
    public CommandDispatcher(UpdateManager manager, ProgressSink progressSink, Clock clock) {
        this(manager, progressSink, clock, Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("update-command-%d")
                .setDaemon(true)
                .build()));
    }

    CommandDispatcher(UpdateManager manager, ProgressSink progressSink, Clock clock, ExecutorService executor) {
        this.manager = manager;
        this.progressSink = progressSink;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Entry point for the transport. Unknown commands are logged and dropped.
     */
    public void dispatch(String name, Map<String, Object> payload) {
        Optional<UpdateCommand> command = UpdateCommand.fromWire(name, payload);
        if (command.isEmpty()) {
            LOG.warn("Ignoring unknown server command '{}'", name);
            return;
        }
        submit(command.get());
    }

    public void submit(UpdateCommand command) {
        LOG.info("Processing server command {}", command.name());
        try {
            executor.execute(() -> run(command));
        } catch (RejectedExecutionException e) {
            LOG.warn("Dropping {} command, dispatcher is shut down", command.name());
        }
    }

    private void run(UpdateCommand command) {
        try {
            if (command instanceof CheckUpdate) {
                checkUpdate();
            } else if (command instanceof ForceUpdate force) {
                forceUpdate(force.reason());
            } else if (command instanceof CancelUpdate) {
                cancelUpdate();
            } else {
                LOG.warn("No handler for command {}", command.name());
            }
        } catch (RuntimeException e) {
            LOG.error("Command {} failed unexpectedly", command.name(), e);
            reportRefusal(command.name() + " failed: " + e.getMessage());
        }
    }

    private void checkUpdate() {
        LOG.info("Triggering immediate update check per server request");
        try {
            UpdateStatus result = manager.checkNow();
            LOG.info("Update check completed: {}", result.wireName());
        } catch (UpdateBusyException e) {
            LOG.warn("Update check refused: {}", e.getMessage());
            reportRefusal(e.getMessage());
        } catch (UpdateDisabledException e) {
            LOG.warn("Update check refused: {}", e.getMessage());
        } catch (UpdateException e) {
            LOG.error("Update check failed: {}", e.getMessage());
            reportRefusal(e.getMessage());
        }
    }

    private void forceUpdate(String reason) {
        LOG.info("Triggering forced install per server request (reason: {})", reason.isEmpty() ? "none" : reason);
        try {
            UpdateStatus result = manager.forceInstallLatest(reason);
            LOG.info("Forced install completed: {}", result.wireName());
        } catch (UpdateBusyException e) {
            LOG.warn("Forced install refused: {}", e.getMessage());
            reportRefusal(e.getMessage());
        } catch (UpdateDisabledException e) {
            LOG.warn("Forced install refused: {}", e.getMessage());
        } catch (UpdateException e) {
            LOG.error("Forced install failed: {}", e.getMessage());
            reportRefusal(e.getMessage());
        }
    }

    private void cancelUpdate() {
        if (manager.cancel()) {
            LOG.info("Update cancellation requested");
            return;
        }
        LOG.warn("Unable to cancel update: nothing running or in a non-cancellable phase");
        reportRefusal("Cannot cancel: no update running or update is in a non-cancellable phase");
    }

    private void reportRefusal(String message) {
        progressSink.publish(new ProgressEvent(UpdateStatus.FAILED, "", -1, message, message, clock.instant()));
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
