package de.bsommerfeld.fleetagent.agent.runtime;

import de.bsommerfeld.fleetagent.updater.source.RestartTrigger;
import de.bsommerfeld.fleetagent.updater.update.UpdateErrorCode;
import de.bsommerfeld.fleetagent.updater.update.UpdateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Restarts the agent after an install.
 *
 * <p>
 * A configured restart command (e.g. {@code systemctl restart fleet-agent})
 * is launched first. The process then exits with {@link #RESTART_EXIT_CODE}
 * after a short delay that lets pending progress reach the server; a service
 * manager configured to restart the agent brings up the new binary.
 */
public class ProcessRestartTrigger implements RestartTrigger {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessRestartTrigger.class);

    /** EX_TEMPFAIL: tells the service manager the exit is transient. */
    public static final int RESTART_EXIT_CODE = 75;

    private final List<String> restartCommand;
    private final Duration exitDelay;
    private final IntConsumer exiter;

    public ProcessRestartTrigger(List<String> restartCommand, Duration exitDelay) {
        this(restartCommand, exitDelay, System::exit);
    }

    ProcessRestartTrigger(List<String> restartCommand, Duration exitDelay, IntConsumer exiter) {
        this.restartCommand = restartCommand == null ? List.of() : List.copyOf(restartCommand);
        this.exitDelay = exitDelay;
        this.exiter = exiter;
    }

    @Override
    public boolean restart() throws UpdateException {
        if (!restartCommand.isEmpty()) {
            LOG.info("Running restart command: {}", String.join(" ", restartCommand));
            try {
                new ProcessBuilder(restartCommand)
                        .redirectErrorStream(true)
                        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                        .start();
            } catch (IOException | IllegalArgumentException e) {
                throw new UpdateException(UpdateErrorCode.RESTART_FAILED,
                        "Restart command failed: " + e.getMessage(), e);
            }
        }

        Thread exit = new Thread(() -> {
            try {
                Thread.sleep(exitDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            LOG.info("Exiting with code {} to restart into the new version", RESTART_EXIT_CODE);
            exiter.accept(RESTART_EXIT_CODE);
        }, "agent-restart");
        exit.start();
        return true;
    }
}
