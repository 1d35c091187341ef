package de.bsommerfeld.fleetagent.agent.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.fleetagent.agent.command.CommandDispatcher;
import de.bsommerfeld.fleetagent.agent.policy.FleetPolicyParser;
import de.bsommerfeld.fleetagent.agent.policy.FleetPolicyStore;
import de.bsommerfeld.fleetagent.core.config.ServerConfig;
import de.bsommerfeld.fleetagent.updater.policy.PolicyParseException;
import de.bsommerfeld.fleetagent.updater.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Pulls pending commands and the fleet update policy from the server on a
 * fixed interval.
 *
 * <p>
 * Commands arrive as {@code {"commands": [{"command": "...", "data": {...}}]}}
 * and go to the {@link CommandDispatcher}. The policy endpoint answers 204
 * when the tenant has no fleet policy, which withdraws the current one.
 */
@Singleton
public class CommandPoller implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CommandPoller.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {
    };

    private final ServerConnection connection;
    private final CommandDispatcher dispatcher;
    private final FleetPolicyStore fleetPolicies;
    private final Duration interval;
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                    .setNameFormat("command-poller-%d")
                    .setDaemon(true)
                    .build());

    private boolean serverReachable = true;

    @Inject
    public CommandPoller(ServerConnection connection, CommandDispatcher dispatcher, FleetPolicyStore fleetPolicies,
            ServerConfig serverConfig) {
        this(connection, dispatcher, fleetPolicies,
                Duration.ofSeconds(Math.max(5, serverConfig.getCommandPollSeconds())));
    }

    CommandPoller(ServerConnection connection, CommandDispatcher dispatcher, FleetPolicyStore fleetPolicies,
            Duration interval) {
        this.connection = connection;
        this.dispatcher = dispatcher;
        this.fleetPolicies = fleetPolicies;
        this.interval = interval;
    }

    public void start() {
        LOG.info("Polling server for commands every {} s", interval.toSeconds());
        executor.scheduleWithFixedDelay(this::pollCycle, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    void pollCycle() {
        try {
            pollPolicy();
            pollCommands();
            if (!serverReachable) {
                LOG.info("Fleet server reachable again");
                serverReachable = true;
            }
        } catch (IOException e) {
            // Log the first failure of a streak only
            if (serverReachable) {
                LOG.warn("Fleet server unreachable: {}", e.getMessage());
                serverReachable = false;
            } else {
                LOG.debug("Fleet server still unreachable: {}", e.getMessage());
            }
        } catch (RuntimeException e) {
            LOG.error("Command poll failed", e);
        }
    }

    private void pollPolicy() throws IOException {
        Optional<JsonNode> policy = connection.getJson(connection.agentPath("/update-policy"));
        if (policy.isEmpty()) {
            fleetPolicies.clear();
            return;
        }
        try {
            fleetPolicies.update(FleetPolicyParser.parse(policy.get()));
        } catch (PolicyParseException e) {
            LOG.warn("Ignoring fleet policy: {}", e.getMessage());
        }
    }

    private void pollCommands() throws IOException {
        Optional<JsonNode> response = connection.getJson(connection.agentPath("/commands"));
        if (response.isEmpty()) {
            return;
        }
        for (JsonNode command : response.get().path("commands")) {
            String name = command.path("command").asText("");
            Map<String, Object> data = command.path("data").isObject()
                    ? JsonSupport.mapper().convertValue(command.get("data"), PAYLOAD)
                    : Map.of();
            dispatcher.dispatch(name, data);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
