package de.bsommerfeld.fleetagent.agent.policy;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.fleetagent.core.config.AutoUpdateConfig;
import de.bsommerfeld.fleetagent.core.config.LocalPolicyConfig;
import de.bsommerfeld.fleetagent.core.config.MaintenanceWindowConfig;
import de.bsommerfeld.fleetagent.updater.policy.AgentOverrideMode;
import de.bsommerfeld.fleetagent.updater.policy.FleetUpdatePolicy;
import de.bsommerfeld.fleetagent.updater.policy.MaintenanceWindow;
import de.bsommerfeld.fleetagent.updater.policy.PolicyParseException;
import de.bsommerfeld.fleetagent.updater.policy.PolicyProvider;
import de.bsommerfeld.fleetagent.updater.policy.PolicySpec;
import de.bsommerfeld.fleetagent.updater.policy.VersionPinStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Policy inputs from the agent's {@code [auto-update]} configuration and the
 * fleet policy store. Configuration is read once; misconfigured values are
 * logged and replaced by their defaults.
 */
@Singleton
public class ConfigPolicyProvider implements PolicyProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigPolicyProvider.class);

    private final AgentOverrideMode mode;
    private final PolicySpec localPolicy;
    private final FleetPolicyStore fleetPolicies;

    @Inject
    public ConfigPolicyProvider(AutoUpdateConfig config, FleetPolicyStore fleetPolicies) {
        this.mode = parseMode(config.getMode());
        this.localPolicy = toSpec(config.getLocalPolicy());
        this.fleetPolicies = fleetPolicies;
        LOG.info("Auto-update mode {}, local policy: check every {} days, strategy {}", mode.wireName(),
                localPolicy.updateCheckDays(), localPolicy.versionPinStrategy().wireName());
    }

    @Override
    public AgentOverrideMode overrideMode() {
        return mode;
    }

    @Override
    public PolicySpec localPolicy() {
        return localPolicy;
    }

    @Override
    public Optional<FleetUpdatePolicy> fleetPolicy() {
        return fleetPolicies.current();
    }

    static AgentOverrideMode parseMode(String raw) {
        try {
            return AgentOverrideMode.parse(raw);
        } catch (PolicyParseException e) {
            LOG.warn("{}; using '{}'", e.getMessage(), AgentOverrideMode.INHERIT.wireName());
            return AgentOverrideMode.INHERIT;
        }
    }

    static PolicySpec toSpec(LocalPolicyConfig config) {
        if (config == null) {
            return PolicySpec.defaults();
        }
        VersionPinStrategy strategy;
        try {
            strategy = VersionPinStrategy.parse(config.getVersionPinStrategy());
        } catch (PolicyParseException e) {
            LOG.warn("{}; using '{}'", e.getMessage(), VersionPinStrategy.MINOR.wireName());
            strategy = VersionPinStrategy.MINOR;
        }
        return new PolicySpec(config.getUpdateCheckDays(), strategy, config.isAllowMajorUpgrade(),
                config.getTargetVersion(), config.isCollectTelemetry(), toWindow(config.getMaintenanceWindow()));
    }

    private static MaintenanceWindow toWindow(MaintenanceWindowConfig config) {
        if (config == null) {
            return MaintenanceWindow.DISABLED;
        }
        return new MaintenanceWindow(config.isEnabled(), config.getStartHour(), config.getStartMinute(),
                config.getEndHour(), config.getEndMinute(), config.getTimezone(),
                config.getDaysOfWeek() == null ? Set.of() : Set.copyOf(config.getDaysOfWeek()));
    }
}
