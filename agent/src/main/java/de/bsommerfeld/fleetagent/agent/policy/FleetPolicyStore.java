package de.bsommerfeld.fleetagent.agent.policy;

import com.google.inject.Singleton;
import de.bsommerfeld.fleetagent.updater.policy.FleetUpdatePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the last fleet policy received from the server. Each arrival
 * replaces the previous one.
 */
@Singleton
public class FleetPolicyStore {

    private static final Logger LOG = LoggerFactory.getLogger(FleetPolicyStore.class);

    private final AtomicReference<FleetUpdatePolicy> current = new AtomicReference<>();

    public Optional<FleetUpdatePolicy> current() {
        return Optional.ofNullable(current.get());
    }

    public void update(FleetUpdatePolicy policy) {
        FleetUpdatePolicy previous = current.getAndSet(policy);
        if (!Objects.equals(previous, policy)) {
            LOG.info("Fleet update policy {} (tenant {}, updated {})", previous == null ? "received" : "changed",
                    policy.tenantId(), policy.updatedAt());
        }
    }

    /**
     * Forgets the fleet policy; resolution falls back to the local policy.
     */
    public void clear() {
        if (current.getAndSet(null) != null) {
            LOG.info("Fleet update policy withdrawn, falling back to local policy");
        }
    }
}
