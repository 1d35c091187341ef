package de.bsommerfeld.fleetagent.agent.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.fleetagent.updater.policy.FleetUpdatePolicy;
import de.bsommerfeld.fleetagent.updater.policy.MaintenanceWindow;
import de.bsommerfeld.fleetagent.updater.policy.PolicyParseException;
import de.bsommerfeld.fleetagent.updater.policy.PolicySpec;
import de.bsommerfeld.fleetagent.updater.policy.VersionPinStrategy;
import de.bsommerfeld.fleetagent.updater.util.JsonSupport;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Reads the fleet policy document served to agents. The policy fields sit
 * at the top level next to {@code tenant_id} and {@code updated_at}.
 */
public final class FleetPolicyParser {

    private FleetPolicyParser() {
    }

    /**
     * @throws PolicyParseException if the document is malformed or names an
     *                              unknown pin strategy
     */
    public static FleetUpdatePolicy parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new PolicyParseException("Fleet policy must be a JSON object");
        }
        Document doc;
        try {
            doc = JsonSupport.mapper().treeToValue(node, Document.class);
        } catch (JsonProcessingException e) {
            throw new PolicyParseException("Malformed fleet policy: " + e.getOriginalMessage());
        }

        Window w = doc.maintenanceWindow;
        MaintenanceWindow window = w == null
                ? MaintenanceWindow.DISABLED
                : new MaintenanceWindow(w.enabled, w.startHour, w.startMin, w.endHour, w.endMin, w.timezone,
                        w.daysOfWeek == null ? Set.of() : Set.copyOf(w.daysOfWeek));

        VersionPinStrategy strategy = doc.versionPinStrategy == null || doc.versionPinStrategy.isBlank()
                ? VersionPinStrategy.MINOR
                : VersionPinStrategy.parse(doc.versionPinStrategy);

        PolicySpec spec = new PolicySpec(doc.updateCheckDays, strategy, doc.allowMajorUpgrade, doc.targetVersion,
                doc.collectTelemetry, window);
        return new FleetUpdatePolicy(doc.tenantId, spec, doc.updatedAt);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Document {
        @JsonProperty("tenant_id")
        String tenantId;
        @JsonProperty("updated_at")
        Instant updatedAt;
        @JsonProperty("update_check_days")
        int updateCheckDays = 7;
        @JsonProperty("version_pin_strategy")
        String versionPinStrategy;
        @JsonProperty("allow_major_upgrade")
        boolean allowMajorUpgrade;
        @JsonProperty("target_version")
        String targetVersion;
        @JsonProperty("collect_telemetry")
        boolean collectTelemetry = true;
        @JsonProperty("maintenance_window")
        Window maintenanceWindow;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Window {
        @JsonProperty("enabled")
        boolean enabled;
        @JsonProperty("start_hour")
        int startHour;
        @JsonProperty("start_min")
        int startMin;
        @JsonProperty("end_hour")
        int endHour;
        @JsonProperty("end_min")
        int endMin;
        @JsonProperty("timezone")
        String timezone;
        @JsonProperty("days_of_week")
        List<Integer> daysOfWeek;
    }
}
