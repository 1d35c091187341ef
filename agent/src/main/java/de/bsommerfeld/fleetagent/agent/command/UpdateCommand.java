package de.bsommerfeld.fleetagent.agent.command;

import java.util.Map;
import java.util.Optional;

/**
 * Update commands the fleet server can send. The untyped wire payload is
 * turned into one of these at the transport edge and nowhere else.
 */
public interface UpdateCommand {

    String CHECK_UPDATE = "check_update";
    String CANCEL_UPDATE = "cancel_update";
    String FORCE_UPDATE = "force_update";

    /** Wire name of the command. */
    String name();

    record CheckUpdate() implements UpdateCommand {
        @Override
        public String name() {
            return CHECK_UPDATE;
        }
    }

    record CancelUpdate() implements UpdateCommand {
        @Override
        public String name() {
            return CANCEL_UPDATE;
        }
    }

    /**
     * @param reason free text for logs and telemetry, never {@code null}
     */
    record ForceUpdate(String reason) implements UpdateCommand {

        public ForceUpdate {
            reason = reason == null ? "" : reason.trim();
        }

        @Override
        public String name() {
            return FORCE_UPDATE;
        }
    }

    /**
     * Maps a wire command onto its typed form.
     *
     * @param name    command name as sent by the server
     * @param payload command data, may be {@code null}
     * @return the command, or empty if the name is unknown
     */
    static Optional<UpdateCommand> fromWire(String name, Map<String, Object> payload) {
        if (name == null) {
            return Optional.empty();
        }
        switch (name.trim()) {
            case CHECK_UPDATE:
                return Optional.of(new CheckUpdate());
            case CANCEL_UPDATE:
                return Optional.of(new CancelUpdate());
            case FORCE_UPDATE:
                // A non-string reason is treated as absent
                Object reason = payload == null ? null : payload.get("reason");
                return Optional.of(new ForceUpdate(reason instanceof String s ? s : ""));
            default:
                return Optional.empty();
        }
    }
}
