package de.bsommerfeld.fleetagent.updater.policy;

/**
 * Thrown when a policy value read from configuration or the wire cannot be
 * mapped onto a known constant.
 */
public class PolicyParseException extends RuntimeException {

    public PolicyParseException(String message) {
        super(message);
    }
}
