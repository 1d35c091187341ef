package de.bsommerfeld.fleetagent.updater.version;

import de.bsommerfeld.fleetagent.updater.policy.PolicySpec;
import de.bsommerfeld.fleetagent.updater.policy.VersionPinStrategy;

import java.util.Optional;

/**
 * Decides whether an offered version may replace the running one under a
 * policy. Forced installs bypass this entirely.
 */
public final class VersionEligibility {

    private VersionEligibility() {
    }

    public record Decision(boolean eligible, String reason) {

        static Decision allow(String reason) {
            return new Decision(true, reason);
        }

        static Decision deny(String reason) {
            return new Decision(false, reason);
        }
    }

    public static Decision evaluate(String running, String candidate, PolicySpec spec) {
        if (candidate == null || candidate.isBlank()) {
            return Decision.deny("No version offered");
        }
        // A target version restricts every strategy, not only "pin"
        if (spec.versionPinStrategy() == VersionPinStrategy.PIN || !spec.targetVersion().isBlank()) {
            return evaluatePin(running, candidate, spec.targetVersion());
        }

        Optional<SemanticVersion> current = SemanticVersion.parse(running);
        Optional<SemanticVersion> offered = SemanticVersion.parse(candidate);
        if (current.isEmpty() || offered.isEmpty()) {
            // Without an ordering only "latest" can tell that something changed
            if (spec.versionPinStrategy() == VersionPinStrategy.LATEST && !sameText(running, candidate)) {
                return Decision.allow("Version " + candidate + " differs from unparseable " + running);
            }
            return Decision.deny("Cannot compare versions '" + running + "' and '" + candidate + "'");
        }

        SemanticVersion from = current.get();
        SemanticVersion to = offered.get();
        if (!to.isNewerThan(from)) {
            return Decision.deny("Already on " + running + " (offered " + candidate + ")");
        }

        switch (spec.versionPinStrategy()) {
            case PATCH:
                if (!to.sameMinorLine(from)) {
                    return Decision.deny(candidate + " leaves the " + from.major() + "." + from.minor() + " line");
                }
                break;
            case MINOR:
            case LATEST:
                if (!to.sameMajor(from) && !spec.allowMajorUpgrade()) {
                    return Decision.deny("Major upgrade to " + candidate + " not allowed");
                }
                break;
            default:
                break;
        }
        return Decision.allow("Update " + running + " -> " + candidate + " allowed by "
                + spec.versionPinStrategy().wireName() + " strategy");
    }

    private static Decision evaluatePin(String running, String candidate, String target) {
        if (target == null || target.isBlank()) {
            return Decision.deny("Pin strategy without target version");
        }
        if (!sameVersion(candidate, target)) {
            return Decision.deny("Target version " + target + " set; offered " + candidate + " not allowed");
        }
        if (sameVersion(candidate, running)) {
            return Decision.deny("Already on target version " + target);
        }
        return Decision.allow("Moving to target version " + target);
    }

    public static boolean sameVersion(String left, String right) {
        Optional<SemanticVersion> l = SemanticVersion.parse(left);
        Optional<SemanticVersion> r = SemanticVersion.parse(right);
        if (l.isPresent() && r.isPresent()) {
            return l.get().compareTo(r.get()) == 0;
        }
        return sameText(left, right);
    }

    private static boolean sameText(String left, String right) {
        return SemanticVersion.normalize(left).equalsIgnoreCase(SemanticVersion.normalize(right));
    }
}
