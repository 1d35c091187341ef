package de.bsommerfeld.fleetagent.updater.download;

/**
 * Cooperative cancellation flag polled between download chunks and between
 * update phases.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NEVER = () -> false;

    boolean isCancelled();
}
