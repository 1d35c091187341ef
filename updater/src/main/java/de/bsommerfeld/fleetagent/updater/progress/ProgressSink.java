package de.bsommerfeld.fleetagent.updater.progress;

/**
 * Receives every progress event the update manager emits. Implementations
 * must not block and must not throw.
 */
@FunctionalInterface
public interface ProgressSink {

    void publish(ProgressEvent event);
}
