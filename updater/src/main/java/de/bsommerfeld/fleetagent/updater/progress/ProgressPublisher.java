package de.bsommerfeld.fleetagent.updater.progress;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.fleetagent.core.event.ApplicationEventBus;

/**
 * Fans progress out to local observers, synchronously through the
 * {@link ApplicationEventBus}, and to the fleet server through the
 * {@link RemoteProgressForwarder}.
 */
@Singleton
public class ProgressPublisher implements ProgressSink {

    private final ApplicationEventBus eventBus;
    private final RemoteProgressForwarder forwarder;

    @Inject
    public ProgressPublisher(ApplicationEventBus eventBus, RemoteProgressForwarder forwarder) {
        this.eventBus = eventBus;
        this.forwarder = forwarder;
    }

    @Override
    public void publish(ProgressEvent event) {
        eventBus.post(event);
        forwarder.enqueue(event);
    }
}
