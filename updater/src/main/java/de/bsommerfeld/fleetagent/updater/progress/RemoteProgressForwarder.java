package de.bsommerfeld.fleetagent.updater.progress;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands progress events to the remote channel on a background thread.
 *
 * <p>
 * {@link #enqueue(ProgressEvent)} never blocks. When the bounded queue is
 * full the oldest queued event is dropped, so a slow or offline server only
 * loses stale intermediate steps. Send failures are logged and the event is
 * discarded; there is no retry.
 */
public class RemoteProgressForwarder implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteProgressForwarder.class);

    public static final int DEFAULT_CAPACITY = 256;

    private final RemoteProgressChannel channel;
    private final BlockingDeque<ProgressEvent> queue;
    private final ExecutorService sender;
    private final AtomicLong dropped = new AtomicLong();

    public RemoteProgressForwarder(RemoteProgressChannel channel, int capacity) {
        this.channel = channel;
        this.queue = new LinkedBlockingDeque<>(capacity);
        this.sender = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("progress-forwarder-%d")
                .setDaemon(true)
                .build());
        this.sender.execute(this::drain);
    }

    public void enqueue(ProgressEvent event) {
        while (!queue.offerLast(event)) {
            ProgressEvent oldest = queue.pollFirst();
            if (oldest != null) {
                long total = dropped.incrementAndGet();
                LOG.debug("Progress queue full, dropped {} event (total dropped: {})", oldest.status(), total);
            }
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    int pending() {
        return queue.size();
    }

    private void drain() {
        while (!Thread.currentThread().isInterrupted()) {
            ProgressEvent event;
            try {
                event = queue.takeFirst();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                channel.send(event);
            } catch (Exception e) {
                LOG.warn("Failed to forward {} progress to server: {}", event.status(), e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        sender.shutdownNow();
        try {
            if (!sender.awaitTermination(2, TimeUnit.SECONDS)) {
                LOG.warn("Progress forwarder did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
