package shadeagent.relayer.service.queue;

import java.util.List;

import shadeagent.relayer.dto.intent.ValidatedIntent;

/**
 * Reliable work queue. A fetched item stays invisible to other consumers until it is
 * acknowledged or its visibility timeout expires.
 */
public interface IntentQueue {

    void enqueue(ValidatedIntent intent);

    /**
     * Waits up to the configured poll timeout for the next item.
     *
     * @return the next item, or {@link QueuedIntent#empty()} when the queue is idle
     */
    QueuedIntent fetchNext();

    /**
     * Acknowledges an item. A copy that was already made visible again after a lease
     * expiry is withdrawn too.
     */
    void ack(String rawToken);

    /**
     * Restarts the visibility timeout of an item its consumer is still working on,
     * reclaiming it if the lease already expired and it is waiting for redelivery.
     */
    void extendVisibility(String rawToken);

    void moveToDeadLetter(String rawToken);

    List<String> deadLetters();
}
