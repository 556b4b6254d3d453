package shadeagent.relayer.service.queue;

import shadeagent.relayer.dto.intent.IntentMessage;

/**
 * A fetched queue item. {@code intent} is null when the payload could not be decoded;
 * {@code rawToken} is null only for an empty poll.
 */
public record QueuedIntent(IntentMessage intent, String rawToken) {

    private static final QueuedIntent EMPTY = new QueuedIntent(null, null);

    public static QueuedIntent empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return rawToken == null;
    }
}
