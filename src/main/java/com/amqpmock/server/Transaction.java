package com.amqpmock.server;

import com.amqpmock.model.Message;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes buffered on a channel between {@code txSelect} and {@code txCommit}/{@code txRollback}.
 * Buffered calls are kept as issued; routing happens only when they are replayed.
 */
class Transaction {
    private final int channel;
    private final List<PublishAction> buffer = new ArrayList<>();

    /**
     * A publish call captured with its full argument set.
     */
    static class PublishAction {
        final String routingKey;
        final byte[] body;
        final Map<String, Object> options;
        final Map<String, Object> props;

        PublishAction(String routingKey, byte[] body, Map<String, Object> options, Map<String, Object> props) {
            this.routingKey = routingKey;
            this.body = body != null ? body.clone() : new byte[0];
            this.options = options != null ? new HashMap<>(options) : new HashMap<>();
            this.props = Message.copyProps(props);
        }
    }

    /**
     * Replays a buffered publish through the immediate routing path.
     */
    interface Publisher {
        void publish(int channel, PublishAction action);
    }

    Transaction(int channel) {
        this.channel = channel;
    }

    void add(PublishAction action) {
        buffer.add(action);
    }

    int size() {
        return buffer.size();
    }

    List<PublishAction> getActions() {
        return new ArrayList<>(buffer);
    }

    /**
     * Replay every buffered publish in original order. The buffer is cleared only once
     * all of them went through; callers validate the actions beforehand.
     */
    int commit(Publisher publisher) {
        for (PublishAction action : buffer) {
            publisher.publish(channel, action);
        }
        int committed = buffer.size();
        buffer.clear();
        return committed;
    }

    int rollback() {
        int discarded = buffer.size();
        buffer.clear();
        return discarded;
    }
}
