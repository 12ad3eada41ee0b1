package com.amqpmock.server;

import com.amqpmock.config.BrokerConfig;
import com.amqpmock.exception.ConnectionFailedException;
import com.amqpmock.exception.NoQueueSelectedException;
import com.amqpmock.exception.NoTransactionException;
import com.amqpmock.exception.NotConnectedException;
import com.amqpmock.exception.TransactionAlreadyStartedException;
import com.amqpmock.exception.UnknownBindingException;
import com.amqpmock.exception.UnknownChannelException;
import com.amqpmock.exception.UnknownExchangeException;
import com.amqpmock.exception.UnknownQueueException;
import com.amqpmock.exception.UnsupportedOptionException;
import com.amqpmock.model.Binding;
import com.amqpmock.model.Exchange;
import com.amqpmock.model.Message;
import com.amqpmock.model.Queue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory stand-in for an AMQP broker client, for tests that publish and consume
 * without a live broker.
 *
 * <p>All state lives in this object: open channels, exchanges, queues, bindings,
 * per-channel transaction buffers and the global delivery tag counter. Every operation
 * completes or fails immediately; nothing blocks. Public methods are synchronized on the
 * broker so it can be shared between threads.
 *
 * <pre>
 * MockBroker broker = new MockBroker();
 * broker.connect();
 * broker.channelOpen(1);
 * broker.exchangeDeclare(1, "order");
 * broker.queueDeclare(1, "new-orders");
 * broker.queueBind(1, "new-orders", "order", "order.new");
 * broker.publish(1, "order.new", "hello!", Map.of("exchange", "order"));
 * broker.consume(1, "new-orders");
 * Optional&lt;Message&gt; message = broker.recv();
 * </pre>
 */
public class MockBroker {
    private static final Logger logger = LoggerFactory.getLogger(MockBroker.class);

    public static final String OPTION_EXCHANGE = "exchange";
    public static final String OPTION_NO_LOCAL = "no_local";
    public static final String OPTION_NO_ACK = "no_ack";
    public static final String OPTION_EXCLUSIVE = "exclusive";

    private static final Map<String, Object> CONSUME_DEFAULTS = Map.of(
        OPTION_NO_LOCAL, false,
        OPTION_NO_ACK, true,
        OPTION_EXCLUSIVE, false
    );

    private final BrokerConfig config;
    private boolean connected;
    private long deliveryTag;
    private String currentQueue;

    private final Set<Integer> channels = new HashSet<>();
    private final Map<String, Exchange> exchanges = new LinkedHashMap<>();
    private final Map<String, Queue> queues = new LinkedHashMap<>();
    private final Map<Integer, Transaction> transactions = new HashMap<>();

    public MockBroker() {
        this(new BrokerConfig());
    }

    public MockBroker(BrokerConfig config) {
        this.config = config;
        logger.debug("Mock broker created: {}", config);
    }

    // Connection and channels

    public synchronized void connect() {
        if (!config.isConnectable()) {
            logger.debug("Connect refused, broker is not connectable");
            throw new ConnectionFailedException();
        }
        connected = true;
        logger.debug("Connected");
    }

    public synchronized void disconnect() {
        requireConnected("disconnect");
        connected = false;
        logger.debug("Disconnected");
    }

    public synchronized void channelOpen(int channel) {
        requireConnected("channel_open");
        channels.add(channel);
        logger.debug("Opened channel {}", channel);
    }

    /**
     * Closes the channel only. Exchanges, queues and bindings are broker-wide and stay;
     * a transaction still pending on the channel is kept as well.
     */
    public synchronized void channelClose(int channel) {
        requireConnected("channel_close");
        if (!channels.remove(channel)) {
            throw new UnknownChannelException(channel);
        }
        if (transactions.containsKey(channel)) {
            logger.warn("Channel {} closed with {} uncommitted publishes", channel, transactions.get(channel).size());
        }
        logger.debug("Closed channel {}", channel);
    }

    // Topology

    public synchronized void exchangeDeclare(int channel, String name) {
        exchangeDeclare(channel, name, null);
    }

    /**
     * Declares an exchange. Re-declaring keeps the existing exchange and its bindings.
     * Options are accepted for API parity and otherwise ignored.
     */
    public synchronized void exchangeDeclare(int channel, String name, Map<String, Object> options) {
        requireChannel(channel, "exchange_declare");
        if (exchanges.containsKey(name)) {
            logger.debug("Exchange {} already declared", name);
            return;
        }
        exchanges.put(name, new Exchange(name, options));
        logger.debug("Declared exchange: {}", name);
    }

    public synchronized void exchangeDelete(int channel, String name) {
        requireChannel(channel, "exchange_delete");
        Exchange exchange = requireExchange(name);
        exchanges.remove(name);
        logger.debug("Deleted exchange {} with {} bindings", name, exchange.getBindings().size());
    }

    public synchronized void queueDeclare(int channel, String name) {
        queueDeclare(channel, name, null);
    }

    /**
     * Declares a queue. Re-declaring an existing queue leaves its pending messages in place.
     * Options are accepted for API parity and otherwise ignored.
     */
    public synchronized void queueDeclare(int channel, String name, Map<String, Object> options) {
        requireChannel(channel, "queue_declare");
        if (queues.containsKey(name)) {
            logger.debug("Queue {} already declared", name);
            return;
        }
        queues.put(name, new Queue(name, options));
        logger.debug("Declared queue: {}", name);
    }

    /**
     * Deletes a queue together with every binding that targets it.
     *
     * @return the number of messages discarded with the queue
     */
    public synchronized int queueDelete(int channel, String name) {
        requireChannel(channel, "queue_delete");
        Queue queue = requireQueue(name);

        int unbound = 0;
        for (Exchange exchange : exchanges.values()) {
            unbound += exchange.removeAllBindingsToQueue(name);
        }
        queues.remove(name);
        if (name.equals(currentQueue)) {
            currentQueue = null;
        }

        logger.debug("Deleted queue {} with {} messages and {} bindings", name, queue.size(), unbound);
        return queue.size();
    }

    /**
     * @return the number of messages discarded
     */
    public synchronized int queuePurge(int channel, String name) {
        requireChannel(channel, "queue_purge");
        int purged = requireQueue(name).purge();
        logger.debug("Purged {} messages from queue {}", purged, name);
        return purged;
    }

    /**
     * Binds a queue to an exchange. The binding key may use {@code #} (any run of characters,
     * dots included) or {@code *} (one dot-free word). Binding the same key on the same
     * exchange again replaces the previous destination queue.
     */
    public synchronized void queueBind(int channel, String queueName, String exchangeName, String bindingKey) {
        requireChannel(channel, "queue_bind");
        requireQueue(queueName);
        Exchange exchange = requireExchange(exchangeName);

        exchange.addBinding(bindingKey, queueName).ifPresent(previous ->
            logger.debug("Binding {} on exchange {} rebound from queue {} to {}",
                        bindingKey, exchangeName, previous.getQueueName(), queueName));
        logger.debug("Bound queue {} to exchange {} with binding key {}", queueName, exchangeName, bindingKey);
    }

    public synchronized void queueUnbind(int channel, String queueName, String exchangeName, String bindingKey) {
        requireChannel(channel, "queue_unbind");
        requireQueue(queueName);
        Exchange exchange = requireExchange(exchangeName);

        if (exchange.removeBinding(bindingKey).isEmpty()) {
            throw new UnknownBindingException(exchangeName, bindingKey);
        }
        logger.debug("Unbound queue {} from exchange {} with binding key {}", queueName, exchangeName, bindingKey);
    }

    // Publish

    public synchronized void publish(int channel, String routingKey, String body, Map<String, Object> options) {
        publish(channel, routingKey, body, options, null);
    }

    public synchronized void publish(int channel, String routingKey, String body,
                                     Map<String, Object> options, Map<String, Object> props) {
        publish(channel, routingKey, body != null ? body.getBytes(StandardCharsets.UTF_8) : null, options, props);
    }

    public synchronized void publish(int channel, String routingKey, byte[] body, Map<String, Object> options) {
        publish(channel, routingKey, body, options, null);
    }

    /**
     * Publishes a message. Inside a transaction the call is only buffered; nothing is
     * validated or routed until commit. Otherwise the message is copied onto the queue of
     * every binding of the target exchange that matches the routing key.
     *
     * @param options {@code exchange} selects the target exchange, defaulting to the configured default exchange
     * @param props   opaque properties echoed back on the delivered message
     */
    public synchronized void publish(int channel, String routingKey, byte[] body,
                                     Map<String, Object> options, Map<String, Object> props) {
        Transaction transaction = transactions.get(channel);
        if (transaction != null) {
            transaction.add(new Transaction.PublishAction(routingKey, body, options, props));
            logger.debug("Buffered publish of {} in transaction on channel {}", routingKey, channel);
            return;
        }
        route(channel, new Transaction.PublishAction(routingKey, body, options, props));
    }

    private void route(int channel, Transaction.PublishAction action) {
        requireChannel(channel, "publish");

        String exchangeName = exchangeName(action);
        Exchange exchange = requireExchange(exchangeName);

        List<Binding> matched = exchange.route(action.routingKey);
        for (Binding binding : matched) {
            Queue queue = queues.get(binding.getQueueName());
            if (queue == null) {
                logger.warn("Binding {} targets missing queue {}", binding.getBindingKey(), binding.getQueueName());
                continue;
            }
            queue.enqueue(new Message(action.body, action.routingKey, exchangeName, action.props));
            if (config.isDebug()) {
                logger.info("Routing key {} matched binding {}, delivered to queue {}",
                           action.routingKey, binding.getBindingKey(), queue.getName());
            } else {
                logger.debug("Routing key {} matched binding {}, delivered to queue {}",
                            action.routingKey, binding.getBindingKey(), queue.getName());
            }
        }

        logger.debug("Published {} to {} queues via exchange {}", action.routingKey, matched.size(), exchangeName);
    }

    private String exchangeName(Transaction.PublishAction action) {
        Object requested = action.options.get(OPTION_EXCHANGE);
        return requested != null ? requested.toString() : config.getDefaultExchange();
    }

    // Transactions

    public synchronized void txSelect(int channel) {
        requireChannel(channel, "tx_select");
        if (transactions.containsKey(channel)) {
            throw new TransactionAlreadyStartedException(channel);
        }
        transactions.put(channel, new Transaction(channel));
        logger.debug("Transaction started on channel {}", channel);
    }

    /**
     * Replays the buffered publishes in order through the immediate publish path, so
     * unknown exchanges surface here. Every target exchange is checked before anything is
     * routed: on failure no queue changes and the transaction stays open.
     */
    public synchronized void txCommit(int channel) {
        requireChannel(channel, "tx_commit");
        Transaction transaction = transactions.get(channel);
        if (transaction == null) {
            throw new NoTransactionException(channel);
        }
        for (Transaction.PublishAction action : transaction.getActions()) {
            requireExchange(exchangeName(action));
        }
        int actionCount = transaction.commit(this::route);
        transactions.remove(channel);
        logger.debug("Transaction committed on channel {}: {} publishes routed", channel, actionCount);
    }

    public synchronized void txRollback(int channel) {
        requireChannel(channel, "tx_rollback");
        Transaction transaction = transactions.remove(channel);
        if (transaction == null) {
            throw new NoTransactionException(channel);
        }
        int actionCount = transaction.rollback();
        logger.debug("Transaction rolled back on channel {}: {} publishes discarded", channel, actionCount);
    }

    // Consume and retrieval

    public synchronized void consume(int channel, String queueName) {
        consume(channel, queueName, null);
    }

    /**
     * Selects the queue read by {@link #recv()}. There is one selection per broker, not per
     * channel. Only {@code no_ack=true} is supported.
     */
    public synchronized void consume(int channel, String queueName, Map<String, Object> options) {
        requireChannel(channel, "consume");
        requireQueue(queueName);

        Map<String, Object> effective = new HashMap<>(CONSUME_DEFAULTS);
        if (options != null) {
            effective.putAll(options);
        }
        Object noAck = effective.get(OPTION_NO_ACK);
        if (!isTrue(noAck)) {
            throw new UnsupportedOptionException(OPTION_NO_ACK, noAck);
        }

        currentQueue = queueName;
        logger.debug("Consuming from queue {} on channel {}", queueName, channel);
    }

    public synchronized Optional<Message> get(int channel, String queueName) {
        return get(channel, queueName, null);
    }

    /**
     * Fetches the oldest message of the queue. An empty queue gives an empty result.
     * Options are accepted for API parity and otherwise ignored.
     */
    public synchronized Optional<Message> get(int channel, String queueName, Map<String, Object> options) {
        requireChannel(channel, "get");
        Message message = requireQueue(queueName).dequeue();
        if (message == null) {
            return Optional.empty();
        }

        message.setDeliveryTag(++deliveryTag);
        message.setContentType("");
        message.setRedelivered(false);
        message.setMessageCount(0);
        return Optional.of(message.copy());
    }

    /**
     * Takes the oldest message of the queue selected by {@code consume}. Never blocks:
     * an empty queue gives an empty result.
     */
    public synchronized Optional<Message> recv() {
        requireConnected("recv");
        if (currentQueue == null) {
            throw new NoQueueSelectedException();
        }
        Message message = requireQueue(currentQueue).dequeue();
        if (message == null) {
            return Optional.empty();
        }

        message.setDeliveryTag(++deliveryTag);
        message.setConsumerTag("");
        return Optional.of(message.copy());
    }

    // Inspection

    public synchronized boolean isConnected() {
        return connected;
    }

    public synchronized boolean isChannelOpen(int channel) {
        return channels.contains(channel);
    }

    public synchronized boolean isInTransaction(int channel) {
        return transactions.containsKey(channel);
    }

    public synchronized boolean hasExchange(String name) {
        return exchanges.containsKey(name);
    }

    public synchronized boolean hasQueue(String name) {
        return queues.containsKey(name);
    }

    public synchronized int getMessageCount(String queueName) {
        Queue queue = queues.get(queueName);
        return queue != null ? queue.size() : 0;
    }

    public synchronized List<Binding> getBindings(String exchangeName) {
        Exchange exchange = exchanges.get(exchangeName);
        return exchange != null ? exchange.getBindings() : Collections.emptyList();
    }

    public synchronized Optional<String> getCurrentQueue() {
        return Optional.ofNullable(currentQueue);
    }

    /**
     * @return the last delivery tag handed out, 0 before the first delivery
     */
    public synchronized long getDeliveryTag() {
        return deliveryTag;
    }

    public synchronized void setConnectable(boolean connectable) {
        config.setConnectable(connectable);
    }

    public synchronized boolean isConnectable() {
        return config.isConnectable();
    }

    public synchronized void setDebug(boolean debug) {
        config.setDebug(debug);
    }

    public synchronized boolean isDebug() {
        return config.isDebug();
    }

    // Checks, in the order connection, channel, queue, exchange

    private void requireConnected(String operation) {
        if (!connected) {
            throw new NotConnectedException(operation);
        }
    }

    private void requireChannel(int channel, String operation) {
        requireConnected(operation);
        if (!channels.contains(channel)) {
            throw new UnknownChannelException(channel);
        }
    }

    private Queue requireQueue(String name) {
        Queue queue = queues.get(name);
        if (queue == null) {
            throw new UnknownQueueException(name);
        }
        return queue;
    }

    private Exchange requireExchange(String name) {
        Exchange exchange = exchanges.get(name);
        if (exchange == null) {
            throw new UnknownExchangeException(name);
        }
        return exchange;
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            return Boolean.parseBoolean(text) || "1".equals(text);
        }
        return false;
    }
}
