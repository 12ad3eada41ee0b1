package com.amqpmock.model;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A routed message. Queues hold messages with only the publish-time fields set;
 * the delivery fields are stamped on the copy handed out by {@code get} or {@code recv}.
 */
public class Message {
    private byte[] body;
    private String routingKey;
    private String exchange;
    private Map<String, Object> props;

    // Delivery fields
    private long deliveryTag;
    private boolean redelivered;
    private int messageCount;
    private String consumerTag;
    private String contentType;

    public Message() {
        this.body = new byte[0];
        this.props = new HashMap<>();
    }

    public Message(byte[] body, String routingKey, String exchange, Map<String, Object> props) {
        this.body = body != null ? body.clone() : new byte[0];
        this.routingKey = routingKey;
        this.exchange = exchange;
        this.props = copyProps(props);
    }

    /**
     * Copies a props bag so no mutable structure is shared with the source. Nested maps,
     * lists and byte arrays are copied recursively; any other value is kept by reference
     * and is expected to be immutable (strings, numbers, booleans).
     */
    public static Map<String, Object> copyProps(Map<String, Object> props) {
        Map<String, Object> copy = new HashMap<>();
        if (props != null) {
            props.forEach((key, value) -> copy.put(key, copyValue(value)));
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> map = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, nested) -> map.put(key, copyValue(nested)));
            return map;
        }
        if (value instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object nested : (List<?>) value) {
                list.add(copyValue(nested));
            }
            return list;
        }
        if (value instanceof byte[]) {
            return ((byte[]) value).clone();
        }
        return value;
    }

    /**
     * Independent copy: body and props are not shared with this instance.
     */
    public Message copy() {
        Message copy = new Message(body, routingKey, exchange, props);
        copy.deliveryTag = deliveryTag;
        copy.redelivered = redelivered;
        copy.messageCount = messageCount;
        copy.consumerTag = consumerTag;
        copy.contentType = contentType;
        return copy;
    }

    public byte[] getBody() {
        return body;
    }

    public void setBody(byte[] body) {
        this.body = body;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public void setRoutingKey(String routingKey) {
        this.routingKey = routingKey;
    }

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public Map<String, Object> getProps() {
        return props;
    }

    public void setProps(Map<String, Object> props) {
        this.props = props;
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public void setDeliveryTag(long deliveryTag) {
        this.deliveryTag = deliveryTag;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public void setRedelivered(boolean redelivered) {
        this.redelivered = redelivered;
    }

    public int getMessageCount() {
        return messageCount;
    }

    public void setMessageCount(int messageCount) {
        this.messageCount = messageCount;
    }

    /**
     * @return {@code ""} for messages received via {@code recv}, {@code null} otherwise
     */
    public String getConsumerTag() {
        return consumerTag;
    }

    public void setConsumerTag(String consumerTag) {
        this.consumerTag = consumerTag;
    }

    /**
     * @return {@code ""} for messages fetched via {@code get}, {@code null} otherwise
     */
    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    @Override
    public String toString() {
        return String.format("Message{deliveryTag=%d, exchange='%s', routingKey='%s', bodySize=%d}",
                deliveryTag, exchange, routingKey, body != null ? body.length : 0);
    }
}
