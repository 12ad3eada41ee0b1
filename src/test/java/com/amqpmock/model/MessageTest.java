package com.amqpmock.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MessageTest {

    @Test
    void testConstructorCopiesBodyAndProps() {
        byte[] body = "hello!".getBytes(StandardCharsets.UTF_8);
        Map<String, Object> props = new HashMap<>();
        props.put("content_type", "text/plain");

        Message message = new Message(body, "order.new", "order", props);
        body[0] = 'j';
        props.put("priority", 5);

        assertThat(message.getBodyAsString()).isEqualTo("hello!");
        assertThat(message.getProps()).containsOnlyKeys("content_type");
        assertThat(message.getRoutingKey()).isEqualTo("order.new");
        assertThat(message.getExchange()).isEqualTo("order");
    }

    @Test
    void testNullBodyAndPropsBecomeEmpty() {
        Message message = new Message(null, "order.new", "order", null);

        assertThat(message.getBody()).isEmpty();
        assertThat(message.getProps()).isEmpty();
    }

    @Test
    void testCopyIsIndependent() {
        Message original = new Message("hello!".getBytes(StandardCharsets.UTF_8), "order.new", "order",
                                       Map.of("app_id", "tests"));
        original.setDeliveryTag(7);
        original.setConsumerTag("");

        Message copy = original.copy();
        copy.getBody()[0] = 'j';
        copy.getProps().put("extra", true);

        assertThat(copy.getDeliveryTag()).isEqualTo(7);
        assertThat(copy.getConsumerTag()).isEmpty();
        assertThat(original.getBodyAsString()).isEqualTo("hello!");
        assertThat(original.getProps()).containsOnlyKeys("app_id");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testNestedPropsAreCopied() {
        Map<String, Object> headers = new HashMap<>();
        headers.put("trace", "abc");
        List<Object> tags = new ArrayList<>(List.of("a", new HashMap<>(Map.of("k", "v"))));
        byte[] signature = {1, 2};
        Map<String, Object> props = new HashMap<>();
        props.put("headers", headers);
        props.put("tags", tags);
        props.put("signature", signature);

        Message message = new Message(new byte[0], "order.new", "order", props);
        headers.put("trace", "changed");
        tags.add("b");
        signature[0] = 9;

        Message copy = message.copy();
        ((Map<String, Object>) copy.getProps().get("headers")).put("trace", "copy");

        assertThat(message.getProps().get("headers")).isEqualTo(Map.of("trace", "abc"));
        assertThat(message.getProps().get("tags")).isEqualTo(List.of("a", Map.of("k", "v")));
        assertThat((byte[]) message.getProps().get("signature")).containsExactly(1, 2);
    }

    @Test
    void testDeliveryFieldsDefaults() {
        Message message = new Message();

        assertThat(message.getDeliveryTag()).isZero();
        assertThat(message.isRedelivered()).isFalse();
        assertThat(message.getMessageCount()).isZero();
        assertThat(message.getConsumerTag()).isNull();
        assertThat(message.getContentType()).isNull();
    }
}
