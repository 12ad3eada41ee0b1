package com.amqpmock.server;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TransactionTest {

    @Test
    void testCommitReplaysInOrder() {
        Transaction transaction = new Transaction(4);
        transaction.add(action("one"));
        transaction.add(action("two"));
        List<String> replayed = new ArrayList<>();

        int count = transaction.commit((channel, action) -> {
            assertThat(channel).isEqualTo(4);
            replayed.add(new String(action.body, StandardCharsets.UTF_8));
        });

        assertThat(count).isEqualTo(2);
        assertThat(replayed).containsExactly("one", "two");
        assertThat(transaction.size()).isZero();
    }

    @Test
    void testCommitFailureKeepsBuffer() {
        Transaction transaction = new Transaction(1);
        transaction.add(action("one"));
        transaction.add(action("two"));
        List<String> replayed = new ArrayList<>();

        assertThatThrownBy(() -> transaction.commit((channel, action) -> {
            String body = new String(action.body, StandardCharsets.UTF_8);
            if (body.equals("two")) {
                throw new IllegalStateException("boom");
            }
            replayed.add(body);
        })).isInstanceOf(IllegalStateException.class);

        assertThat(replayed).containsExactly("one");
        assertThat(transaction.size()).isEqualTo(2);
    }

    @Test
    void testGetActionsIsACopy() {
        Transaction transaction = new Transaction(1);
        transaction.add(action("one"));

        transaction.getActions().clear();

        assertThat(transaction.getActions()).hasSize(1);
    }

    @Test
    void testRollbackDiscards() {
        Transaction transaction = new Transaction(1);
        transaction.add(action("one"));

        assertThat(transaction.rollback()).isEqualTo(1);
        assertThat(transaction.size()).isZero();
    }

    @Test
    void testActionIsDetachedFromCaller() {
        byte[] body = "one".getBytes(StandardCharsets.UTF_8);
        Transaction.PublishAction action = new Transaction.PublishAction("order.new", body, null, null);
        body[0] = 'x';

        assertThat(new String(action.body, StandardCharsets.UTF_8)).isEqualTo("one");
        assertThat(action.options).isEmpty();
        assertThat(action.props).isEmpty();
    }

    private static Transaction.PublishAction action(String body) {
        return new Transaction.PublishAction("order.new", body.getBytes(StandardCharsets.UTF_8),
                                             Map.of("exchange", "order"), null);
    }
}
