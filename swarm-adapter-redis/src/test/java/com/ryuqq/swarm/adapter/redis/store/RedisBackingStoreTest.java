package com.ryuqq.swarm.adapter.redis.store;

import com.ryuqq.swarm.core.error.StoreException;
import com.ryuqq.swarm.core.spi.Subscription;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.SetArgs;
import io.lettuce.core.TransactionResult;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.lettuce.core.pubsub.api.sync.RedisPubSubCommands;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * RedisBackingStore 테스트 (Lettuce 연결을 Mockito로 대체).
 *
 * @author Swarm Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RedisBackingStoreTest {

    @Mock
    private RedisClient client;

    @Mock
    private StatefulRedisConnection<String, String> connection;

    @Mock
    private RedisCommands<String, String> commands;

    private RedisBackingStore store;

    @BeforeEach
    void setUp() {
        when(connection.sync()).thenReturn(commands);
        store = new RedisBackingStore(client, connection, false);
    }

    // ============================================================
    // 기본 명령
    // ============================================================

    @Test
    void get_값이_없으면_empty() {
        // given
        when(commands.get("k")).thenReturn(null);

        // when & then
        assertThat(store.get("k")).isEmpty();
    }

    @Test
    void set_TTL은_PX로_전달됨() {
        // when
        store.set("k", "v", Duration.ofSeconds(5));

        // then
        verify(commands).set(eq("k"), eq("v"), any(SetArgs.class));
    }

    @Test
    void setIfAbsent_OK_응답이면_true() {
        // given
        when(commands.set(eq("claim"), eq("agent-1"), any(SetArgs.class))).thenReturn("OK", (String) null);

        // when & then
        assertThat(store.setIfAbsent("claim", "agent-1", Duration.ofMinutes(1))).isTrue();
        assertThat(store.setIfAbsent("claim", "agent-1", Duration.ofMinutes(1))).isFalse();
    }

    @Test
    void delete_키가_없으면_명령을_보내지_않음() {
        // when
        long deleted = store.delete();

        // then
        assertThat(deleted).isZero();
        verifyNoInteractions(commands);
    }

    @Test
    void expire_밀리초_단위로_전달됨() {
        // given
        when(commands.pexpire("k", 1500L)).thenReturn(true);

        // when & then
        assertThat(store.expire("k", Duration.ofMillis(1500))).isTrue();
    }

    @Test
    void hashGetAll_결과를_그대로_반환() {
        // given
        when(commands.hgetall("h")).thenReturn(Map.of("f", "v"));

        // when & then
        assertThat(store.hashGetAll("h")).containsEntry("f", "v");
    }

    @Test
    void listRange_null_응답은_빈_목록() {
        // given
        when(commands.lrange("l", 0, -1)).thenReturn(null);

        // when & then
        assertThat(store.listRange("l", 0, -1)).isEmpty();
    }

    @Test
    void RedisException은_StoreException으로_변환() {
        // given
        when(commands.get("k")).thenThrow(new RedisConnectionException("connection refused"));

        // when & then
        assertThatThrownBy(() -> store.get("k"))
            .isInstanceOf(StoreException.class)
            .hasMessageContaining("connection refused")
            .hasCauseInstanceOf(RedisConnectionException.class);
    }

    @Test
    void null_키는_IllegalArgumentException() {
        assertThatThrownBy(() -> store.get(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // executeAtomically
    // ============================================================

    @Test
    void executeAtomically_전용_연결에서_MULTI_EXEC() {
        // given
        StatefulRedisConnection<String, String> txConnection = mockConnection();
        RedisCommands<String, String> txCommands = mockCommands();
        TransactionResult result = org.mockito.Mockito.mock(TransactionResult.class);
        when(client.connect()).thenReturn(txConnection);
        when(txConnection.sync()).thenReturn(txCommands);
        when(txCommands.exec()).thenReturn(result);
        when(result.wasDiscarded()).thenReturn(false);

        // when
        store.executeAtomically(batch -> {
            batch.set("a", "1");
            batch.setAdd("s", "m");
        });

        // then
        InOrder order = inOrder(txCommands, txConnection);
        order.verify(txCommands).multi();
        order.verify(txCommands).set("a", "1");
        order.verify(txCommands).sadd("s", "m");
        order.verify(txCommands).exec();
        order.verify(txConnection).close();
        verify(commands, never()).set(any(), any());
    }

    @Test
    void executeAtomically_배치_실패시_DISCARD_후_예외_전파() {
        // given
        StatefulRedisConnection<String, String> txConnection = mockConnection();
        RedisCommands<String, String> txCommands = mockCommands();
        when(client.connect()).thenReturn(txConnection);
        when(txConnection.sync()).thenReturn(txCommands);

        // when & then
        assertThatThrownBy(() -> store.executeAtomically(batch -> {
            batch.set("a", "1");
            throw new IllegalStateException("abort");
        })).isInstanceOf(IllegalStateException.class);

        verify(txCommands).discard();
        verify(txCommands, never()).exec();
        verify(txConnection).close();
    }

    @Test
    void executeAtomically_Redis가_폐기하면_StoreException() {
        // given
        StatefulRedisConnection<String, String> txConnection = mockConnection();
        RedisCommands<String, String> txCommands = mockCommands();
        TransactionResult result = org.mockito.Mockito.mock(TransactionResult.class);
        when(client.connect()).thenReturn(txConnection);
        when(txConnection.sync()).thenReturn(txCommands);
        when(txCommands.exec()).thenReturn(result);
        when(result.wasDiscarded()).thenReturn(true);

        // when & then
        assertThatThrownBy(() -> store.executeAtomically(batch -> batch.set("a", "1")))
            .isInstanceOf(StoreException.class)
            .hasMessageContaining("discarded");
        verify(txConnection).close();
    }

    // ============================================================
    // Pub/Sub
    // ============================================================

    @Test
    void 같은_채널_구독은_한번만_SUBSCRIBE하고_마지막_해제시_UNSUBSCRIBE() {
        // given
        StatefulRedisPubSubConnection<String, String> pubSubConnection = mockPubSubConnection();
        RedisPubSubCommands<String, String> pubSubCommands = mockPubSubCommands();
        when(client.connectPubSub()).thenReturn(pubSubConnection);
        when(pubSubConnection.sync()).thenReturn(pubSubCommands);

        // when
        Subscription first = store.subscribe("ch", (channel, message) -> { });
        Subscription second = store.subscribe("ch", (channel, message) -> { });
        first.close();
        first.close();

        // then
        verify(pubSubCommands, times(1)).subscribe("ch");
        verify(pubSubCommands, never()).unsubscribe("ch");

        second.close();
        verify(pubSubCommands).unsubscribe("ch");
    }

    @Test
    void 실패하는_리스너가_다른_리스너_전달을_막지_않음() {
        // given
        StatefulRedisPubSubConnection<String, String> pubSubConnection = mockPubSubConnection();
        RedisPubSubCommands<String, String> pubSubCommands = mockPubSubCommands();
        when(client.connectPubSub()).thenReturn(pubSubConnection);
        when(pubSubConnection.sync()).thenReturn(pubSubCommands);
        List<String> received = new ArrayList<>();
        store.subscribe("ch", (channel, message) -> {
            throw new IllegalStateException("boom");
        });
        store.subscribe("ch", (channel, message) -> received.add(message));

        // when
        store.dispatch("ch", "hello");
        store.dispatch("other", "ignored");

        // then
        assertThat(received).containsExactly("hello");
    }

    @Test
    void close_외부_클라이언트는_종료하지_않음() {
        // when
        store.close();

        // then
        verify(connection).close();
        verify(client, never()).shutdown();
    }

    private static StatefulRedisConnection<String, String> mockConnection() {
        return org.mockito.Mockito.mock();
    }

    private static RedisCommands<String, String> mockCommands() {
        return org.mockito.Mockito.mock();
    }

    private static StatefulRedisPubSubConnection<String, String> mockPubSubConnection() {
        return org.mockito.Mockito.mock();
    }

    private static RedisPubSubCommands<String, String> mockPubSubCommands() {
        return org.mockito.Mockito.mock();
    }
}
