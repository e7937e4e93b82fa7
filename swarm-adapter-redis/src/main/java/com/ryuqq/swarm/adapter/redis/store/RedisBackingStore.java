package com.ryuqq.swarm.adapter.redis.store;

import com.ryuqq.swarm.core.error.StoreException;
import com.ryuqq.swarm.core.spi.BackingStore;
import com.ryuqq.swarm.core.spi.MessageListener;
import com.ryuqq.swarm.core.spi.Subscription;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.SetArgs;
import io.lettuce.core.TransactionResult;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Redis 기반 BackingStore 구현체 (Lettuce).
 *
 * <p>여러 프로세스(Orchestrator, Agent Launcher, Agent Worker)가 같은 Redis를 바라보며
 * 세션 상태를 공유할 때 사용하는 프로덕션 구현입니다.</p>
 *
 * <p><strong>연결 구성:</strong></p>
 * <ul>
 *   <li>명령 연결: thread-safe 단일 연결을 모든 호출자가 공유 (Lettuce 동기 API)</li>
 *   <li>pub/sub 연결: 첫 subscribe 시 생성, 채널별 리스너 목록으로 분배</li>
 *   <li>트랜잭션 연결: executeAtomically 호출마다 전용 연결에서 MULTI/EXEC</li>
 * </ul>
 *
 * <p><strong>오류 처리:</strong> Lettuce의 {@link RedisException}은 {@link StoreException}으로 변환됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (RedisBackingStore store = new RedisBackingStore("redis://localhost:6379")) {
 *     MemoryCoordinator memory = new MemoryCoordinator(store);
 *     ...
 * }
 * </pre>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public class RedisBackingStore implements BackingStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisBackingStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisCommands<String, String> commands;
    private final boolean ownsClient;

    private final Map<String, List<MessageListener>> listeners = new ConcurrentHashMap<>();
    private final Object pubSubLock = new Object();
    private volatile StatefulRedisPubSubConnection<String, String> pubSubConnection;

    /**
     * Redis URL로 생성 (클라이언트 수명 소유).
     *
     * @param redisUrl 예: {@code redis://localhost:6379/0}
     * @throws StoreException 연결 실패 시
     */
    public RedisBackingStore(String redisUrl) {
        this(createClient(redisUrl), true);
    }

    /**
     * 외부 클라이언트로 생성 (클라이언트 수명은 호출자 소유).
     *
     * @param client Redis 클라이언트
     * @throws StoreException 연결 실패 시
     */
    public RedisBackingStore(RedisClient client) {
        this(client, false);
    }

    private RedisBackingStore(RedisClient client, boolean ownsClient) {
        this(client, connect(client), ownsClient);
    }

    RedisBackingStore(RedisClient client, StatefulRedisConnection<String, String> connection, boolean ownsClient) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
        this.connection = connection;
        this.commands = connection.sync();
        this.ownsClient = ownsClient;
    }

    private RedisBackingStore(RedisClient client, RedisCommands<String, String> transactionCommands) {
        this.client = client;
        this.connection = null;
        this.commands = transactionCommands;
        this.ownsClient = false;
    }

    private static RedisClient createClient(String redisUrl) {
        if (redisUrl == null || redisUrl.isBlank()) {
            throw new IllegalArgumentException("redisUrl cannot be null or blank");
        }
        try {
            return RedisClient.create(redisUrl);
        } catch (RedisException | IllegalArgumentException e) {
            throw new StoreException("Invalid Redis URL: " + redisUrl, e);
        }
    }

    private static StatefulRedisConnection<String, String> connect(RedisClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        try {
            return client.connect();
        } catch (RedisException e) {
            throw new StoreException("Failed to connect to Redis", e);
        }
    }

    // ============================================================
    // Strings
    // ============================================================

    @Override
    public Optional<String> get(String key) {
        requireKey(key);
        return Optional.ofNullable(call(() -> commands.get(key)));
    }

    @Override
    public void set(String key, String value) {
        requireKey(key);
        requireValue(value);
        call(() -> commands.set(key, value));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        requireKey(key);
        requireValue(value);
        requireTtl(ttl);
        call(() -> commands.set(key, value, SetArgs.Builder.px(ttl.toMillis())));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        requireKey(key);
        requireValue(value);
        requireTtl(ttl);
        return "OK".equals(call(() -> commands.set(key, value, SetArgs.Builder.nx().px(ttl.toMillis()))));
    }

    @Override
    public long delete(String... keys) {
        if (keys == null || keys.length == 0) {
            return 0;
        }
        for (String key : keys) {
            requireKey(key);
        }
        return toLong(call(() -> commands.del(keys)));
    }

    @Override
    public boolean exists(String key) {
        requireKey(key);
        return toLong(call(() -> commands.exists(key))) > 0;
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        requireKey(key);
        requireTtl(ttl);
        return Boolean.TRUE.equals(call(() -> commands.pexpire(key, ttl.toMillis())));
    }

    @Override
    public long increment(String key, long delta) {
        requireKey(key);
        return toLong(call(() -> commands.incrby(key, delta)));
    }

    // ============================================================
    // Hashes
    // ============================================================

    @Override
    public void hashSet(String key, Map<String, String> fields) {
        requireKey(key);
        if (fields == null || fields.isEmpty()) {
            return;
        }
        call(() -> commands.hset(key, fields));
    }

    @Override
    public Optional<String> hashGet(String key, String field) {
        requireKey(key);
        return Optional.ofNullable(call(() -> commands.hget(key, field)));
    }

    @Override
    public Map<String, String> hashGetAll(String key) {
        requireKey(key);
        Map<String, String> all = call(() -> commands.hgetall(key));
        return all == null ? Map.of() : all;
    }

    @Override
    public long hashDelete(String key, String... fields) {
        requireKey(key);
        if (fields == null || fields.length == 0) {
            return 0;
        }
        return toLong(call(() -> commands.hdel(key, fields)));
    }

    // ============================================================
    // Sets
    // ============================================================

    @Override
    public long setAdd(String key, String... members) {
        requireKey(key);
        if (members == null || members.length == 0) {
            return 0;
        }
        return toLong(call(() -> commands.sadd(key, members)));
    }

    @Override
    public long setRemove(String key, String... members) {
        requireKey(key);
        if (members == null || members.length == 0) {
            return 0;
        }
        return toLong(call(() -> commands.srem(key, members)));
    }

    @Override
    public Set<String> setMembers(String key) {
        requireKey(key);
        Set<String> members = call(() -> commands.smembers(key));
        return members == null ? Set.of() : members;
    }

    // ============================================================
    // Lists
    // ============================================================

    @Override
    public long listPush(String key, String... values) {
        requireKey(key);
        if (values == null || values.length == 0) {
            return 0;
        }
        return toLong(call(() -> commands.lpush(key, values)));
    }

    @Override
    public void listTrim(String key, long start, long stop) {
        requireKey(key);
        call(() -> commands.ltrim(key, start, stop));
    }

    @Override
    public List<String> listRange(String key, long start, long stop) {
        requireKey(key);
        List<String> range = call(() -> commands.lrange(key, start, stop));
        return range == null ? List.of() : range;
    }

    // ============================================================
    // Pub/Sub
    // ============================================================

    @Override
    public long publish(String channel, String message) {
        requireKey(channel);
        requireValue(message);
        return toLong(call(() -> commands.publish(channel, message)));
    }

    @Override
    public Subscription subscribe(String channel, MessageListener listener) {
        requireKey(channel);
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        StatefulRedisPubSubConnection<String, String> pubSub = pubSub();
        List<MessageListener> channelListeners =
            listeners.computeIfAbsent(channel, ignored -> new CopyOnWriteArrayList<>());
        boolean first = channelListeners.isEmpty();
        channelListeners.add(listener);
        if (first) {
            call(() -> {
                pubSub.sync().subscribe(channel);
                return null;
            });
        }
        return new RedisSubscription(channel, listener);
    }

    private StatefulRedisPubSubConnection<String, String> pubSub() {
        StatefulRedisPubSubConnection<String, String> current = pubSubConnection;
        if (current != null) {
            return current;
        }
        synchronized (pubSubLock) {
            if (pubSubConnection == null) {
                StatefulRedisPubSubConnection<String, String> created = call(client::connectPubSub);
                created.addListener(new RedisPubSubAdapter<>() {
                    @Override
                    public void message(String channel, String message) {
                        dispatch(channel, message);
                    }
                });
                pubSubConnection = created;
            }
            return pubSubConnection;
        }
    }

    void dispatch(String channel, String message) {
        List<MessageListener> channelListeners = listeners.get(channel);
        if (channelListeners == null) {
            return;
        }
        for (MessageListener listener : channelListeners) {
            try {
                listener.onMessage(channel, message);
            } catch (RuntimeException e) {
                log.warn("Listener on channel {} failed: {}", channel, e.getMessage(), e);
            }
        }
    }

    // ============================================================
    // Batching
    // ============================================================

    /**
     * 전용 연결에서 MULTI/EXEC로 배치 실행.
     *
     * <p>배치가 예외를 던지면 DISCARD 후 예외를 그대로 전파합니다.
     * 배치 내 읽기는 큐에 쌓일 뿐 값을 반환하지 않습니다.</p>
     */
    @Override
    public void executeAtomically(Consumer<BackingStore> batch) {
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
        StatefulRedisConnection<String, String> transactionConnection = connect(client);
        try {
            RedisCommands<String, String> transaction = transactionConnection.sync();
            call(transaction::multi);
            try {
                batch.accept(new RedisBackingStore(client, transaction));
            } catch (RuntimeException e) {
                call(transaction::discard);
                throw e;
            }
            TransactionResult result = call(transaction::exec);
            if (result != null && result.wasDiscarded()) {
                throw new StoreException("Atomic batch was discarded by Redis");
            }
        } finally {
            transactionConnection.close();
        }
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    @Override
    public void close() {
        StatefulRedisPubSubConnection<String, String> pubSub = pubSubConnection;
        if (pubSub != null) {
            pubSub.close();
        }
        if (connection != null) {
            connection.close();
        }
        if (ownsClient) {
            client.shutdown();
        }
        log.debug("Redis backing store closed");
    }

    // ============================================================
    // Internal
    // ============================================================

    private <T> T call(Supplier<T> command) {
        try {
            return command.get();
        } catch (RedisException e) {
            throw new StoreException("Redis command failed: " + e.getMessage(), e);
        }
    }

    private static long toLong(Long value) {
        return value == null ? 0 : value;
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    private static void requireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    private static void requireTtl(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
    }

    private final class RedisSubscription implements Subscription {

        private final String channel;
        private final MessageListener listener;
        private final AtomicBoolean closed = new AtomicBoolean();

        private RedisSubscription(String channel, MessageListener listener) {
            this.channel = channel;
            this.listener = listener;
        }

        @Override
        public String channel() {
            return channel;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            List<MessageListener> channelListeners = listeners.get(channel);
            if (channelListeners == null) {
                return;
            }
            channelListeners.remove(listener);
            if (channelListeners.isEmpty()) {
                StatefulRedisPubSubConnection<String, String> pubSub = pubSubConnection;
                if (pubSub != null) {
                    call(() -> {
                        pubSub.sync().unsubscribe(channel);
                        return null;
                    });
                }
            }
        }
    }
}
