package com.ryuqq.swarm.core.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * 세션 공유 컨텍스트.
 *
 * <p>같은 세션의 Task 핸들러들이 값을 주고받는 문자열 키 → 값 Map입니다.
 * 값은 직렬화 가능해야 하며(JSON), null은 허용하지 않습니다.</p>
 *
 * <p>변경 리스너가 설정되어 있으면 {@link #put(String, Object)} 호출마다 통지되며,
 * Orchestrator는 이를 이용해 Memory Coordinator에 값을 미러링합니다.
 * 리스너 예외는 put 호출자에게 전파되지 않습니다.</p>
 *
 * <p>Thread-safe.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class SharedContext {

    private static final Logger log = LoggerFactory.getLogger(SharedContext.class);

    private final Map<String, Object> values = new ConcurrentHashMap<>();
    private volatile BiConsumer<String, Object> changeListener = (key, value) -> { };

    public SharedContext() {
    }

    public SharedContext(Map<String, Object> initialValues) {
        if (initialValues != null) {
            initialValues.forEach(this::putQuietly);
        }
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 타입 지정 값 조회.
     *
     * @param key 키
     * @param type 기대 타입
     * @return 값 (없거나 타입이 다르면 empty)
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /**
     * 값 저장 후 리스너 통지.
     *
     * @param key 키
     * @param value 값 (null 불가)
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public void put(String key, Object value) {
        putQuietly(key, value);
        try {
            changeListener.accept(key, value);
        } catch (RuntimeException e) {
            log.warn("Shared context change listener failed for key {}", key, e);
        }
    }

    public Object remove(String key) {
        return values.remove(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * 현재 값의 스냅샷 (키 정렬 없음).
     *
     * @return 복사본
     */
    public Map<String, Object> snapshot() {
        return new LinkedHashMap<>(values);
    }

    /**
     * 변경 리스너 설정.
     *
     * @param listener 리스너 (null이면 해제)
     */
    public void onChange(BiConsumer<String, Object> listener) {
        this.changeListener = listener == null ? (key, value) -> { } : listener;
    }

    private void putQuietly(String key, Object value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Shared context key and value cannot be null (key: " + key + ")");
        }
        values.put(key, value);
    }
}
