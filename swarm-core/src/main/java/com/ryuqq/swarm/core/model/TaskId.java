package com.ryuqq.swarm.core.model;

/**
 * Task 식별자.
 *
 * <p>세션 내 Task 키로부터 {@code {sessionId}_{key}} 형태로 파생됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용 (Backing Store 키 구분자 ':' 충돌 방지)</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class TaskId {

    private final String value;

    private TaskId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("TaskId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("TaskId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * TaskId 생성.
     *
     * @param value 식별자 값
     * @return TaskId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TaskId of(String value) {
        return new TaskId(value);
    }

    /**
     * 세션 ID와 Task 키로부터 TaskId 파생.
     *
     * @param sessionId 소속 세션
     * @param key 세션 내 고유 Task 키
     * @return {@code {sessionId}_{key}} 형태의 TaskId
     * @throws IllegalArgumentException sessionId가 null이거나 key가 유효하지 않은 경우
     */
    public static TaskId of(SessionId sessionId, String key) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return new TaskId(sessionId.getValue() + "_" + key);
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskId that = (TaskId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
