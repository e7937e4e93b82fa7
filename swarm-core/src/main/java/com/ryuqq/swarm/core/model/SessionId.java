package com.ryuqq.swarm.core.model;

import java.util.UUID;

/**
 * Session 식별자.
 *
 * <p>Orchestrator가 세션 생성 시 UUID 기반으로 발급하며, Backing Store 키와
 * 이벤트 채널 이름의 일부로 사용됩니다.</p>
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
public final class SessionId {

    private final String value;

    private SessionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("SessionId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("SessionId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * SessionId 생성.
     *
     * @param value 식별자 값
     * @return SessionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SessionId of(String value) {
        return new SessionId(value);
    }

    /**
     * 새로운 SessionId 발급 (UUID 기반).
     *
     * @return 신규 SessionId
     */
    public static SessionId generate() {
        return new SessionId(UUID.randomUUID().toString());
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
        SessionId that = (SessionId) o;
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
