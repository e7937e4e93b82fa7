package com.ryuqq.swarm.core.model;

/**
 * Agent 식별자.
 *
 * <p>호출자가 명시하거나, Orchestrator가 {@code {sessionId}_agent_{index}} 형태로 합성합니다.
 * Launcher가 템플릿에서 생성하는 경우 {@code {template}_{8 hex}} 형태를 사용합니다.</p>
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
public final class AgentId {

    private final String value;

    private AgentId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AgentId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("AgentId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("AgentId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * AgentId 생성.
     *
     * @param value 식별자 값
     * @return AgentId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AgentId of(String value) {
        return new AgentId(value);
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
        AgentId that = (AgentId) o;
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
