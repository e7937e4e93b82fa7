package com.ryuqq.swarm.core.error;

/**
 * Backing Store 접근 실패 (연결 불가, 직렬화 오류 등).
 *
 * <p>호출 단위로 실패하며, 호출자는 경고 로그를 남기고 메모리 상의 상태로 계속 동작합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
