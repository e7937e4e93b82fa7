package com.ryuqq.swarm.core.error;

/**
 * 잘못된 Session / Task / Agent / Launch 구성.
 *
 * <p>상태를 변경하기 전에 동기적으로 발생합니다. 이 예외가 던져진 경우
 * 어떤 상태도 저장되거나 시작되지 않았음이 보장됩니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
