package com.ryuqq.swarm.core.statemachine;

/**
 * 상태 전이 검증.
 *
 * <p>Session, Task, Agent의 상태 전이가 허용된 규칙을 따르는지 검증합니다.
 * 허용되지 않은 전이는 {@link IllegalStateException}으로 즉시 실패합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태의 Session은 어떤 상태로도 전이 불가</li>
 *   <li>종료 상태의 Task는 FAILED → QUEUED (재시도)를 제외하고 전이 불가</li>
 *   <li>자기 자신으로의 전이 불가</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Session 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SessionStatus from, SessionStatus to) {
        requireNonNull(from, to);

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition session from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case INITIALIZING -> to == SessionStatus.ACTIVE || to == SessionStatus.CANCELLED;
            case ACTIVE -> to == SessionStatus.COMPLETING
                || to == SessionStatus.CANCELLED
                || to == SessionStatus.FAILED;
            case COMPLETING -> to == SessionStatus.COMPLETED || to == SessionStatus.FAILED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };

        reject(valid, "session", from, to);
    }

    /**
     * Task 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TaskStatus from, TaskStatus to) {
        requireNonNull(from, to);

        boolean valid = switch (from) {
            case QUEUED -> to == TaskStatus.ASSIGNED || to == TaskStatus.CANCELLED;
            case ASSIGNED -> to == TaskStatus.IN_PROGRESS
                || to == TaskStatus.QUEUED
                || to == TaskStatus.CANCELLED;
            case IN_PROGRESS -> to == TaskStatus.COMPLETED
                || to == TaskStatus.FAILED
                || to == TaskStatus.CANCELLED;
            case FAILED -> to == TaskStatus.QUEUED;
            case COMPLETED, CANCELLED -> false;
        };

        reject(valid, "task", from, to);
    }

    /**
     * Agent 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(AgentStatus from, AgentStatus to) {
        requireNonNull(from, to);

        boolean valid = switch (from) {
            case IDLE -> to == AgentStatus.BUSY || to == AgentStatus.OFFLINE || to == AgentStatus.ERROR;
            case BUSY -> to == AgentStatus.IDLE || to == AgentStatus.OFFLINE || to == AgentStatus.ERROR;
            case OFFLINE -> to == AgentStatus.IDLE || to == AgentStatus.ERROR;
            case ERROR -> to == AgentStatus.IDLE || to == AgentStatus.OFFLINE;
        };

        reject(valid, "agent", from, to);
    }

    /**
     * Task 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static TaskStatus transition(TaskStatus current, TaskStatus next) {
        validate(current, next);
        return next;
    }

    /**
     * Session 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static SessionStatus transition(SessionStatus current, SessionStatus next) {
        validate(current, next);
        return next;
    }

    /**
     * Agent 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static AgentStatus transition(AgentStatus current, AgentStatus next) {
        validate(current, next);
        return next;
    }

    private static void requireNonNull(Enum<?> from, Enum<?> to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
    }

    private static void reject(boolean valid, String subject, Enum<?> from, Enum<?> to) {
        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid %s state transition: %s → %s", subject, from, to)
            );
        }
    }
}
