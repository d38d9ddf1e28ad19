package com.ryuqq.fleet.core.statemachine;

/**
 * 실행 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → EVALUATING</li>
 *   <li>EVALUATING → PLANNED</li>
 *   <li>EVALUATING → ABORTED</li>
 *   <li>PLANNED → EXECUTING</li>
 *   <li>EXECUTING → COMPLETED</li>
 *   <li>EXECUTING → ABORTED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, ABORTED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>EXECUTING 진입에는 동결된 Plan(PLANNED)이 필요</li>
 * </ul>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunState from, RunState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case IDLE -> to == RunState.EVALUATING;
            case EVALUATING -> to == RunState.PLANNED || to == RunState.ABORTED;
            case PLANNED -> to == RunState.EXECUTING;
            case EXECUTING -> to == RunState.COMPLETED || to == RunState.ABORTED;
            case COMPLETED, ABORTED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RunState transition(RunState current, RunState next) {
        validate(current, next);
        return next;
    }
}
