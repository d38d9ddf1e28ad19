package com.ryuqq.fleet.core.spi;

import java.util.List;

/**
 * 원격 명령 실행 결과.
 *
 * @param exitCode 종료 코드
 * @param stdout 표준 출력 (줄 단위)
 * @param stderr 표준 에러 (줄 단위)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record CommandResult(int exitCode, List<String> stdout, List<String> stderr) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException stdout 또는 stderr가 null인 경우
     */
    public CommandResult {
        if (stdout == null) {
            throw new IllegalArgumentException("stdout cannot be null");
        }
        if (stderr == null) {
            throw new IllegalArgumentException("stderr cannot be null");
        }
        stdout = List.copyOf(stdout);
        stderr = List.copyOf(stderr);
    }

    /**
     * 성공 결과 생성.
     *
     * @param stdout 표준 출력
     * @return exitCode 0인 CommandResult
     */
    public static CommandResult success(List<String> stdout) {
        return new CommandResult(0, stdout, List.of());
    }

    /**
     * 실패 결과 생성.
     *
     * @param exitCode 종료 코드 (0이 아닌 값)
     * @param stderr 표준 에러
     * @return CommandResult
     */
    public static CommandResult failure(int exitCode, List<String> stderr) {
        return new CommandResult(exitCode, List.of(), stderr);
    }

    /**
     * 성공 여부 확인.
     *
     * @return exitCode가 0이면 true
     */
    public boolean isSuccess() {
        return exitCode == 0;
    }
}
