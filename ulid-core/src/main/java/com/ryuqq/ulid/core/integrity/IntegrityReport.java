package com.ryuqq.ulid.core.integrity;

import com.ryuqq.ulid.core.exception.FatalInitializationException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 무결성 검사 실행 결과.
 *
 * @param results 검사 순서대로의 결과 목록
 * @author ULID Team
 * @since 1.0.0
 */
public record IntegrityReport(List<Result> results) {

    /**
     * 단일 검사 결과.
     *
     * @param name 검사 이름
     * @param passed 통과 여부
     * @param detail 실패 사유 (통과 시 null)
     */
    public record Result(String name, boolean passed, String detail) {

        public Result {
            if (name == null) {
                throw new IllegalArgumentException("name cannot be null");
            }
        }

        public static Result passed(String name) {
            return new Result(name, true, null);
        }

        public static Result failed(String name, String detail) {
            return new Result(name, false, detail);
        }
    }

    public IntegrityReport {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        results = List.copyOf(results);
    }

    /**
     * 모든 검사 통과 여부.
     *
     * @return 실패가 하나도 없으면 true
     */
    public boolean isOk() {
        return results.stream().allMatch(Result::passed);
    }

    public List<Result> failures() {
        return results.stream()
            .filter(result -> !result.passed())
            .collect(Collectors.toList());
    }

    /**
     * 실패가 있으면 초기화 거부.
     *
     * @return this (통과 시)
     * @throws FatalInitializationException 하나라도 실패한 경우
     */
    public IntegrityReport requireOk() {
        if (!isOk()) {
            throw new FatalInitializationException(summary(), this);
        }
        return this;
    }

    /**
     * 실패 요약 메시지.
     *
     * @return 통과 시 "all N checks passed", 실패 시 실패 항목 나열
     */
    public String summary() {
        List<Result> failures = failures();
        if (failures.isEmpty()) {
            return "all " + results.size() + " checks passed";
        }
        return failures.size() + " of " + results.size() + " system checks failed: "
            + failures.stream()
                .map(result -> result.name() + " (" + result.detail() + ")")
                .collect(Collectors.joining(", "));
    }
}
