package com.ryuqq.ulid.core.integrity;

import com.ryuqq.ulid.core.exception.FatalInitializationException;
import com.ryuqq.ulid.core.spi.EntropySource;
import com.ryuqq.ulid.core.spi.TimeSource;

import java.util.ArrayList;
import java.util.List;

/**
 * 시스템 무결성 검사기.
 *
 * <p>식별자 생성 전에 한 번 실행되어, 나머지 코드가 의존하는 비트 폭/바이트 순서/카운터 순환
 * 가정이 이 JVM에서 성립하는지 확인합니다. 검사 중 하나라도 실패하면 식별자 생성을
 * 거부합니다 ({@link #verify()}).</p>
 *
 * <p>모든 검사는 실패 여부와 관계없이 끝까지 실행되어 보고서에 담깁니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class IntegrityChecker {

    private final List<IntegrityCheck> checks;

    /**
     * 검사 목록으로 생성.
     *
     * @param checks 실행할 검사 (순서 유지)
     * @throws IllegalArgumentException checks가 null이거나 null 원소를 포함하는 경우
     */
    public IntegrityChecker(List<IntegrityCheck> checks) {
        if (checks == null) {
            throw new IllegalArgumentException("checks cannot be null");
        }
        this.checks = List.copyOf(checks);
    }

    /**
     * 기본 검사 세트.
     *
     * <ul>
     *   <li>128비트 부호 없는 정수 연산</li>
     *   <li>big-endian packing 왕복</li>
     *   <li>4/8/16/72/80비트 카운터 순환</li>
     *   <li>epoch 정의</li>
     *   <li>시계 범위</li>
     *   <li>엔트로피 소스 동작</li>
     * </ul>
     *
     * @param timeSource 검사할 시간 소스
     * @param entropySource 검사할 엔트로피 소스
     * @return IntegrityChecker
     */
    public static IntegrityChecker defaults(TimeSource timeSource, EntropySource entropySource) {
        List<IntegrityCheck> checks = new ArrayList<>();
        checks.add(SystemChecks.wideArithmetic());
        checks.add(SystemChecks.byteOrder());
        checks.add(SystemChecks.counterWrap(SystemChecks.COUNTER_WIDTHS));
        checks.add(SystemChecks.epochDefinition());
        checks.add(SystemChecks.clockRange(timeSource));
        checks.add(SystemChecks.entropyLiveness(entropySource));
        return new IntegrityChecker(checks);
    }

    public List<IntegrityCheck> checks() {
        return checks;
    }

    /**
     * 모든 검사를 실행하고 결과 보고.
     *
     * @return 검사 보고서 (예외를 던지지 않음)
     */
    public IntegrityReport run() {
        List<IntegrityReport.Result> results = new ArrayList<>(checks.size());
        for (IntegrityCheck check : checks) {
            results.add(runOne(check));
        }
        return new IntegrityReport(results);
    }

    /**
     * 모든 검사를 실행하고 실패 시 거부.
     *
     * @return 통과한 보고서
     * @throws FatalInitializationException 하나라도 실패한 경우
     */
    public IntegrityReport verify() {
        return run().requireOk();
    }

    private static IntegrityReport.Result runOne(IntegrityCheck check) {
        try {
            check.verify();
            return IntegrityReport.Result.passed(check.name());
        } catch (IntegrityViolation e) {
            return IntegrityReport.Result.failed(check.name(), e.getMessage());
        } catch (RuntimeException e) {
            return IntegrityReport.Result.failed(check.name(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
