package com.ryuqq.ulid.core.exception;

import com.ryuqq.ulid.core.integrity.IntegrityReport;

/**
 * 복구 불가능한 초기화 실패.
 *
 * <p>다음 두 경우에만 발생합니다:</p>
 * <ul>
 *   <li>시스템 무결성 검사({@link com.ryuqq.ulid.core.integrity.IntegrityChecker}) 실패</li>
 *   <li>TimeSource가 48비트에 담을 수 없는 timestamp를 반환</li>
 * </ul>
 *
 * <p>이 예외가 발생하면 식별자 생성은 거부되며, 재시도하지 않습니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public class FatalInitializationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final transient IntegrityReport report;

    /**
     * 메시지로 생성.
     *
     * @param message 실패 원인
     */
    public FatalInitializationException(String message) {
        this(message, null);
    }

    /**
     * 무결성 검사 보고서와 함께 생성.
     *
     * @param message 실패 원인
     * @param report 실패한 검사 결과 (nullable)
     */
    public FatalInitializationException(String message, IntegrityReport report) {
        super(message);
        this.report = report;
    }

    /**
     * 무결성 검사 보고서 조회.
     *
     * @return 보고서, timestamp 오버플로로 발생한 경우 null
     */
    public IntegrityReport getReport() {
        return report;
    }
}
