package com.ryuqq.ulid.core.integrity;

/**
 * 무결성 검사 실패 신호.
 *
 * <p>{@link IntegrityChecker} 내부에서만 잡히며, 호출자에게는
 * {@link com.ryuqq.ulid.core.exception.FatalInitializationException}으로 전달됩니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public class IntegrityViolation extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public IntegrityViolation(String message) {
        super(message);
    }

    /**
     * 조건이 거짓이면 실패.
     *
     * @param condition 검사 조건
     * @param message 실패 메시지
     * @throws IntegrityViolation condition이 false인 경우
     */
    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new IntegrityViolation(message);
        }
    }
}
