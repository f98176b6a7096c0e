package com.ryuqq.ulid.core.exception;

/**
 * 외부 표현(바이트, 정수, 문자열)을 식별자로 복원하지 못한 경우 발생하는 예외.
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>바이트 길이가 포맷의 고정 길이와 다름</li>
 *   <li>문자열 길이 불일치 또는 알파벳 외 문자 포함</li>
 *   <li>정수가 음수이거나 포맷의 비트 폭을 초과</li>
 *   <li>timestamp/randomness 필드가 각자의 비트 폭을 초과</li>
 * </ul>
 *
 * <p>호출자에게 즉시 전달되며, 내부적으로 재시도하지 않습니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public class DecodeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 메시지로 생성.
     *
     * @param message 실패 원인
     */
    public DecodeException(String message) {
        super(message);
    }

    /**
     * 메시지와 원인 예외로 생성.
     *
     * @param message 실패 원인
     * @param cause 원인 예외
     */
    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
