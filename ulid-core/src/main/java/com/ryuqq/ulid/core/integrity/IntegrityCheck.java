package com.ryuqq.ulid.core.integrity;

/**
 * 단일 시스템 무결성 검사.
 *
 * <p>{@link #verify()}는 검사가 통과하면 정상 반환하고, 실패하면
 * {@link IntegrityViolation}을 던집니다. 그 밖의 RuntimeException도
 * {@link IntegrityChecker}가 실패로 기록합니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public interface IntegrityCheck {

    /**
     * 검사 이름 (로그와 보고서에 표시).
     *
     * @return 이름
     */
    String name();

    /**
     * 검사 실행.
     *
     * @throws IntegrityViolation 가정이 깨진 경우
     */
    void verify();

    /**
     * 람다로 검사 생성.
     *
     * @param name 검사 이름
     * @param body 검사 본문
     * @return IntegrityCheck
     */
    static IntegrityCheck of(String name, Runnable body) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return new IntegrityCheck() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void verify() {
                body.run();
            }

            @Override
            public String toString() {
                return "IntegrityCheck{" + name + '}';
            }
        };
    }
}
