package com.ryuqq.ulid.application.generator;

/**
 * UlidGenerator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>systemChecks: 생성 시점에 시스템 무결성 검사 실행 (기본 true)</li>
 *   <li>registerShutdownHook: JVM 종료 시 영속 카운터 반납 (기본 false)</li>
 * </ul>
 *
 * <p>systemChecks는 생성자에서 한 번만 읽힙니다. 실행 중에 바꿀 수 없습니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 * @param systemChecks 무결성 검사 실행 여부
 * @param registerShutdownHook 종료 훅 등록 여부
 */
public record GeneratorConfig(boolean systemChecks, boolean registerShutdownHook) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: systemChecks=true, registerShutdownHook=false</p>
     */
    public GeneratorConfig() {
        this(true, false);
    }

    public GeneratorConfig withSystemChecks(boolean systemChecks) {
        return new GeneratorConfig(systemChecks, this.registerShutdownHook);
    }

    public GeneratorConfig withRegisterShutdownHook(boolean registerShutdownHook) {
        return new GeneratorConfig(this.systemChecks, registerShutdownHook);
    }
}
