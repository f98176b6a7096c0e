package com.ryuqq.ulid.adapter.file;

import java.nio.file.Path;

/**
 * FileCounterStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>path: 카운터 파일 위치 (기본 작업 디렉터리의 {@code .ulid-counter})</li>
 * </ul>
 *
 * <p>같은 파일을 여러 프로세스가 동시에 쓰는 구성은 지원하지 않습니다.
 * 프로세스마다 다른 경로를 지정하세요.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 * @param path 카운터 파일 경로 (null 불가, 디렉터리가 아니어야 함)
 */
public record FileCounterStoreConfig(Path path) {

    /** 기본 파일 이름. */
    public static final String DEFAULT_FILE_NAME = ".ulid-counter";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: path=./.ulid-counter</p>
     */
    public FileCounterStoreConfig() {
        this(Path.of(DEFAULT_FILE_NAME));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FileCounterStoreConfig {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (path.getFileName() == null) {
            throw new IllegalArgumentException("path must name a file (current: " + path + ")");
        }
    }

    /**
     * path만 변경한 새 인스턴스 생성.
     *
     * @param path 새 파일 경로
     * @return 새 FileCounterStoreConfig 인스턴스
     */
    public FileCounterStoreConfig withPath(Path path) {
        return new FileCounterStoreConfig(path);
    }
}
