package com.ryuqq.ulid.adapter.file;

import com.ryuqq.ulid.core.spi.CounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 파일 기반 {@link CounterStore}.
 *
 * <p>local_lexical 전략의 카운터를 프로세스 재시작 사이에 보존합니다.</p>
 *
 * <p><strong>파일 형식:</strong> 마지막으로 발급한 카운터 값의 10진수 문자열 한 줄 (UTF-8).</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>load: 파일이 없으면 empty. 내용이 숫자가 아니거나 80비트 범위를 벗어나면
 *       WARN 로그 후 empty (처음 실행과 동일하게 0부터 시작)</li>
 *   <li>save: 같은 디렉터리의 임시 파일에 쓴 뒤 원자적으로 교체.
 *       파일 시스템이 원자적 이동을 지원하지 않으면 일반 교체로 대체</li>
 *   <li>I/O 실패: {@link UncheckedIOException}으로 전파</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 한 프로세스 안에서 load와 save는 한 번씩만 호출됩니다.
 * 여러 프로세스가 같은 파일을 쓰는 경우 잠금을 걸지 않으며, 마지막에 쓴 값이 남습니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public class FileCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(FileCounterStore.class);

    /** 저장 가능한 최대값 (80비트 카운터). */
    static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(80).subtract(BigInteger.ONE);

    private final Path path;

    /**
     * 기본 설정으로 생성 ({@code ./.ulid-counter}).
     */
    public FileCounterStore() {
        this(new FileCounterStoreConfig());
    }

    /**
     * 설정으로 생성.
     *
     * @param config 파일 위치 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public FileCounterStore(FileCounterStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.path = config.path().toAbsolutePath();
    }

    public Path path() {
        return path;
    }

    @Override
    public Optional<BigInteger> load() {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8).strip();
        } catch (NoSuchFileException e) {
            log.debug("No counter file at {}, starting fresh", path);
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read counter file " + path, e);
        }

        Optional<BigInteger> value = parse(content);
        if (value.isEmpty()) {
            log.warn("Ignoring unreadable counter file {} (content: '{}')", path, abbreviate(content));
            return Optional.empty();
        }
        log.debug("Loaded counter {} from {}", value.get(), path);
        return value;
    }

    @Override
    public void save(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative (current: " + value + ")");
        }

        Path directory = path.getParent();
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            try {
                Files.writeString(temp, value.toString() + System.lineSeparator(), StandardCharsets.UTF_8);
                move(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write counter file " + path, e);
        }
        log.debug("Stored counter {} to {}", value, path);
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Optional<BigInteger> parse(String content) {
        if (content.isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c < '0' || c > '9') {
                return Optional.empty();
            }
        }
        BigInteger value = new BigInteger(content);
        return value.compareTo(MAX_VALUE) > 0 ? Optional.empty() : Optional.of(value);
    }

    private static String abbreviate(String content) {
        return content.length() <= 32 ? content : content.substring(0, 32) + "...";
    }
}
