package com.ryuqq.ulid.adapter.file;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileCounterStore 파일 처리 테스트.
 *
 * @author ULID Team
 * @since 1.0.0
 */
class FileCounterStoreTest {

    @TempDir
    Path directory;

    private Path file;
    private FileCounterStore store;
    private ListAppender<ILoggingEvent> appender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        file = directory.resolve("counter");
        store = new FileCounterStore(new FileCounterStoreConfig(file));

        logger = (Logger) LoggerFactory.getLogger(FileCounterStore.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void save_WritesDecimalText() throws Exception {
        // when
        store.save(new BigInteger("1208925819614629174706175"));

        // then
        assertThat(Files.readString(file, StandardCharsets.UTF_8).strip())
            .isEqualTo("1208925819614629174706175");
        try (Stream<Path> entries = Files.list(directory)) {
            assertThat(entries).containsExactly(file);
        }
    }

    @Test
    void load_SurroundingWhitespace_IsIgnored() throws Exception {
        // given
        Files.writeString(file, "  42\n\n", StandardCharsets.UTF_8);

        // when & then
        assertThat(store.load()).contains(BigInteger.valueOf(42));
    }

    @Test
    void load_CorruptContent_WarnsAndReturnsEmpty() throws Exception {
        // given
        Files.writeString(file, "not-a-number", StandardCharsets.UTF_8);

        // when & then
        assertThat(store.load()).isEmpty();
        assertThat(appender.list)
            .anySatisfy(event -> {
                assertThat(event.getLevel()).isEqualTo(Level.WARN);
                assertThat(event.getFormattedMessage()).contains("not-a-number");
            });
    }

    @Test
    void load_ValueBeyond80Bits_ReturnsEmpty() throws Exception {
        // given
        Files.writeString(file, BigInteger.ONE.shiftLeft(80).toString(), StandardCharsets.UTF_8);

        // when & then
        assertThat(store.load()).isEmpty();
    }

    @Test
    void load_NegativeOrEmptyContent_ReturnsEmpty() throws Exception {
        Files.writeString(file, "-3", StandardCharsets.UTF_8);
        assertThat(store.load()).isEmpty();

        Files.writeString(file, "", StandardCharsets.UTF_8);
        assertThat(store.load()).isEmpty();
    }

    @Test
    void save_MissingParentDirectories_AreCreated() {
        // given
        Path nested = directory.resolve("a").resolve("b").resolve("counter");
        FileCounterStore nestedStore = new FileCounterStore(new FileCounterStoreConfig(nested));

        // when
        nestedStore.save(BigInteger.TEN);

        // then
        assertThat(nested).exists();
        assertThat(nestedStore.load()).contains(BigInteger.TEN);
    }

    @Test
    void load_PathIsDirectory_ThrowsUncheckedIOException() throws Exception {
        // given
        Files.createDirectories(file);

        // when & then
        assertThatThrownBy(() -> store.load())
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining(file.getFileName().toString());
    }

    @Test
    void path_IsAbsolute() {
        assertThat(new FileCounterStore(new FileCounterStoreConfig(Path.of("relative-counter"))).path())
            .isAbsolute();
    }
}
