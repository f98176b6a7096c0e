package com.ryuqq.ulid.application.generator;

import com.ryuqq.ulid.adapter.file.FileCounterStore;
import com.ryuqq.ulid.adapter.file.FileCounterStoreConfig;
import com.ryuqq.ulid.core.model.Ulid;
import com.ryuqq.ulid.core.strategy.SeedRegistry;
import com.ryuqq.ulid.core.strategy.StrategyKind;
import com.ryuqq.ulid.testkit.source.ManualTimeSource;
import com.ryuqq.ulid.testkit.source.SequenceEntropySource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 파일 카운터 저장소와 연결한 재시작 시나리오 테스트.
 *
 * @author ULID Team
 * @since 1.0.0
 */
class FileBackedGeneratorTest {

    @TempDir
    Path directory;

    @Test
    void 재시작해도_local_lexical_값이_정렬_순서를_유지() throws Exception {
        // given
        Path file = directory.resolve("counter");
        ManualTimeSource clock = new ManualTimeSource(Instant.parse("2024-06-01T12:00:00Z"));
        SeedRegistry seeds = new SeedRegistry(new SequenceEntropySource(3));

        Ulid lastOfFirstRun;
        try (UlidGenerator firstRun = new UlidGenerator(clock, SequenceEntropySource.counting(),
                new FileCounterStore(new FileCounterStoreConfig(file)), seeds, new GeneratorConfig())) {
            firstRun.ulid(StrategyKind.LOCAL_LEXICAL);
            lastOfFirstRun = firstRun.ulid(StrategyKind.LOCAL_LEXICAL);
        }

        // when: 같은 밀리초에 새 프로세스가 시작된 상황
        Ulid firstOfSecondRun;
        try (UlidGenerator secondRun = new UlidGenerator(clock, SequenceEntropySource.counting(),
                new FileCounterStore(new FileCounterStoreConfig(file)), seeds, new GeneratorConfig())) {
            firstOfSecondRun = secondRun.ulid(StrategyKind.LOCAL_LEXICAL);
        }

        // then
        assertThat(firstOfSecondRun).isGreaterThan(lastOfFirstRun);
        assertThat(firstOfSecondRun.randomness()).isEqualTo(BigInteger.TWO);
        assertThat(Files.readString(file, StandardCharsets.UTF_8).strip()).isEqualTo("2");
    }
}
