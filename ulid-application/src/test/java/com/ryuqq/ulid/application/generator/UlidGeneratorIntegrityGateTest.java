package com.ryuqq.ulid.application.generator;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.ryuqq.ulid.core.exception.FatalInitializationException;
import com.ryuqq.ulid.core.integrity.IntegrityReport;
import com.ryuqq.ulid.core.spi.EntropySource;
import com.ryuqq.ulid.core.spi.TimeSource;
import com.ryuqq.ulid.core.spi.noop.NoOpCounterStore;
import com.ryuqq.ulid.core.strategy.SeedRegistry;
import com.ryuqq.ulid.testkit.source.ManualTimeSource;
import com.ryuqq.ulid.testkit.source.SequenceEntropySource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * UlidGenerator 무결성 검사 게이트 테스트.
 *
 * <ul>
 *   <li>검사 통과 시 INFO 한 번</li>
 *   <li>실패 시 검사별 WARN + ERROR 한 번, FatalInitializationException</li>
 *   <li>systemChecks=false면 검사하지 않음</li>
 * </ul>
 *
 * @author ULID Team
 * @since 1.0.0
 */
class UlidGeneratorIntegrityGateTest {

    private static final Instant HEALTHY = Instant.parse("2024-06-01T12:00:00Z");
    private static final Instant STALE = Instant.parse("2001-01-01T00:00:00Z");

    private final SeedRegistry seeds = new SeedRegistry(new SequenceEntropySource(1));

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(UlidGenerator.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    private UlidGenerator create(TimeSource clock, EntropySource entropy, boolean systemChecks) {
        return new UlidGenerator(clock, entropy, NoOpCounterStore.INSTANCE, seeds,
            new GeneratorConfig().withSystemChecks(systemChecks));
    }

    @Test
    void 검사_통과시_INFO_한_번_남기고_생성됨() {
        // when
        UlidGenerator generator = create(new ManualTimeSource(HEALTHY), SequenceEntropySource.counting(), true);

        // then
        assertThat(generator.ulid().instant()).isEqualTo(HEALTHY);
        assertThat(events(Level.INFO)).containsExactly("System checks passed (6 checks)");
        assertThat(events(Level.ERROR)).isEmpty();
    }

    @Test
    void 시계가_과거면_생성_거부() {
        // when
        FatalInitializationException exception = catchThrowableOfType(
            () -> create(new ManualTimeSource(STALE), SequenceEntropySource.counting(), true),
            FatalInitializationException.class
        );

        // then
        assertThat(exception).isNotNull();
        assertThat(exception.getReport().failures())
            .extracting(IntegrityReport.Result::name)
            .containsExactly("clock-range");
        assertThat(events(Level.WARN)).hasSize(1).allMatch(message -> message.contains("clock-range"));
        assertThat(events(Level.ERROR)).hasSize(1);
    }

    @Test
    void 여러_검사가_실패해도_ERROR는_한_번() {
        // given: 고정 바이트 엔트로피 + 과거 시계
        EntropySource stuck = new SequenceEntropySource(7);

        // when & then
        assertThatThrownBy(() -> create(new ManualTimeSource(STALE), stuck, true))
            .isInstanceOf(FatalInitializationException.class);

        assertThat(events(Level.WARN)).hasSize(2);
        assertThat(events(Level.ERROR)).hasSize(1)
            .allMatch(message -> message.contains("2 of 6"));
    }

    @Test
    void systemChecks가_false면_검사하지_않음() {
        // when
        UlidGenerator generator = create(new ManualTimeSource(STALE), new SequenceEntropySource(7), false);

        // then
        assertThat(generator.ulid().instant()).isEqualTo(STALE);
        assertThat(events(Level.WARN)).isEmpty();
        assertThat(events(Level.INFO)).containsExactly("System checks disabled by configuration");
    }

    @Test
    void 검사를_꺼도_48비트를_넘는_시계는_발급_시점에_거부() {
        // given
        UlidGenerator generator = create(new ManualTimeSource(1L << 48), SequenceEntropySource.counting(), false);

        // when & then
        assertThatThrownBy(generator::ulid).isInstanceOf(FatalInitializationException.class);
    }

    private List<String> events(Level level) {
        return appender.list.stream()
            .filter(event -> event.getLevel() == level)
            .map(ILoggingEvent::getFormattedMessage)
            .collect(Collectors.toList());
    }
}
