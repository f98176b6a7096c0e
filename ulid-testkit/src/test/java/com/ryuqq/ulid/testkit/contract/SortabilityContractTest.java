package com.ryuqq.ulid.testkit.contract;

import com.ryuqq.ulid.core.model.Identifier;
import com.ryuqq.ulid.core.model.Ulid;
import com.ryuqq.ulid.core.strategy.EnvLexicalStrategy;
import com.ryuqq.ulid.core.strategy.IdentifierAssembler;
import com.ryuqq.ulid.core.strategy.RandomStrategy;
import com.ryuqq.ulid.core.strategy.RandomnessStrategy;
import com.ryuqq.ulid.core.strategy.RuntimeLexicalStrategy;
import com.ryuqq.ulid.core.strategy.SeedRegistry;
import com.ryuqq.ulid.core.strategy.ShortEnvLexicalStrategy;
import com.ryuqq.ulid.core.strategy.SlidStrategy;
import com.ryuqq.ulid.core.strategy.StrategyKind;
import com.ryuqq.ulid.testkit.source.ManualTimeSource;
import com.ryuqq.ulid.testkit.source.SequenceEntropySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 정렬성 (Sortability).
 *
 * <p>같은 밀리초 안에서는 카운터 기반 전략이 발급 순서대로 정렬되고,
 * 밀리초가 바뀌면 모든 전략이 시간 순으로 정렬되는지 검증합니다.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>runtime/env/slid: 같은 밀리초 내 엄격 증가</li>
 *   <li>random: 밀리초가 다르면 시간 순</li>
 *   <li>문자열 정렬 = 값 정렬</li>
 *   <li>short_env: 16회 발급 후 카운터 니블이 원래 값으로 돌아오고 seed는 유지</li>
 * </ul>
 *
 * @author ULID Team
 * @since 1.0.0
 */
class SortabilityContractTest {

    private static final long NOW = 1_717_171_717_171L;

    private ManualTimeSource clock;
    private IdentifierAssembler assembler;
    private SeedRegistry seeds;

    @BeforeEach
    void setUp() {
        clock = new ManualTimeSource(NOW);
        assembler = new IdentifierAssembler(clock);
        seeds = new SeedRegistry(new SequenceEntropySource(0xB4));
    }

    @Test
    void testLexicalStrategies_SameMillisecond_StrictlyIncreasing() {
        List<RandomnessStrategy> strategies = List.of(
            new RuntimeLexicalStrategy(seeds),
            new EnvLexicalStrategy(seeds),
            new SlidStrategy(seeds)
        );

        for (RandomnessStrategy strategy : strategies) {
            // When
            List<Identifier<?>> ids = generate(strategy, 100);

            // Then
            assertStrictlyIncreasing(ids, strategy.kind());
        }
    }

    @Test
    void testRandomStrategy_AcrossMilliseconds_OrderedByTime() {
        // Given
        RandomStrategy strategy = new RandomStrategy(SequenceEntropySource.counting());
        List<Ulid> ids = new ArrayList<>();

        // When
        for (int i = 0; i < 50; i++) {
            ids.add(assembler.ulid(strategy));
            clock.advance(1);
        }

        // Then
        for (int i = 1; i < ids.size(); i++) {
            assertTrue(ids.get(i - 1).compareTo(ids.get(i)) < 0);
            assertTrue(ids.get(i - 1).toString().compareTo(ids.get(i).toString()) < 0);
        }
    }

    @Test
    void testShortEnvLexical_SixteenConstructions_CounterNibbleWraps() {
        // Given
        ShortEnvLexicalStrategy strategy = new ShortEnvLexicalStrategy(seeds);
        Identifier<?> first = assembler.construct(strategy);

        // When
        List<Identifier<?>> following = generate(strategy, 16);

        // Then: seed는 16회 모두 동일
        int seed = StrategyKind.SHORT_ENV_LEXICAL.primeOf(first).getAsInt();
        assertEquals(0xB, seed);
        for (Identifier<?> id : following) {
            assertEquals(seed, StrategyKind.SHORT_ENV_LEXICAL.primeOf(id).getAsInt());
        }
        // Then: 16번째 이후 카운터가 처음 값으로 복귀
        Identifier<?> wrapped = following.get(15);
        assertEquals(StrategyKind.SHORT_ENV_LEXICAL.counterOf(first), StrategyKind.SHORT_ENV_LEXICAL.counterOf(wrapped));
        assertEquals(first, wrapped);
    }

    @Test
    void testClockStepsBackward_OrderIsNotGuaranteed() {
        // Given
        RuntimeLexicalStrategy strategy = new RuntimeLexicalStrategy(seeds);
        Ulid before = assembler.ulid(strategy);

        // When: 시계가 뒤로 이동
        clock.advance(-1);
        Ulid after = assembler.ulid(strategy);

        // Then: timestamp가 우선하므로 나중에 발급한 값이 더 작음
        assertTrue(after.compareTo(before) < 0);
    }

    private List<Identifier<?>> generate(RandomnessStrategy strategy, int count) {
        List<Identifier<?>> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ids.add(assembler.construct(strategy));
        }
        return ids;
    }

    private static void assertStrictlyIncreasing(List<Identifier<?>> ids, StrategyKind kind) {
        for (int i = 1; i < ids.size(); i++) {
            Identifier<?> previous = ids.get(i - 1);
            Identifier<?> current = ids.get(i);
            assertTrue(previous.toBigInteger().compareTo(current.toBigInteger()) < 0,
                kind + ": " + previous + " should sort before " + current);
        }
    }
}
