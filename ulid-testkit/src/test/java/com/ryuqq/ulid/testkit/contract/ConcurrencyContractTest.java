package com.ryuqq.ulid.testkit.contract;

import com.ryuqq.ulid.core.model.Ulid;
import com.ryuqq.ulid.core.strategy.IdentifierAssembler;
import com.ryuqq.ulid.core.strategy.MonotonicCounter;
import com.ryuqq.ulid.core.strategy.RuntimeLexicalStrategy;
import com.ryuqq.ulid.core.strategy.SeedRegistry;
import com.ryuqq.ulid.core.strategy.StrategyKind;
import com.ryuqq.ulid.core.strategy.ThreadEnvLexicalStrategy;
import com.ryuqq.ulid.testkit.source.ManualTimeSource;
import com.ryuqq.ulid.testkit.source.SequenceEntropySource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 동시성 토폴로지별 유일성.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>thread_env: 스레드마다 독립 카운터, 같은 밀리초에서도 충돌 없음</li>
 *   <li>thread_env: 스레드 내 엄격 증가</li>
 *   <li>runtime + synchronized counter: 공유해도 충돌 없음</li>
 * </ul>
 *
 * @author ULID Team
 * @since 1.0.0
 */
class ConcurrencyContractTest {

    private static final int THREADS = 8;
    private static final int PER_THREAD = 500;

    private final IdentifierAssembler assembler = new IdentifierAssembler(new ManualTimeSource(1_700_000_000_000L));

    @Test
    void testThreadEnvLexical_ConcurrentThreads_NoCollisions() throws Exception {
        // Given
        ThreadEnvLexicalStrategy strategy = new ThreadEnvLexicalStrategy(new SeedRegistry(new SequenceEntropySource(0)));
        Set<Ulid> seen = ConcurrentHashMap.newKeySet();
        Set<Integer> primes = ConcurrentHashMap.newKeySet();

        // When
        List<List<Ulid>> perThread = runConcurrently(() -> assembler.ulid(strategy));
        perThread.forEach(seen::addAll);
        perThread.forEach(ids -> primes.add(StrategyKind.THREAD_ENV_LEXICAL.primeOf(ids.get(0)).getAsInt()));

        // Then
        assertEquals(THREADS * PER_THREAD, seen.size());
        assertEquals(THREADS, primes.size());
        for (List<Ulid> ids : perThread) {
            for (int i = 1; i < ids.size(); i++) {
                assertTrue(ids.get(i - 1).compareTo(ids.get(i)) < 0);
            }
        }
    }

    @Test
    void testRuntimeLexical_SynchronizedCounter_NoCollisions() throws Exception {
        // Given
        RuntimeLexicalStrategy strategy = new RuntimeLexicalStrategy(MonotonicCounter.synchronizedCounter(80));
        Set<Ulid> seen = ConcurrentHashMap.newKeySet();

        // When
        runConcurrently(() -> assembler.ulid(strategy)).forEach(seen::addAll);

        // Then
        assertEquals(THREADS * PER_THREAD, seen.size());
    }

    private List<List<Ulid>> runConcurrently(java.util.function.Supplier<Ulid> generator) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Ulid>>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < THREADS; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    List<Ulid> ids = new ArrayList<>(PER_THREAD);
                    for (int i = 0; i < PER_THREAD; i++) {
                        ids.add(generator.get());
                    }
                    return ids;
                }));
            }
            start.countDown();
            List<List<Ulid>> results = new ArrayList<>();
            for (Future<List<Ulid>> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
