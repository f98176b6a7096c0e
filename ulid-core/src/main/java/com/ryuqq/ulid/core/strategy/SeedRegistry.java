package com.ryuqq.ulid.core.strategy;

import com.ryuqq.ulid.core.source.SecureRandomEntropySource;
import com.ryuqq.ulid.core.spi.EntropySource;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 프로세스/스레드 단위 일회성 seed(prime)와 카운터 레지스트리.
 *
 * <p><strong>프로세스 seed:</strong> 생성 시점에 EntropySource에서 1바이트를 한 번 읽어
 * 캐시합니다. 이후 불변이므로 여러 스레드가 동시에 읽어도 안전합니다.
 * short_env 전략은 이 바이트의 상위 4비트를 사용합니다.</p>
 *
 * <p><strong>스레드 seed:</strong> 처음 조회한 스레드부터 순서대로 0, 1, 2, ... 를 부여하고
 * 256으로 나눈 나머지를 사용합니다. 같은 스레드는 수명 동안 같은 값을 받습니다.
 * 256개를 초과하는 스레드가 동시에 실행되면 seed가 겹칠 수 있습니다.</p>
 *
 * <p><strong>카운터:</strong> 카운터는 seed와 같은 범위에 둡니다. runtime_lexical, env_lexical,
 * short_env_lexical, slid 카운터는 레지스트리당 하나씩(프로세스 범위), thread_env_lexical 카운터는
 * 스레드당 하나씩 보관합니다. 같은 레지스트리로 만든 전략들은 카운터를 공유하므로, 생성기를 여러 개
 * 만들어도 같은 seed와 같은 카운터 값이 두 번 발급되지 않습니다. local_lexical 카운터는 저장소에서
 * 읽어 오므로 여기에 두지 않습니다.</p>
 *
 * <p>seed와 카운터는 영속화되지 않습니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class SeedRegistry {

    private static final StrategyKind[] PROCESS_SCOPED = {
        StrategyKind.RUNTIME_LEXICAL,
        StrategyKind.ENV_LEXICAL,
        StrategyKind.SHORT_ENV_LEXICAL,
        StrategyKind.SLID
    };

    private final int processSeed;
    private final AtomicInteger threadSequence = new AtomicInteger();
    private final ThreadLocal<Integer> threadSeed =
        ThreadLocal.withInitial(() -> threadSequence.getAndIncrement() & 0xFF);
    private final Map<StrategyKind, MonotonicCounter> processCounters = new EnumMap<>(StrategyKind.class);
    private final ThreadLocal<MonotonicCounter> threadCounter =
        ThreadLocal.withInitial(() -> new MonotonicCounter(StrategyKind.THREAD_ENV_LEXICAL.counterBits()));

    /**
     * 생성 (프로세스 seed를 즉시 읽음).
     *
     * @param entropySource seed를 읽을 엔트로피 소스
     * @throws IllegalArgumentException entropySource가 null인 경우
     */
    public SeedRegistry(EntropySource entropySource) {
        if (entropySource == null) {
            throw new IllegalArgumentException("entropySource cannot be null");
        }
        this.processSeed = entropySource.nextBytes(1)[0] & 0xFF;
        for (StrategyKind kind : PROCESS_SCOPED) {
            processCounters.put(kind, new MonotonicCounter(kind.counterBits()));
        }
    }

    /**
     * 프로세스 전역 레지스트리.
     *
     * <p>최초 접근 시 {@link SecureRandomEntropySource}로 한 번 초기화됩니다.</p>
     *
     * @return JVM 당 하나인 레지스트리
     */
    public static SeedRegistry processWide() {
        return Holder.INSTANCE;
    }

    /**
     * 프로세스 seed 바이트.
     *
     * @return 0 ~ 255
     */
    public int processSeed() {
        return processSeed;
    }

    /**
     * 프로세스 seed 니블 (seed 바이트의 상위 4비트).
     *
     * @return 0 ~ 15
     */
    public int processSeedNibble() {
        return processSeed >>> 4;
    }

    /**
     * 호출 스레드의 seed.
     *
     * @return 0 ~ 255
     */
    public int threadSeed() {
        return threadSeed.get();
    }

    /**
     * 프로세스 범위 카운터.
     *
     * <p>같은 kind에 대해 항상 같은 인스턴스를 반환합니다. 동기화하지 않습니다.</p>
     *
     * @param kind runtime_lexical, env_lexical, short_env_lexical, slid 중 하나
     * @return kind의 counterBits 폭을 가진 공유 카운터
     * @throws IllegalArgumentException kind가 null이거나 프로세스 범위 카운터가 없는 경우
     */
    public MonotonicCounter processCounter(StrategyKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        MonotonicCounter counter = processCounters.get(kind);
        if (counter == null) {
            throw new IllegalArgumentException("No process-scoped counter for " + kind);
        }
        return counter;
    }

    /**
     * 호출 스레드의 thread_env_lexical 카운터.
     *
     * @return 스레드마다 독립된 72비트 카운터
     */
    public MonotonicCounter threadCounter() {
        return threadCounter.get();
    }

    private static final class Holder {
        private static final SeedRegistry INSTANCE = new SeedRegistry(new SecureRandomEntropySource());
    }
}
