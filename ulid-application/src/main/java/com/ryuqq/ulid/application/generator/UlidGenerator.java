package com.ryuqq.ulid.application.generator;

import com.ryuqq.ulid.core.exception.FatalInitializationException;
import com.ryuqq.ulid.core.integrity.IntegrityChecker;
import com.ryuqq.ulid.core.integrity.IntegrityReport;
import com.ryuqq.ulid.core.model.Identifier;
import com.ryuqq.ulid.core.model.IdentifierFormat;
import com.ryuqq.ulid.core.model.ShortUlid;
import com.ryuqq.ulid.core.model.Slid;
import com.ryuqq.ulid.core.model.Ulid;
import com.ryuqq.ulid.core.source.SecureRandomEntropySource;
import com.ryuqq.ulid.core.source.SystemTimeSource;
import com.ryuqq.ulid.core.spi.CounterStore;
import com.ryuqq.ulid.core.spi.EntropySource;
import com.ryuqq.ulid.core.spi.TimeSource;
import com.ryuqq.ulid.core.spi.noop.NoOpCounterStore;
import com.ryuqq.ulid.core.strategy.EnvLexicalStrategy;
import com.ryuqq.ulid.core.strategy.IdentifierAssembler;
import com.ryuqq.ulid.core.strategy.LocalLexicalStrategy;
import com.ryuqq.ulid.core.strategy.RandomStrategy;
import com.ryuqq.ulid.core.strategy.RandomnessStrategy;
import com.ryuqq.ulid.core.strategy.RuntimeLexicalStrategy;
import com.ryuqq.ulid.core.strategy.SeedRegistry;
import com.ryuqq.ulid.core.strategy.ShortEnvLexicalStrategy;
import com.ryuqq.ulid.core.strategy.SlidStrategy;
import com.ryuqq.ulid.core.strategy.StrategyKind;
import com.ryuqq.ulid.core.strategy.ThreadEnvLexicalStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * 기본 {@link IdentifierGenerator} 구현.
 *
 * <p><strong>초기화 순서:</strong></p>
 * <ol>
 *   <li>systemChecks가 true면 무결성 검사 실행. 실패 시 검사별 WARN, 요약 ERROR를 한 번 남기고
 *       {@link FatalInitializationException}을 던짐 (생성기 자체가 만들어지지 않음)</li>
 *   <li>메모리 기반 전략 생성</li>
 *   <li>registerShutdownHook이 true면 종료 훅 등록</li>
 * </ol>
 *
 * <p><strong>영속 카운터:</strong> local_lexical은 처음 요청될 때 CounterStore에서 값을 읽고(acquire),
 * {@link #close()} 또는 종료 훅에서 기록합니다(release). 한 번도 쓰지 않으면 저장소에 접근하지 않습니다.</p>
 *
 * <p><strong>카운터 범위:</strong> local_lexical을 제외한 카운터는 {@link SeedRegistry}가 보관합니다.
 * 같은 레지스트리를 받은 생성기들은 seed와 카운터를 함께 공유하므로, 한 프로세스에 생성기가 여럿 있어도
 * 같은 밀리초에 같은 값을 발급하지 않습니다. 기본 생성자들은 {@link SeedRegistry#processWide()}를 씁니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>random, thread_env_lexical: 여러 스레드에서 안전</li>
 *   <li>runtime_lexical, local_lexical, env_lexical, short_env_lexical, slid: 카운터를 동기화하지 않음.
 *       여러 스레드가 같은 전략을 쓰면 값이 중복될 수 있음</li>
 * </ul>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public class UlidGenerator implements IdentifierGenerator {

    private static final Logger log = LoggerFactory.getLogger(UlidGenerator.class);

    private final IdentifierAssembler assembler;
    private final CounterStore counterStore;
    private final Map<StrategyKind, RandomnessStrategy> strategies = new EnumMap<>(StrategyKind.class);
    private final Object lifecycleLock = new Object();
    private final Thread shutdownHook;

    private volatile LocalLexicalStrategy localStrategy;
    private volatile boolean closed;

    /**
     * 시스템 시계, SecureRandom, 비영속 카운터, 기본 설정으로 생성.
     *
     * @throws FatalInitializationException 무결성 검사 실패 시
     */
    public UlidGenerator() {
        this(NoOpCounterStore.INSTANCE, new GeneratorConfig());
    }

    /**
     * 영속 카운터 저장소와 설정으로 생성 (시스템 시계, SecureRandom, 프로세스 전역 seed).
     *
     * @param counterStore local_lexical 카운터 저장소
     * @param config 생성기 설정
     * @throws FatalInitializationException 무결성 검사 실패 시
     */
    public UlidGenerator(CounterStore counterStore, GeneratorConfig config) {
        this(new SystemTimeSource(), new SecureRandomEntropySource(), counterStore, SeedRegistry.processWide(), config);
    }

    /**
     * 모든 협력 객체를 주입해 생성.
     *
     * @param timeSource 시간 소스
     * @param entropySource 엔트로피 소스 (random 전략과 무결성 검사에 사용)
     * @param counterStore local_lexical 카운터 저장소
     * @param seeds seed 레지스트리
     * @param config 생성기 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     * @throws FatalInitializationException 무결성 검사 실패 시
     */
    public UlidGenerator(TimeSource timeSource, EntropySource entropySource, CounterStore counterStore,
                         SeedRegistry seeds, GeneratorConfig config) {
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (entropySource == null) {
            throw new IllegalArgumentException("entropySource cannot be null");
        }
        if (counterStore == null) {
            throw new IllegalArgumentException("counterStore cannot be null");
        }
        if (seeds == null) {
            throw new IllegalArgumentException("seeds cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        if (config.systemChecks()) {
            runSystemChecks(IntegrityChecker.defaults(timeSource, entropySource));
        } else {
            log.info("System checks disabled by configuration");
        }

        this.assembler = new IdentifierAssembler(timeSource);
        this.counterStore = counterStore;
        strategies.put(StrategyKind.RANDOM, new RandomStrategy(entropySource));
        strategies.put(StrategyKind.RUNTIME_LEXICAL, new RuntimeLexicalStrategy(seeds));
        strategies.put(StrategyKind.ENV_LEXICAL, new EnvLexicalStrategy(seeds));
        strategies.put(StrategyKind.THREAD_ENV_LEXICAL, new ThreadEnvLexicalStrategy(seeds));
        strategies.put(StrategyKind.SHORT_ENV_LEXICAL, new ShortEnvLexicalStrategy(seeds));
        strategies.put(StrategyKind.SLID, new SlidStrategy(seeds));

        if (config.registerShutdownHook()) {
            this.shutdownHook = new Thread(this::release, "ulid-counter-release");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            log.debug("Registered shutdown hook to release the local counter");
        } else {
            this.shutdownHook = null;
        }
    }

    private static void runSystemChecks(IntegrityChecker checker) {
        IntegrityReport report = checker.run();
        if (report.isOk()) {
            log.info("System checks passed ({} checks)", report.results().size());
            return;
        }
        for (IntegrityReport.Result failure : report.failures()) {
            log.warn("System check '{}' failed: {}", failure.name(), failure.detail());
        }
        log.error("Refusing to generate identifiers: {}", report.summary());
        throw new FatalInitializationException(report.summary(), report);
    }

    @Override
    public Ulid ulid() {
        return ulid(StrategyKind.RANDOM);
    }

    @Override
    public Ulid ulid(StrategyKind kind) {
        return assembler.ulid(strategyFor(kind, IdentifierFormat.ULID));
    }

    @Override
    public ShortUlid shortUlid() {
        return assembler.shortUlid(strategyFor(StrategyKind.SHORT_ENV_LEXICAL, IdentifierFormat.SHORT_ULID));
    }

    @Override
    public Slid slid() {
        return assembler.slid(strategyFor(StrategyKind.SLID, IdentifierFormat.SLID));
    }

    @Override
    public Identifier<?> generate(StrategyKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return assembler.construct(strategyFor(kind, kind.format()));
    }

    /**
     * 생성기가 닫혔는지 확인.
     *
     * @return close 이후 true
     */
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (shutdownHook != null && !closed) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("JVM is shutting down, the shutdown hook releases the local counter");
            }
        }
        release();
    }

    private RandomnessStrategy strategyFor(StrategyKind kind, IdentifierFormat expected) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind.format() != expected) {
            throw new IllegalArgumentException(
                kind + " produces " + kind.format().displayName() + ", not " + expected.displayName()
            );
        }
        if (closed) {
            throw new IllegalStateException("UlidGenerator is closed");
        }
        if (kind == StrategyKind.LOCAL_LEXICAL) {
            return acquireLocal();
        }
        return strategies.get(kind);
    }

    private LocalLexicalStrategy acquireLocal() {
        LocalLexicalStrategy local = localStrategy;
        if (local != null) {
            return local;
        }
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("UlidGenerator is closed");
            }
            if (localStrategy == null) {
                localStrategy = new LocalLexicalStrategy(counterStore);
                log.info("Acquired local counter (resuming after {})",
                    localStrategy.persistentValue().map(Object::toString).orElse("nothing"));
            }
            return localStrategy;
        }
    }

    private void release() {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            if (localStrategy != null) {
                localStrategy.close();
                log.info("Released local counter at {}",
                    localStrategy.persistentValue().map(Object::toString).orElse("nothing"));
            }
        }
    }
}
