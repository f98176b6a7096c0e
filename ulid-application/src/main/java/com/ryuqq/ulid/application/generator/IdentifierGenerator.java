package com.ryuqq.ulid.application.generator;

import com.ryuqq.ulid.core.model.Identifier;
import com.ryuqq.ulid.core.model.ShortUlid;
import com.ryuqq.ulid.core.model.Slid;
import com.ryuqq.ulid.core.model.Ulid;
import com.ryuqq.ulid.core.strategy.StrategyKind;

/**
 * 식별자 생성기.
 *
 * <p>전략별 상태(카운터, seed, 영속 카운터)를 소유하고 식별자를 발급합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (IdentifierGenerator generator = new UlidGenerator()) {
 *     Ulid id = generator.ulid();                              // random
 *     Ulid ordered = generator.ulid(StrategyKind.RUNTIME_LEXICAL);
 *     Slid compact = generator.slid();
 * }
 * </pre>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public interface IdentifierGenerator extends AutoCloseable {

    /**
     * 기본 전략(random)으로 Ulid 발급.
     *
     * @return 새 Ulid
     */
    Ulid ulid();

    /**
     * 지정한 전략으로 Ulid 발급.
     *
     * @param kind Ulid 포맷 전략 (RANDOM, RUNTIME_LEXICAL, LOCAL_LEXICAL, ENV_LEXICAL, THREAD_ENV_LEXICAL)
     * @return 새 Ulid
     * @throws IllegalArgumentException kind가 Ulid 포맷이 아닌 경우
     */
    Ulid ulid(StrategyKind kind);

    /**
     * short_env_lexical 전략으로 ShortUlid 발급.
     *
     * @return 새 ShortUlid
     */
    ShortUlid shortUlid();

    /**
     * slid 전략으로 Slid 발급.
     *
     * @return 새 Slid
     */
    Slid slid();

    /**
     * 전략의 포맷에 맞는 식별자 발급.
     *
     * @param kind 전략
     * @return Ulid, ShortUlid 또는 Slid
     */
    Identifier<?> generate(StrategyKind kind);

    /**
     * 영속 카운터를 반납하고 생성기를 닫음 (멱등).
     *
     * <p>닫힌 뒤의 발급 요청은 {@link IllegalStateException}을 던집니다.</p>
     *
     * @throws java.io.UncheckedIOException 카운터 저장 실패 시
     */
    @Override
    void close();
}
