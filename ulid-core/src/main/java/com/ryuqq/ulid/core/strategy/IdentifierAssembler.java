package com.ryuqq.ulid.core.strategy;

import com.ryuqq.ulid.core.model.Identifier;
import com.ryuqq.ulid.core.model.IdentifierFormat;
import com.ryuqq.ulid.core.model.ShortUlid;
import com.ryuqq.ulid.core.model.Slid;
import com.ryuqq.ulid.core.model.Timestamps;
import com.ryuqq.ulid.core.model.Ulid;
import com.ryuqq.ulid.core.spi.TimeSource;

/**
 * 타임스탬프와 전략이 만든 randomness를 식별자로 조립.
 *
 * <p><strong>순서:</strong></p>
 * <ol>
 *   <li>TimeSource에서 현재 시각(ms)을 읽음</li>
 *   <li>48비트 범위 검증 (벗어나면 {@link com.ryuqq.ulid.core.exception.FatalInitializationException})</li>
 *   <li>전략에서 randomness를 얻음</li>
 *   <li>{@code timestamp << randomnessBits | randomness}로 packing</li>
 * </ol>
 *
 * <p>자체 상태가 없습니다. 스레드 안전성은 전략을 따릅니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class IdentifierAssembler {

    private final TimeSource timeSource;

    public IdentifierAssembler(TimeSource timeSource) {
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.timeSource = timeSource;
    }

    /**
     * 전략의 포맷에 맞는 식별자 생성.
     *
     * @param strategy randomness 전략
     * @return 생성된 식별자 (Ulid, ShortUlid 또는 Slid)
     */
    public Identifier<?> construct(RandomnessStrategy strategy) {
        IdentifierFormat format = requireStrategy(strategy).kind().format();
        return switch (format) {
            case ULID -> ulid(strategy);
            case SHORT_ULID -> shortUlid(strategy);
            case SLID -> slid(strategy);
        };
    }

    public Ulid ulid(RandomnessStrategy strategy) {
        requireFormat(strategy, IdentifierFormat.ULID);
        long timestamp = currentTimestamp();
        return Ulid.of(timestamp, strategy.nextRandomness());
    }

    public ShortUlid shortUlid(RandomnessStrategy strategy) {
        requireFormat(strategy, IdentifierFormat.SHORT_ULID);
        long timestamp = currentTimestamp();
        return ShortUlid.of(timestamp, strategy.nextRandomness());
    }

    public Slid slid(RandomnessStrategy strategy) {
        requireFormat(strategy, IdentifierFormat.SLID);
        long timestamp = currentTimestamp();
        return Slid.of(timestamp, strategy.nextRandomness());
    }

    private long currentTimestamp() {
        return Timestamps.requireClock(timeSource.currentTimeMillis());
    }

    private static RandomnessStrategy requireStrategy(RandomnessStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        return strategy;
    }

    private static void requireFormat(RandomnessStrategy strategy, IdentifierFormat expected) {
        IdentifierFormat actual = requireStrategy(strategy).kind().format();
        if (actual != expected) {
            throw new IllegalArgumentException(
                strategy.kind() + " produces " + actual.displayName()
                    + ", not " + expected.displayName()
            );
        }
    }
}
