package com.ryuqq.ulid.testkit.source;

import com.ryuqq.ulid.core.spi.TimeSource;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테스트용 수동 시계.
 *
 * <p>명시적으로 {@link #advance(long)} 또는 {@link #set(long)}을 호출하기 전까지
 * 같은 값을 반환합니다. 범위 검증을 하지 않으므로 음수나 48비트 초과 값도 설정할 수 있습니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class ManualTimeSource implements TimeSource {

    private final AtomicLong millis;

    public ManualTimeSource(long initialMillis) {
        this.millis = new AtomicLong(initialMillis);
    }

    public ManualTimeSource(Instant initial) {
        this(initial.toEpochMilli());
    }

    @Override
    public long currentTimeMillis() {
        return millis.get();
    }

    public void set(long epochMillis) {
        millis.set(epochMillis);
    }

    public long advance(long deltaMillis) {
        return millis.addAndGet(deltaMillis);
    }

    public long advance(Duration duration) {
        return advance(duration.toMillis());
    }
}
