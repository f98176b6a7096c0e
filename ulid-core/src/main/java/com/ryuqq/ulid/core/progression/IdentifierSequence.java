package com.ryuqq.ulid.core.progression;

import com.ryuqq.ulid.core.model.Identifier;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * 유한 식별자 시퀀스 (지연 평가).
 *
 * <p>시작 식별자를 포착할 뿐 원본을 변경하지 않으며,
 * {@link #iterator()}를 다시 호출하면 같은 시퀀스를 처음부터 재생합니다.</p>
 *
 * <p><strong>예시 (count=3):</strong></p>
 * <ul>
 *   <li>정방향: id, id+1, id+2</li>
 *   <li>역방향: id, id-1, id-2</li>
 * </ul>
 *
 * <p>각 단계는 {@link Progression}의 wrap 규칙을 따릅니다.</p>
 *
 * @param <T> 식별자 타입
 * @author ULID Team
 * @since 1.0.0
 */
public final class IdentifierSequence<T extends Identifier<T>> implements Iterable<T> {

    private final T start;
    private final long count;
    private final boolean descending;

    IdentifierSequence(T start, long count, boolean descending) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
        }
        this.start = start;
        this.count = count;
        this.descending = descending;
    }

    /**
     * 같은 시작점에서 -1씩 감소하는 시퀀스.
     *
     * @return 방향이 반대인 새 시퀀스
     */
    public IdentifierSequence<T> reversed() {
        return new IdentifierSequence<>(start, count, !descending);
    }

    public T start() {
        return start;
    }

    public long size() {
        return count;
    }

    public boolean isDescending() {
        return descending;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private T current = start;
            private long emitted;

            @Override
            public boolean hasNext() {
                return emitted < count;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T result = current;
                emitted++;
                if (emitted < count) {
                    current = descending ? current.previous() : current.next();
                }
                return result;
            }
        };
    }

    /**
     * 순차 스트림으로 변환.
     *
     * @return count개 원소를 갖는 스트림
     */
    public Stream<T> stream() {
        return Stream.iterate(start, id -> descending ? id.previous() : id.next()).limit(count);
    }
}
