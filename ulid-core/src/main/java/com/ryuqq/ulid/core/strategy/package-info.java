/**
 * randomness 생성 전략과 식별자 조립.
 *
 * <p>{@link com.ryuqq.ulid.core.strategy.StrategyKind}가 전략별 비트 레이아웃을 정의하고,
 * {@link com.ryuqq.ulid.core.strategy.IdentifierAssembler}가 타임스탬프와 결합합니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
package com.ryuqq.ulid.core.strategy;
