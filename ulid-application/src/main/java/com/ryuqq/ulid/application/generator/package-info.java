/**
 * 식별자 생성 파사드.
 *
 * <p>{@link com.ryuqq.ulid.application.generator.UlidGenerator}가 무결성 검사,
 * 전략 생성, 영속 카운터 생명주기를 묶어 제공합니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
package com.ryuqq.ulid.application.generator;
